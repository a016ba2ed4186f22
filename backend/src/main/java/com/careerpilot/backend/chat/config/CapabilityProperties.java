package com.careerpilot.backend.chat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "app.chat.capabilities")
public class CapabilityProperties {

  private Capability researcher =
      new Capability(
          """
          You are a research agent. You are given a query and you need to find the most relevant \
          information on a certain company. Use exa_search to search for information on the \
          company and website_scraper to read the company's website. Cite your sources.
          """,
          3);

  private Capability tailor =
      new Capability(
          """
          You are a tailor agent. Given a user query you tailor the user's resume to the job \
          description. Use retrieve_existing_jobs to look up the user's saved jobs and \
          retrieve_existing_resumes to look up the user's resumes.
          """,
          3);

  private Capability jobMatcher =
      new Capability(
          """
          You are a job matching agent. Given a user query you find the most relevant jobs for the \
          user. Use retrieve_existing_jobs to look up known jobs and website_scraper to read job \
          pages. Return the jobs you recommend as a JSON array of objects with the fields \
          job_title, company, location, match_rating (integer 0-5) and link.
          """,
          3);

  public Capability getResearcher() {
    return researcher;
  }

  public void setResearcher(Capability researcher) {
    this.researcher = researcher;
  }

  public Capability getTailor() {
    return tailor;
  }

  public void setTailor(Capability tailor) {
    this.tailor = tailor;
  }

  public Capability getJobMatcher() {
    return jobMatcher;
  }

  public void setJobMatcher(Capability jobMatcher) {
    this.jobMatcher = jobMatcher;
  }

  public static class Capability {

    private String systemPrompt;

    /** Maximum number of tool invocations a single capability call may perform. */
    private int maxToolCalls;

    public Capability() {
      this("", 3);
    }

    public Capability(String systemPrompt, int maxToolCalls) {
      this.systemPrompt = systemPrompt;
      this.maxToolCalls = maxToolCalls;
    }

    public String getSystemPrompt() {
      return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
      if (StringUtils.hasText(systemPrompt)) {
        this.systemPrompt = systemPrompt;
      }
    }

    public int getMaxToolCalls() {
      return maxToolCalls;
    }

    public void setMaxToolCalls(int maxToolCalls) {
      this.maxToolCalls = maxToolCalls;
    }
  }
}
