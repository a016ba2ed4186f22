package com.careerpilot.backend.chat.capability.tool;

import com.careerpilot.backend.chat.persistence.UserJob;
import com.careerpilot.backend.chat.persistence.UserJobRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;

@Component
public class UserJobsTool {

  private final UserJobRepository userJobRepository;

  public UserJobsTool(UserJobRepository userJobRepository) {
    this.userJobRepository = userJobRepository;
  }

  @Tool(
      name = "retrieve_existing_jobs",
      description = "Returns the jobs previously matched and saved for the current user.")
  public String retrieveExistingJobs(ToolContext toolContext) {
    Optional<String> userId = ToolContextSupport.userId(toolContext);
    if (userId.isEmpty()) {
      return "The user is not identified; no saved jobs are available.";
    }
    List<UserJob> jobs = userJobRepository.findTop20ByUserIdOrderByCreatedAtDesc(userId.get());
    if (jobs.isEmpty()) {
      return "The user has no saved jobs.";
    }
    StringBuilder builder = new StringBuilder();
    for (UserJob job : jobs) {
      builder
          .append("- ")
          .append(job.getJobTitle())
          .append(" at ")
          .append(job.getCompany())
          .append(" (")
          .append(job.getLocation())
          .append("), rating ")
          .append(job.getMatchRating())
          .append("/5, ")
          .append(job.getLink())
          .append('\n');
    }
    return builder.toString().strip();
  }
}
