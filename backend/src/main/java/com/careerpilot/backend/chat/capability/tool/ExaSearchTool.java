package com.careerpilot.backend.chat.capability.tool;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClientException;

@Component
public class ExaSearchTool {

  private static final Logger log = LoggerFactory.getLogger(ExaSearchTool.class);

  private final ExaSearchClient client;

  public ExaSearchTool(ExaSearchClient client) {
    this.client = client;
  }

  @Tool(name = "exa_search", description = "Use Exa Search to find key summary information.")
  public String exaSearch(
      @ToolParam(description = "The query to execute to find key summary information.")
          String query) {
    List<ExaSearchResult> results;
    try {
      results = client.search(query);
    } catch (WebClientException exception) {
      log.warn("Exa search failed for query '{}': {}", query, exception.getMessage());
      return "Search is currently unavailable: " + exception.getMessage();
    }
    if (results.isEmpty()) {
      return "No results found.";
    }
    StringBuilder builder = new StringBuilder();
    for (ExaSearchResult result : results) {
      builder.append("Title: ").append(valueOrDash(result.title())).append('\n');
      builder.append("URL: ").append(valueOrDash(result.url())).append('\n');
      for (String highlight : result.highlights()) {
        builder.append("- ").append(highlight.strip()).append('\n');
      }
      builder.append('\n');
    }
    return builder.toString().strip();
  }

  private static String valueOrDash(String value) {
    return StringUtils.hasText(value) ? value : "-";
  }
}
