package com.careerpilot.backend.chat.capability;

import com.careerpilot.backend.chat.capability.tool.ExaSearchTool;
import com.careerpilot.backend.chat.capability.tool.UserJobsTool;
import com.careerpilot.backend.chat.capability.tool.UserResumesTool;
import com.careerpilot.backend.chat.capability.tool.WebsiteScraperTool;
import com.careerpilot.backend.chat.config.CapabilityProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.stereotype.Component;

/** Builds a fresh set of capabilities for every turn. */
@Component
public class CapabilityFactory {

  private final ChatClient chatClient;
  private final CapabilityProperties properties;
  private final ObjectMapper objectMapper;
  private final List<ToolCallback> researcherTools;
  private final List<ToolCallback> tailorTools;
  private final List<ToolCallback> jobMatcherTools;

  public CapabilityFactory(
      ChatClient chatClient,
      CapabilityProperties properties,
      ObjectMapper objectMapper,
      ExaSearchTool exaSearchTool,
      WebsiteScraperTool websiteScraperTool,
      UserJobsTool userJobsTool,
      UserResumesTool userResumesTool) {
    this.chatClient = chatClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.researcherTools = callbacks(exaSearchTool, websiteScraperTool);
    this.tailorTools = callbacks(userJobsTool, userResumesTool);
    this.jobMatcherTools = callbacks(userJobsTool, websiteScraperTool);
  }

  public CapabilityRegistry createRegistry() {
    return new CapabilityRegistry(
        List.of(
            create(CapabilityName.RESEARCHER, properties.getResearcher(), researcherTools, false),
            create(CapabilityName.TAILOR, properties.getTailor(), tailorTools, false),
            create(
                CapabilityName.JOB_MATCHER, properties.getJobMatcher(), jobMatcherTools, true)));
  }

  private Capability create(
      CapabilityName name,
      CapabilityProperties.Capability config,
      List<ToolCallback> tools,
      boolean structuredJobs) {
    return new ChatClientCapability(
        name,
        chatClient,
        config.getSystemPrompt(),
        tools,
        config.getMaxToolCalls(),
        structuredJobs ? objectMapper : null);
  }

  private static List<ToolCallback> callbacks(Object... toolObjects) {
    return List.of(
        MethodToolCallbackProvider.builder().toolObjects(toolObjects).build().getToolCallbacks());
  }
}
