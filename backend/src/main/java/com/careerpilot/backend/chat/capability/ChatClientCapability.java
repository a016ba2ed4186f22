package com.careerpilot.backend.chat.capability;

import com.careerpilot.backend.chat.domain.CapabilityResult;
import com.careerpilot.backend.chat.domain.JobRecord;
import com.careerpilot.backend.chat.extraction.JobRecordValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.util.StringUtils;

/**
 * Capability backed by one chat model call with a system prompt and a bounded set of tools. When
 * structured output is enabled the answer is additionally read as a JSON array of job records;
 * every element is validated on its own and invalid elements are dropped.
 */
public class ChatClientCapability implements Capability {

  private static final Logger log = LoggerFactory.getLogger(ChatClientCapability.class);

  private final CapabilityName name;
  private final ChatClient chatClient;
  private final String systemPrompt;
  private final List<ToolCallback> tools;
  private final int maxToolCalls;
  private final ObjectMapper objectMapper;

  /**
   * @param objectMapper reader for structured answers, {@code null} when the capability only
   *     answers in text
   */
  public ChatClientCapability(
      CapabilityName name,
      ChatClient chatClient,
      String systemPrompt,
      List<ToolCallback> tools,
      int maxToolCalls,
      ObjectMapper objectMapper) {
    this.name = name;
    this.chatClient = chatClient;
    this.systemPrompt = systemPrompt != null ? systemPrompt : "";
    this.tools = tools != null ? List.copyOf(tools) : List.of();
    this.maxToolCalls = Math.max(0, maxToolCalls);
    this.objectMapper = objectMapper;
  }

  @Override
  public CapabilityName name() {
    return name;
  }

  @Override
  public CapabilityResult invoke(String request, CapabilityContext context) {
    ToolCallBudget budget = new ToolCallBudget(maxToolCalls);
    List<ToolCallback> boundedTools =
        tools.stream()
            .<ToolCallback>map(tool -> new BoundedToolCallback(tool, budget, name))
            .toList();

    var promptSpec =
        chatClient
            .prompt()
            .system(systemPrompt + "\n\nUser context: " + context.userContext())
            .messages(PromptMessages.toPromptMessages(context.history()))
            .user(StringUtils.hasText(request) ? request : "Continue with the user's request.");
    if (!boundedTools.isEmpty()) {
      promptSpec = promptSpec.toolCallbacks(boundedTools);
    }
    if (StringUtils.hasText(context.userId())) {
      promptSpec =
          promptSpec.toolContext(Map.of(CapabilityContext.TOOL_CONTEXT_USER_ID, context.userId()));
    }

    String content = promptSpec.call().content();
    if (log.isDebugEnabled()) {
      log.debug(
          "Capability {} answered after {} tool call(s): {}", name.code(), budget.used(), content);
    }
    return new CapabilityResult(content, readStructured(content));
  }

  private List<JobRecord> readStructured(String content) {
    if (objectMapper == null || !StringUtils.hasText(content)) {
      return null;
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(content));
    } catch (JsonProcessingException exception) {
      log.debug("Capability {} answer is not a job list: {}", name.code(), exception.getMessage());
      return null;
    }
    if (root == null || !root.isArray()) {
      return null;
    }
    List<JobRecord> records = new ArrayList<>(root.size());
    for (JsonNode element : root) {
      Optional<JobRecord> record = JobRecordValidator.fromNode(element);
      record.ifPresent(records::add);
    }
    if (records.size() < root.size()) {
      log.debug(
          "Capability {} returned {} job element(s), {} rejected",
          name.code(),
          root.size(),
          root.size() - records.size());
    }
    return records;
  }

  private static String stripCodeFence(String content) {
    String trimmed = content.trim();
    if (!trimmed.startsWith("```")) {
      return trimmed;
    }
    int firstLineEnd = trimmed.indexOf('\n');
    if (firstLineEnd < 0) {
      return trimmed;
    }
    String body = trimmed.substring(firstLineEnd + 1);
    int closing = body.lastIndexOf("```");
    return (closing >= 0 ? body.substring(0, closing) : body).trim();
  }
}
