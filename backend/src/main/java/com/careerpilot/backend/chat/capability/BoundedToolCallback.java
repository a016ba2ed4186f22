package com.careerpilot.backend.chat.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Decorator for {@link ToolCallback} that charges every call against a {@link ToolCallBudget} and
 * logs the exchange. Calls past the budget are answered with a refusal instead of running the tool.
 */
public class BoundedToolCallback implements ToolCallback {

  private static final Logger log = LoggerFactory.getLogger(BoundedToolCallback.class);

  private final ToolCallback delegate;
  private final ToolCallBudget budget;
  private final CapabilityName capability;

  public BoundedToolCallback(
      ToolCallback delegate, ToolCallBudget budget, CapabilityName capability) {
    this.delegate = delegate;
    this.budget = budget;
    this.capability = capability;
  }

  @Override
  public ToolDefinition getToolDefinition() {
    return delegate.getToolDefinition();
  }

  @Override
  public String call(String input) {
    return call(input, null);
  }

  @Override
  public String call(String input, ToolContext toolContext) {
    String toolName = resolveToolName();
    if (!budget.tryConsume()) {
      log.debug(
          "TOOL[{}] refused for {}: limit of {} call(s) reached",
          toolName,
          capability.code(),
          budget.limit());
      return refusal();
    }
    if (log.isDebugEnabled()) {
      log.debug("TOOL[{}] input from {}: {}", toolName, capability.code(), input);
    }
    try {
      String result =
          toolContext != null ? delegate.call(input, toolContext) : delegate.call(input);
      if (log.isDebugEnabled()) {
        log.debug("TOOL[{}] output: {}", toolName, result);
      }
      return result;
    } catch (RuntimeException exception) {
      if (log.isDebugEnabled()) {
        log.debug("TOOL[{}] raised: {}", toolName, exception.getMessage(), exception);
      }
      throw exception;
    }
  }

  String refusal() {
    return "Tool call limit of "
        + budget.limit()
        + " reached. Answer with the information gathered so far.";
  }

  private String resolveToolName() {
    ToolDefinition definition = delegate.getToolDefinition();
    return definition != null ? definition.name() : "unknown";
  }
}
