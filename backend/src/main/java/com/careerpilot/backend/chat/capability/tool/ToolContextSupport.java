package com.careerpilot.backend.chat.capability.tool;

import com.careerpilot.backend.chat.capability.CapabilityContext;
import java.util.Optional;
import org.springframework.ai.chat.model.ToolContext;

final class ToolContextSupport {

  private ToolContextSupport() {}

  static Optional<String> userId(ToolContext toolContext) {
    if (toolContext == null || toolContext.getContext() == null) {
      return Optional.empty();
    }
    Object value = toolContext.getContext().get(CapabilityContext.TOOL_CONTEXT_USER_ID);
    if (value instanceof String userId && !userId.isBlank()) {
      return Optional.of(userId);
    }
    return Optional.empty();
  }
}
