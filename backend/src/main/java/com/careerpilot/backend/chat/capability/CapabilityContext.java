package com.careerpilot.backend.chat.capability;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.List;

/**
 * Per-turn input shared by every capability call.
 *
 * @param userId owner of the conversation, {@code null} when the turn is anonymous
 * @param userContext formatted user summary, never {@code null}
 * @param history trimmed conversation view
 */
public record CapabilityContext(
    String userId, String userContext, List<ConversationMessage> history) {

  /** Key under which the user id is exposed to tools through the tool context. */
  public static final String TOOL_CONTEXT_USER_ID = "user_id";

  public CapabilityContext {
    userContext = userContext != null ? userContext : "";
    history = history != null ? List.copyOf(history) : List.of();
  }
}
