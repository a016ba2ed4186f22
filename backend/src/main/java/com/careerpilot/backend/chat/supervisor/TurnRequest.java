package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.List;
import java.util.Map;

/**
 * One user turn as received at the boundary.
 *
 * @param metadata attributes attached to the new user message
 * @param inboundMessages prior messages sent by the client, used to seed a thread the server has
 *     not seen yet and as an identity fallback
 */
public record TurnRequest(
    String message,
    String userId,
    String threadId,
    Map<String, String> metadata,
    List<ConversationMessage> inboundMessages) {

  public TurnRequest {
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    inboundMessages = inboundMessages != null ? List.copyOf(inboundMessages) : List.of();
  }

  public static TurnRequest of(String message, String userId, String threadId) {
    return new TurnRequest(message, userId, threadId, null, null);
  }
}
