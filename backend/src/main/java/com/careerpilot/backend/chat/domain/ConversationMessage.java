package com.careerpilot.backend.chat.domain;

import java.util.Map;
import java.util.UUID;

/**
 * Single entry of a conversation. Instances are immutable; a conversation only grows by appending
 * new messages.
 *
 * @param id stable identifier used to correlate UI payloads with the message
 * @param capability name of the capability that produced the message, {@code null} for user input
 *     and supervisor answers
 * @param metadata free-form string attributes supplied by the caller (e.g. embedded identity)
 */
public record ConversationMessage(
    UUID id, ChatRole role, String content, String capability, Map<String, String> metadata) {

  public static final String METADATA_TOOL_CALL_PENDING = "tool_call_pending";

  public ConversationMessage {
    id = id != null ? id : UUID.randomUUID();
    role = role != null ? role : ChatRole.USER;
    content = content != null ? content : "";
    metadata = metadata == null || metadata.isEmpty() ? Map.of() : Map.copyOf(metadata);
  }

  public static ConversationMessage user(String content) {
    return new ConversationMessage(null, ChatRole.USER, content, null, null);
  }

  public static ConversationMessage user(String content, Map<String, String> metadata) {
    return new ConversationMessage(null, ChatRole.USER, content, null, metadata);
  }

  public static ConversationMessage assistant(String content) {
    return new ConversationMessage(null, ChatRole.ASSISTANT, content, null, null);
  }

  public static ConversationMessage tool(String capability, String content) {
    return new ConversationMessage(null, ChatRole.TOOL, content, capability, null);
  }

  public boolean isUser() {
    return role == ChatRole.USER;
  }

  public boolean isAssistant() {
    return role == ChatRole.ASSISTANT;
  }

  public boolean isTool() {
    return role == ChatRole.TOOL;
  }

  /** Assistant message that announced a tool call and still waits for the tool result. */
  public boolean awaitsToolResult() {
    return isAssistant() && Boolean.parseBoolean(metadata.get(METADATA_TOOL_CALL_PENDING));
  }

  public String metadataValue(String key) {
    return metadata.get(key);
  }
}
