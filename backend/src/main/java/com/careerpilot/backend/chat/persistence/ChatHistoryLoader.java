package com.careerpilot.backend.chat.persistence;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.ThreadIdentity;
import com.careerpilot.backend.chat.state.ConversationHistoryLoader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rebuilds conversation messages from {@code chat_history}. Message ids and capability names
 * travel in the row metadata and are restored from there.
 */
@Component
public class ChatHistoryLoader implements ConversationHistoryLoader {

  private final ChatHistoryRepository repository;

  public ChatHistoryLoader(ChatHistoryRepository repository) {
    this.repository = repository;
  }

  @Override
  @Transactional(readOnly = true)
  public List<ConversationMessage> load(ThreadIdentity identity) {
    return repository
        .findByUserIdAndThreadIdOrderByCreatedAtAsc(identity.userId(), identity.threadId())
        .stream()
        .map(ChatHistoryLoader::toMessage)
        .toList();
  }

  static ConversationMessage toMessage(ChatHistoryEntry entry) {
    Map<String, String> metadata = new LinkedHashMap<>();
    if (entry.getMetadata() != null) {
      metadata.putAll(entry.getMetadata());
    }
    UUID id = parseId(metadata.remove(TurnPersistenceService.METADATA_MESSAGE_ID), entry.getId());
    String capability = metadata.remove(TurnPersistenceService.METADATA_CAPABILITY);
    return new ConversationMessage(id, entry.getRole(), entry.getContent(), capability, metadata);
  }

  private static UUID parseId(String value, UUID fallback) {
    if (value == null) {
      return fallback;
    }
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException malformed) {
      return fallback;
    }
  }
}
