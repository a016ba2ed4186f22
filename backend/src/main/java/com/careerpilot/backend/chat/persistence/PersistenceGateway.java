package com.careerpilot.backend.chat.persistence;

import com.careerpilot.backend.chat.domain.ChatRole;
import com.careerpilot.backend.chat.domain.JobRecord;
import java.util.Map;
import java.util.UUID;

/**
 * Durable writes for conversation turns and extracted jobs. Every call may fail with a runtime
 * exception; callers decide how to isolate the failure.
 */
public interface PersistenceGateway {

  UUID saveMessage(
      String userId, String threadId, ChatRole role, String content, Map<String, String> metadata);

  default UUID saveMessage(String userId, String threadId, ChatRole role, String content) {
    return saveMessage(userId, threadId, role, content, Map.of());
  }

  UUID saveJob(String userId, JobRecord job);
}
