package com.careerpilot.backend.chat.persistence;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChatHistoryRepository extends JpaRepository<ChatHistoryEntry, UUID> {

  List<ChatHistoryEntry> findByUserIdAndThreadIdOrderByCreatedAtAsc(String userId, String threadId);
}
