package com.careerpilot.backend.chat.persistence;

import com.careerpilot.backend.chat.domain.ChatRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "chat_history")
public class ChatHistoryEntry {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @Column(name = "user_id", nullable = false, length = 64)
  private String userId;

  @Column(name = "thread_id", nullable = false, length = 128)
  private String threadId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 32)
  private ChatRole role;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT")
  private String content;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata")
  private Map<String, String> metadata;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ChatHistoryEntry() {}

  public ChatHistoryEntry(
      String userId, String threadId, ChatRole role, String content, Map<String, String> metadata) {
    this.userId = userId;
    this.threadId = threadId;
    this.role = role;
    this.content = content;
    this.metadata = metadata == null || metadata.isEmpty() ? null : Map.copyOf(metadata);
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getUserId() {
    return userId;
  }

  public String getThreadId() {
    return threadId;
  }

  public ChatRole getRole() {
    return role;
  }

  public String getContent() {
    return content;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
