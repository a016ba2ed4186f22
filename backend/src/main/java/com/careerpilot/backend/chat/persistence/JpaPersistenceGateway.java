package com.careerpilot.backend.chat.persistence;

import com.careerpilot.backend.chat.domain.ChatRole;
import com.careerpilot.backend.chat.domain.JobRecord;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Component
public class JpaPersistenceGateway implements PersistenceGateway {

  private static final Logger log = LoggerFactory.getLogger(JpaPersistenceGateway.class);

  private final ChatHistoryRepository chatHistoryRepository;
  private final UserJobRepository userJobRepository;

  public JpaPersistenceGateway(
      ChatHistoryRepository chatHistoryRepository, UserJobRepository userJobRepository) {
    this.chatHistoryRepository = chatHistoryRepository;
    this.userJobRepository = userJobRepository;
  }

  @Override
  @Transactional
  public UUID saveMessage(
      String userId, String threadId, ChatRole role, String content, Map<String, String> metadata) {
    if (!StringUtils.hasText(userId) || !StringUtils.hasText(threadId)) {
      throw new IllegalArgumentException("userId and threadId are required to save a message");
    }
    if (role == null) {
      throw new IllegalArgumentException("role is required to save a message");
    }
    log.debug("Saving {} message for user {} thread {}", role.wireName(), userId, threadId);
    ChatHistoryEntry saved =
        chatHistoryRepository.save(
            new ChatHistoryEntry(userId, threadId, role, content != null ? content : "", metadata));
    return saved.getId();
  }

  @Override
  @Transactional
  public UUID saveJob(String userId, JobRecord job) {
    if (!StringUtils.hasText(userId)) {
      throw new IllegalArgumentException("userId is required to save a job");
    }
    if (job == null) {
      throw new IllegalArgumentException("job must not be null");
    }
    log.debug("Saving job '{}' at '{}' for user {}", job.jobTitle(), job.company(), userId);
    UserJob saved =
        userJobRepository.save(
            new UserJob(
                userId,
                job.jobTitle(),
                job.company(),
                job.location(),
                job.matchRating(),
                job.link()));
    return saved.getId();
  }
}
