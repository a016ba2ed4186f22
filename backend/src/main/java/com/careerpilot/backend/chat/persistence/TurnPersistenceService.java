package com.careerpilot.backend.chat.persistence;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.JobRecord;
import com.careerpilot.backend.chat.domain.ThreadIdentity;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs conversation and job writes so that a failing write never reaches the turn. Message saves
 * report failures as an empty result. Job batches are written concurrently and awaited together;
 * each failed item is logged and reported without affecting its siblings.
 */
@Service
public class TurnPersistenceService {

  private static final Logger log = LoggerFactory.getLogger(TurnPersistenceService.class);

  static final String METADATA_MESSAGE_ID = "message_id";
  static final String METADATA_CAPABILITY = "capability";

  private final PersistenceGateway gateway;
  private final ExecutorService executor;
  private final MeterRegistry meterRegistry;

  public TurnPersistenceService(
      PersistenceGateway gateway,
      @Qualifier("persistenceExecutor") ExecutorService executor,
      MeterRegistry meterRegistry) {
    this.gateway = gateway;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /** Saves the message on the calling thread; failures are logged and yield an empty result. */
  public Optional<UUID> saveMessageQuietly(ThreadIdentity identity, ConversationMessage message) {
    try {
      UUID id =
          gateway.saveMessage(
              identity.userId(),
              identity.threadId(),
              message.role(),
              message.content(),
              metadataOf(message));
      return Optional.ofNullable(id);
    } catch (RuntimeException ex) {
      recordFailure("message");
      log.warn(
          "Failed to save {} message {} for thread {}: {}",
          message.role().wireName(),
          message.id(),
          identity.threadId(),
          ex.getMessage());
      return Optional.empty();
    }
  }

  /** Hands the message save to the persistence pool without waiting for it. */
  public CompletableFuture<Optional<UUID>> submitMessage(
      ThreadIdentity identity, ConversationMessage message) {
    try {
      return CompletableFuture.supplyAsync(() -> saveMessageQuietly(identity, message), executor);
    } catch (RuntimeException rejected) {
      recordFailure("message");
      log.warn("Could not schedule save of message {}: {}", message.id(), rejected.getMessage());
      return CompletableFuture.completedFuture(Optional.empty());
    }
  }

  /** Saves the messages one after another on a single pool thread, without waiting for them. */
  public CompletableFuture<Void> submitMessages(
      ThreadIdentity identity, List<ConversationMessage> messages) {
    return submitMessagesAfter(null, identity, messages);
  }

  /**
   * Like {@link #submitMessages} but starts only once {@code predecessor} has finished, whatever
   * its outcome. A {@code null} predecessor starts the writes right away.
   */
  public CompletableFuture<Void> submitMessagesAfter(
      CompletableFuture<?> predecessor,
      ThreadIdentity identity,
      List<ConversationMessage> messages) {
    List<ConversationMessage> ordered = List.copyOf(messages);
    CompletableFuture<?> start =
        predecessor != null ? predecessor : CompletableFuture.completedFuture(null);
    try {
      return start
          .handle((ignored, error) -> null)
          .thenRunAsync(
              () -> ordered.forEach(message -> saveMessageQuietly(identity, message)), executor)
          .exceptionally(
              error -> {
                reportUnscheduled(identity, ordered, unwrap(error));
                return null;
              });
    } catch (RuntimeException rejected) {
      reportUnscheduled(identity, ordered, rejected);
      return CompletableFuture.completedFuture(null);
    }
  }

  private void reportUnscheduled(
      ThreadIdentity identity, List<ConversationMessage> messages, Throwable error) {
    recordFailure("message");
    log.warn(
        "Could not schedule save of {} messages for thread {}: {}",
        messages.size(),
        identity.threadId(),
        error.getMessage());
  }

  /** Writes all jobs concurrently and waits for the whole batch. Never throws. */
  public JobBatchResult saveJobs(String userId, List<JobRecord> jobs) {
    if (jobs == null || jobs.isEmpty()) {
      return JobBatchResult.empty();
    }
    List<CompletableFuture<Outcome>> futures = new ArrayList<>(jobs.size());
    for (int index = 0; index < jobs.size(); index++) {
      futures.add(submitJob(userId, index, jobs.get(index)));
    }
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

    List<UUID> saved = new ArrayList<>();
    List<JobBatchResult.Failure> failures = new ArrayList<>();
    for (CompletableFuture<Outcome> future : futures) {
      Outcome outcome = future.join();
      if (outcome.failure() != null) {
        failures.add(outcome.failure());
      } else {
        saved.add(outcome.id());
      }
    }
    JobBatchResult result = new JobBatchResult(saved, failures);
    if (result.hasFailures()) {
      log.warn(
          "Saved {} of {} jobs for user {}; {} failed",
          saved.size(),
          jobs.size(),
          userId,
          failures.size());
    } else {
      log.debug("Saved {} jobs for user {}", saved.size(), userId);
    }
    return result;
  }

  private CompletableFuture<Outcome> submitJob(String userId, int index, JobRecord job) {
    CompletableFuture<UUID> write;
    try {
      write = CompletableFuture.supplyAsync(() -> gateway.saveJob(userId, job), executor);
    } catch (RuntimeException rejected) {
      write = CompletableFuture.failedFuture(rejected);
    }
    return write.handle(
        (id, error) -> {
          if (error == null) {
            return new Outcome(id, null);
          }
          Throwable cause = unwrap(error);
          recordFailure("job");
          log.warn(
              "Failed to save job #{} '{}' at '{}' for user {}: {}",
              index,
              job.jobTitle(),
              job.company(),
              userId,
              cause.getMessage());
          return new Outcome(null, new JobBatchResult.Failure(index, job, cause.getMessage()));
        });
  }

  private Map<String, String> metadataOf(ConversationMessage message) {
    Map<String, String> metadata = new LinkedHashMap<>(message.metadata());
    metadata.put(METADATA_MESSAGE_ID, message.id().toString());
    if (message.capability() != null) {
      metadata.put(METADATA_CAPABILITY, message.capability());
    }
    return metadata;
  }

  private void recordFailure(String kind) {
    if (meterRegistry != null) {
      meterRegistry.counter("chat.persistence.failures", "kind", kind).increment();
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  private record Outcome(UUID id, JobBatchResult.Failure failure) {}
}
