package com.careerpilot.backend.chat.persistence;

import com.careerpilot.backend.chat.domain.JobRecord;
import java.util.List;
import java.util.UUID;

public record JobBatchResult(List<UUID> savedIds, List<Failure> failures) {

  private static final JobBatchResult EMPTY = new JobBatchResult(List.of(), List.of());

  public JobBatchResult {
    savedIds = savedIds != null ? List.copyOf(savedIds) : List.of();
    failures = failures != null ? List.copyOf(failures) : List.of();
  }

  public static JobBatchResult empty() {
    return EMPTY;
  }

  public int attempted() {
    return savedIds.size() + failures.size();
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  /**
   * @param index position of the job in the submitted batch
   */
  public record Failure(int index, JobRecord job, String error) {}
}
