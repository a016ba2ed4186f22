package com.careerpilot.backend.chat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;

public record UiPayload(
    @JsonProperty("type") String type,
    @JsonProperty("data") JobsTable data,
    @JsonProperty("correlated_message_id") UUID correlatedMessageId) {

  public static final String JOBS_TABLE = "jobs_table";

  public static UiPayload jobsTable(List<JobRecord> jobs, UUID messageId) {
    return new UiPayload(JOBS_TABLE, new JobsTable(List.copyOf(jobs)), messageId);
  }

  public record JobsTable(@JsonProperty("jobs") List<JobRecord> jobs) {}
}
