package com.careerpilot.backend.chat.extraction;

import com.careerpilot.backend.chat.domain.JobRecord;
import java.util.List;

class TypedPayloadStrategy implements ExtractionStrategy {

  @Override
  public String name() {
    return "typed-payload";
  }

  @Override
  public List<JobRecord> extract(ExtractionInput input) {
    if (input == null || input.typed() == null || input.typed().isEmpty()) {
      return List.of();
    }
    return input.typed().stream().filter(JobRecordValidator::isValid).toList();
  }
}
