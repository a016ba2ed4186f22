package com.careerpilot.backend.chat.capability;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum CapabilityName {
  RESEARCHER("researcher"),
  TAILOR("tailor"),
  JOB_MATCHER("job_matcher");

  private final String code;

  CapabilityName(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static Optional<CapabilityName> fromCode(String code) {
    if (code == null || code.isBlank()) {
      return Optional.empty();
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(name -> name.code.equals(normalized)).findFirst();
  }
}
