package com.careerpilot.backend.chat.domain;

import java.util.List;
import java.util.Objects;

/**
 * Uniform output of every capability.
 *
 * @param structured records returned in typed form, {@code null} when the capability only produced
 *     text
 */
public record CapabilityResult(String text, List<JobRecord> structured) {

  public CapabilityResult {
    text = text != null ? text : "";
    structured =
        structured != null ? structured.stream().filter(Objects::nonNull).toList() : null;
  }

  public static CapabilityResult text(String text) {
    return new CapabilityResult(text, null);
  }

  public boolean hasStructured() {
    return structured != null;
  }
}
