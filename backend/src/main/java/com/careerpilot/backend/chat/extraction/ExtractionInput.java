package com.careerpilot.backend.chat.extraction;

import com.careerpilot.backend.chat.domain.CapabilityResult;
import com.careerpilot.backend.chat.domain.JobRecord;
import java.util.List;

/**
 * @param typed records handed over in typed form, {@code null} when only text is available
 */
public record ExtractionInput(String text, List<JobRecord> typed) {

  public static ExtractionInput ofText(String text) {
    return new ExtractionInput(text, null);
  }

  public static ExtractionInput of(CapabilityResult result) {
    if (result == null) {
      return new ExtractionInput(null, null);
    }
    return new ExtractionInput(result.text(), result.structured());
  }
}
