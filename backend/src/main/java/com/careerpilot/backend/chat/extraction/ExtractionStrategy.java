package com.careerpilot.backend.chat.extraction;

import com.careerpilot.backend.chat.domain.JobRecord;
import java.util.List;

/**
 * One way of recovering job records. Implementations never throw and return an empty list when
 * they do not apply.
 */
public interface ExtractionStrategy {

  String name();

  List<JobRecord> extract(ExtractionInput input);
}
