package com.careerpilot.backend.chat.extraction;

import com.careerpilot.backend.chat.domain.CapabilityResult;
import com.careerpilot.backend.chat.domain.JobRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers job records from capability output by trying strategies in order: the typed payload,
 * the first JSON array in the text, then individual job objects in the text. The first strategy
 * that yields at least one record wins. An empty result is a normal outcome.
 *
 * <p>The extractor keeps no state between calls; the same input always yields the same list in
 * the same order.
 */
public class JobRecordExtractor {

  private static final Logger log = LoggerFactory.getLogger(JobRecordExtractor.class);

  private final List<ExtractionStrategy> strategies;

  public JobRecordExtractor(ObjectMapper objectMapper) {
    this(
        List.of(
            new TypedPayloadStrategy(),
            new JsonArrayStrategy(objectMapper),
            new JsonObjectScanStrategy(objectMapper)));
  }

  JobRecordExtractor(List<ExtractionStrategy> strategies) {
    this.strategies = List.copyOf(strategies);
  }

  public List<JobRecord> extract(String text) {
    return extract(ExtractionInput.ofText(text));
  }

  public List<JobRecord> extract(CapabilityResult result) {
    return extract(ExtractionInput.of(result));
  }

  public List<JobRecord> extract(ExtractionInput input) {
    for (ExtractionStrategy strategy : strategies) {
      List<JobRecord> records = apply(strategy, input);
      if (!records.isEmpty()) {
        if (log.isDebugEnabled()) {
          log.debug("Strategy {} extracted {} job record(s)", strategy.name(), records.size());
        }
        return records;
      }
    }
    return List.of();
  }

  private List<JobRecord> apply(ExtractionStrategy strategy, ExtractionInput input) {
    try {
      List<JobRecord> records = strategy.extract(input);
      return records != null ? List.copyOf(records) : List.of();
    } catch (RuntimeException unexpected) {
      log.debug("Strategy {} failed: {}", strategy.name(), unexpected.getMessage());
      return List.of();
    }
  }
}
