package com.careerpilot.backend.chat.extraction;

import com.careerpilot.backend.chat.domain.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Per-element validation shared by all strategies. A record needs every wire field present, a
 * non-blank title and company, and an integral rating within {@code [0, 5]}. Out-of-range ratings
 * reject the record; they are never clamped.
 */
public final class JobRecordValidator {

  static final String JOB_TITLE = "job_title";
  static final String COMPANY = "company";
  static final String LOCATION = "location";
  static final String MATCH_RATING = "match_rating";
  static final String LINK = "link";

  private JobRecordValidator() {}

  public static boolean isValid(JobRecord record) {
    return record != null
        && StringUtils.hasText(record.jobTitle())
        && StringUtils.hasText(record.company())
        && record.location() != null
        && record.link() != null
        && JobRecord.isValidRating(record.matchRating());
  }

  public static Optional<JobRecord> fromNode(JsonNode node) {
    if (node == null || !node.isObject()) {
      return Optional.empty();
    }
    Optional<String> title = text(node, JOB_TITLE);
    Optional<String> company = text(node, COMPANY);
    Optional<String> location = text(node, LOCATION);
    Optional<String> link = text(node, LINK);
    Optional<Integer> rating = rating(node.get(MATCH_RATING));
    if (title.isEmpty()
        || company.isEmpty()
        || location.isEmpty()
        || link.isEmpty()
        || rating.isEmpty()) {
      return Optional.empty();
    }
    JobRecord record =
        new JobRecord(title.get(), company.get(), location.get(), rating.get(), link.get());
    return isValid(record) ? Optional.of(record) : Optional.empty();
  }

  private static Optional<String> text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return Optional.empty();
    }
    return Optional.of(value.asText().trim());
  }

  private static Optional<Integer> rating(JsonNode value) {
    if (value == null || value.isNull()) {
      return Optional.empty();
    }
    BigDecimal number;
    if (value.isNumber()) {
      number = value.decimalValue();
    } else if (value.isTextual() && StringUtils.hasText(value.asText())) {
      try {
        number = new BigDecimal(value.asText().trim());
      } catch (NumberFormatException notNumeric) {
        return Optional.empty();
      }
    } else {
      return Optional.empty();
    }
    if (number.signum() != 0 && number.stripTrailingZeros().scale() > 0) {
      return Optional.empty();
    }
    if (number.compareTo(BigDecimal.valueOf(JobRecord.MIN_RATING)) < 0
        || number.compareTo(BigDecimal.valueOf(JobRecord.MAX_RATING)) > 0) {
      return Optional.empty();
    }
    return Optional.of(number.intValue());
  }
}
