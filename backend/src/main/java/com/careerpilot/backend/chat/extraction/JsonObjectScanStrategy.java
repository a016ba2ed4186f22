package com.careerpilot.backend.chat.extraction;

import com.careerpilot.backend.chat.domain.JobRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/** Parses every object-shaped block that mentions the job title key, one by one. */
class JsonObjectScanStrategy implements ExtractionStrategy {

  private static final Logger log = LoggerFactory.getLogger(JsonObjectScanStrategy.class);
  private static final String MARKER = "\"" + JobRecordValidator.JOB_TITLE + "\"";

  private final ObjectMapper objectMapper;

  JsonObjectScanStrategy(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public String name() {
    return "json-object-scan";
  }

  @Override
  public List<JobRecord> extract(ExtractionInput input) {
    if (input == null || !StringUtils.hasText(input.text()) || !input.text().contains(MARKER)) {
      return List.of();
    }
    String text = input.text();
    List<JobRecord> records = new ArrayList<>();
    int start = text.indexOf('{');
    while (start >= 0) {
      int end = JsonCandidateScanner.findClosing(text, start);
      if (end < 0) {
        break;
      }
      String candidate = text.substring(start, end + 1);
      Optional<JobRecord> record =
          candidate.contains(MARKER) ? parse(candidate) : Optional.empty();
      if (record.isPresent()) {
        records.add(record.get());
        start = text.indexOf('{', end + 1);
      } else {
        start = text.indexOf('{', start + 1);
      }
    }
    return records;
  }

  private Optional<JobRecord> parse(String candidate) {
    try {
      JsonNode node = objectMapper.readTree(candidate);
      return JobRecordValidator.fromNode(node);
    } catch (JsonProcessingException notJson) {
      log.debug("Skipping malformed job object: {}", notJson.getOriginalMessage());
      return Optional.empty();
    }
  }
}
