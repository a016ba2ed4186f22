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

/** Parses the first syntactically valid JSON array found in the text. */
class JsonArrayStrategy implements ExtractionStrategy {

  private static final Logger log = LoggerFactory.getLogger(JsonArrayStrategy.class);

  private final ObjectMapper objectMapper;

  JsonArrayStrategy(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public String name() {
    return "json-array";
  }

  @Override
  public List<JobRecord> extract(ExtractionInput input) {
    if (input == null || !StringUtils.hasText(input.text())) {
      return List.of();
    }
    return firstArray(input.text()).map(this::toRecords).orElse(List.of());
  }

  private Optional<JsonNode> firstArray(String text) {
    int start = text.indexOf('[');
    while (start >= 0) {
      int end = JsonCandidateScanner.findClosing(text, start);
      if (end < 0) {
        return Optional.empty();
      }
      try {
        JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
        if (node != null && node.isArray()) {
          return Optional.of(node);
        }
      } catch (JsonProcessingException notJson) {
        log.debug("Skipping non-JSON bracket block at {}: {}", start, notJson.getOriginalMessage());
      }
      start = text.indexOf('[', start + 1);
    }
    return Optional.empty();
  }

  private List<JobRecord> toRecords(JsonNode array) {
    List<JobRecord> records = new ArrayList<>();
    for (JsonNode element : array) {
      if (element.isObject()) {
        JobRecordValidator.fromNode(element).ifPresent(records::add);
      }
    }
    return records;
  }
}
