package com.careerpilot.backend.chat.capability.tool;

import java.util.List;

public record ExaSearchResult(String title, String url, List<String> highlights) {

  public ExaSearchResult {
    highlights = highlights != null ? List.copyOf(highlights) : List.of();
  }
}
