package com.careerpilot.backend.chat.domain;

import java.util.Locale;

public enum ChatRole {
  USER,
  ASSISTANT,
  TOOL;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ChatRole from(String value) {
    if (value == null || value.isBlank()) {
      return USER;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "HUMAN" -> USER;
      case "AI" -> ASSISTANT;
      default -> ChatRole.valueOf(normalized);
    };
  }
}
