package com.careerpilot.backend.chat.domain;

import org.springframework.util.StringUtils;

public record ThreadIdentity(String userId, String threadId) {

  public ThreadIdentity {
    if (!StringUtils.hasText(userId) || !StringUtils.hasText(threadId)) {
      throw new IllegalArgumentException("Both userId and threadId are required");
    }
    userId = userId.trim();
    threadId = threadId.trim();
  }
}
