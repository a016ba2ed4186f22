package com.careerpilot.backend.chat.ratelimit;

public class RateLimiterInterruptedException extends RuntimeException {

  public RateLimiterInterruptedException(String limiterName, InterruptedException cause) {
    super("Interrupted while waiting for rate limiter '" + limiterName + "'", cause);
  }
}
