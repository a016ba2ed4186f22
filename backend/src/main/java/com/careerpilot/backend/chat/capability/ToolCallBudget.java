package com.careerpilot.backend.chat.capability;

import java.util.concurrent.atomic.AtomicInteger;

/** Number of tool calls left for one capability invocation. Shared by all of its callbacks. */
public final class ToolCallBudget {

  private final int limit;
  private final AtomicInteger used = new AtomicInteger();

  public ToolCallBudget(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("Tool call limit must not be negative");
    }
    this.limit = limit;
  }

  /** Reserves one call; returns {@code false} once the limit has been reached. */
  public boolean tryConsume() {
    while (true) {
      int current = used.get();
      if (current >= limit) {
        return false;
      }
      if (used.compareAndSet(current, current + 1)) {
        return true;
      }
    }
  }

  public int limit() {
    return limit;
  }

  public int used() {
    return used.get();
  }
}
