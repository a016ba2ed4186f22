package com.careerpilot.backend.chat.ratelimit;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allows at most {@code maxCalls} acquisitions per rolling {@code window}, shared by every thread
 * that uses the same instance.
 *
 * <p>Timestamps of recent calls are kept in a FIFO queue. Evicting expired entries, checking the
 * size and recording a new timestamp all happen under one lock, so concurrent callers can never
 * push the count past the limit. A caller that finds the window full waits exactly until the oldest
 * entry expires and then evaluates again.
 */
public class SlidingWindowRateLimiter {

  private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

  private final String name;
  private final int maxCalls;
  private final long windowNanos;
  private final Deque<Long> timestamps = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock(true);
  private final Condition slotReleased = lock.newCondition();

  public SlidingWindowRateLimiter(String name, int maxCalls, Duration window) {
    if (maxCalls <= 0) {
      throw new IllegalArgumentException("maxCalls must be positive");
    }
    if (window == null || window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive");
    }
    this.name = name;
    this.maxCalls = maxCalls;
    this.windowNanos = window.toNanos();
  }

  /**
   * Blocks until a call is allowed and records it.
   *
   * @throws RateLimiterInterruptedException if the thread is interrupted while waiting; the
   *     interrupt flag is restored
   */
  public void acquire() {
    lock.lock();
    try {
      while (true) {
        long now = System.nanoTime();
        evictExpired(now);
        if (timestamps.size() < maxCalls) {
          timestamps.addLast(now);
          return;
        }
        long waitNanos = timestamps.peekFirst() + windowNanos - now;
        if (log.isDebugEnabled()) {
          log.debug(
              "Rate limiter '{}' is full ({} calls), waiting {} ms",
              name,
              maxCalls,
              TimeUnit.NANOSECONDS.toMillis(waitNanos));
        }
        if (waitNanos > 0) {
          slotReleased.awaitNanos(waitNanos);
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new RateLimiterInterruptedException(name, interrupted);
    } finally {
      lock.unlock();
    }
  }

  public int maxCalls() {
    return maxCalls;
  }

  public Duration window() {
    return Duration.ofNanos(windowNanos);
  }

  private void evictExpired(long now) {
    while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowNanos) {
      timestamps.pollFirst();
    }
  }
}
