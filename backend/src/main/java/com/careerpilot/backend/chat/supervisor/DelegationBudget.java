package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.util.StringUtils;

/**
 * Step allowance of one delegation call. The delegation boundary must call {@link #consumeStep()}
 * before every planning or capability step; the call fails once the limit is reached or the owner
 * cancelled the delegation. Safe for use from the delegation thread and the owning turn thread.
 */
public final class DelegationBudget {

  private final int stepLimit;
  private final AtomicInteger usedSteps = new AtomicInteger();
  private volatile boolean cancelled;
  private volatile String partialText;
  private final List<ConversationMessage> emittedMessages = new CopyOnWriteArrayList<>();

  public DelegationBudget(int stepLimit) {
    if (stepLimit <= 0) {
      throw new IllegalArgumentException("stepLimit must be positive");
    }
    this.stepLimit = stepLimit;
  }

  public void consumeStep() {
    if (cancelled) {
      throw new DelegationBudgetExceededException(
          "Delegation cancelled after " + usedSteps.get() + " step(s)",
          stepLimit,
          partialText,
          emittedMessages());
    }
    int step = usedSteps.incrementAndGet();
    if (step > stepLimit) {
      usedSteps.decrementAndGet();
      throw new DelegationBudgetExceededException(
          "Delegation step limit of " + stepLimit + " reached",
          stepLimit,
          partialText,
          emittedMessages());
    }
  }

  /** Remembers the latest useful text so a stopped delegation still has something to return. */
  public void recordPartial(String text) {
    if (StringUtils.hasText(text)) {
      this.partialText = text;
    }
  }

  /** Keeps a message produced during delegation so it survives an early stop. */
  public void recordEmitted(ConversationMessage message) {
    if (message != null) {
      emittedMessages.add(message);
    }
  }

  public void cancel() {
    this.cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public int stepLimit() {
    return stepLimit;
  }

  public int usedSteps() {
    return usedSteps.get();
  }

  public int remainingSteps() {
    return Math.max(0, stepLimit - usedSteps.get());
  }

  public String partialText() {
    return partialText;
  }

  public List<ConversationMessage> emittedMessages() {
    return List.copyOf(emittedMessages);
  }
}
