package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.List;

/** Raised when a delegation call uses up its step budget or is cancelled by the caller. */
public class DelegationBudgetExceededException extends RuntimeException {

  private final int stepLimit;
  private final String partialText;
  private final List<ConversationMessage> emittedMessages;

  public DelegationBudgetExceededException(
      String message,
      int stepLimit,
      String partialText,
      List<ConversationMessage> emittedMessages) {
    super(message);
    this.stepLimit = stepLimit;
    this.partialText = partialText;
    this.emittedMessages = emittedMessages != null ? List.copyOf(emittedMessages) : List.of();
  }

  public int getStepLimit() {
    return stepLimit;
  }

  /** Best answer produced before the delegation was stopped, possibly {@code null}. */
  public String getPartialText() {
    return partialText;
  }

  /** Capability outputs produced before the stop, in order. */
  public List<ConversationMessage> getEmittedMessages() {
    return emittedMessages;
  }
}
