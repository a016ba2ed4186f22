package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.List;

/** Hands a turn over to the capabilities and returns their combined answer. */
public interface DelegationBoundary {

  /**
   * @param history trimmed conversation view ending with the current user message
   * @param budget step allowance; implementations call {@link DelegationBudget#consumeStep()} per
   *     step and let its exception propagate
   * @throws DelegationBudgetExceededException when the budget runs out before an answer exists
   */
  DelegationResult delegate(
      List<ConversationMessage> history, DelegationContext context, DelegationBudget budget);
}
