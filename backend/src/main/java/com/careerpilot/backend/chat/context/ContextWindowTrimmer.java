package com.careerpilot.backend.chat.context;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a bounded view of a conversation for the delegation call.
 *
 * <p>The history is split into turns, each starting at a user message. Whole turns are kept,
 * newest first, while their estimated size fits the budget, so a cut never lands inside a turn.
 * The newest turn is always kept even when it alone exceeds the budget. Leading messages that
 * precede the first user message are never part of the view, and a trailing assistant message that
 * still waits for its tool result is left out. The input list is not modified.
 */
public class ContextWindowTrimmer {

  private static final Logger log = LoggerFactory.getLogger(ContextWindowTrimmer.class);

  private final TokenEstimator tokenEstimator;

  public ContextWindowTrimmer(TokenEstimator tokenEstimator) {
    this.tokenEstimator = tokenEstimator;
  }

  public List<ConversationMessage> trim(List<ConversationMessage> messages, int maxTokens) {
    if (messages == null || messages.isEmpty()) {
      return List.of();
    }
    List<List<ConversationMessage>> turns = splitIntoTurns(messages);
    if (turns.isEmpty()) {
      return List.of();
    }
    int lastIndex = turns.size() - 1;
    turns.set(lastIndex, dropPendingToolCalls(turns.get(lastIndex)));

    int budget = Math.max(0, maxTokens);
    int used = 0;
    int firstKept = turns.size();
    for (int index = lastIndex; index >= 0; index--) {
      int turnTokens = tokenEstimator.estimate(turns.get(index));
      if (index == lastIndex && turnTokens > budget) {
        log.debug(
            "Newest turn needs {} tokens which exceeds the budget of {}; keeping it whole",
            turnTokens,
            budget);
        return List.copyOf(turns.get(index));
      }
      if (used + turnTokens > budget) {
        break;
      }
      used += turnTokens;
      firstKept = index;
    }

    List<ConversationMessage> view = new ArrayList<>();
    for (int index = firstKept; index < turns.size(); index++) {
      view.addAll(turns.get(index));
    }
    if (log.isDebugEnabled() && firstKept > 0) {
      log.debug(
          "Trimmed {} of {} turns to fit {} tokens (kept {} tokens)",
          firstKept,
          turns.size(),
          budget,
          used);
    }
    return List.copyOf(view);
  }

  private List<List<ConversationMessage>> splitIntoTurns(List<ConversationMessage> messages) {
    List<List<ConversationMessage>> turns = new ArrayList<>();
    List<ConversationMessage> current = null;
    for (ConversationMessage message : messages) {
      if (message == null) {
        continue;
      }
      if (message.isUser()) {
        current = new ArrayList<>();
        turns.add(current);
      }
      if (current != null) {
        current.add(message);
      }
    }
    return turns;
  }

  private List<ConversationMessage> dropPendingToolCalls(List<ConversationMessage> turn) {
    int end = turn.size();
    while (end > 1 && turn.get(end - 1).awaitsToolResult()) {
      end--;
    }
    return end == turn.size() ? turn : new ArrayList<>(turn.subList(0, end));
  }
}
