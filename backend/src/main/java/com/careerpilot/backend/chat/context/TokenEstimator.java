package com.careerpilot.backend.chat.context;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.List;

/** Deterministic approximation of how many tokens a message occupies in a prompt. */
public interface TokenEstimator {

  int estimate(ConversationMessage message);

  default int estimate(List<ConversationMessage> messages) {
    if (messages == null) {
      return 0;
    }
    int total = 0;
    for (ConversationMessage message : messages) {
      total += estimate(message);
    }
    return total;
  }
}
