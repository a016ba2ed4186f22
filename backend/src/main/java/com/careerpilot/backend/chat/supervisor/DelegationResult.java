package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.domain.CapabilityResult;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.JobRecord;
import java.util.List;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Outcome of one delegation call.
 *
 * @param text final answer for the user
 * @param structured typed job records of the latest job matcher call, {@code null} when that call
 *     answered in text only
 * @param emittedMessages capability outputs produced during the call, in order
 * @param budgetExhausted whether the call was stopped before the planner finished
 */
public record DelegationResult(
    String text,
    List<JobRecord> structured,
    List<ConversationMessage> emittedMessages,
    boolean budgetExhausted) {

  public DelegationResult {
    structured =
        structured != null ? structured.stream().filter(Objects::nonNull).toList() : null;
    emittedMessages = emittedMessages != null ? List.copyOf(emittedMessages) : List.of();
  }

  public static DelegationResult exhausted(
      String partialText, List<ConversationMessage> emittedMessages) {
    return new DelegationResult(partialText, null, emittedMessages, true);
  }

  public boolean hasText() {
    return StringUtils.hasText(text);
  }

  public CapabilityResult asCapabilityResult() {
    return new CapabilityResult(text, structured);
  }
}
