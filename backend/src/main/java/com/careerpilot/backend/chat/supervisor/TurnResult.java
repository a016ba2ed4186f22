package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.UiPayload;
import java.util.Optional;

/**
 * @param message assistant answer of the turn
 * @param uiPayload jobs table correlated with {@code message}, {@code null} when not annotated
 * @param fallback whether {@code message} is the generic fallback text
 */
public record TurnResult(ConversationMessage message, UiPayload uiPayload, boolean fallback) {

  public Optional<UiPayload> ui() {
    return Optional.ofNullable(uiPayload);
  }
}
