package com.careerpilot.backend.chat.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered message log of one thread plus the UI payloads attached to it. Only appends are
 * supported; readers receive unmodifiable snapshots.
 */
public final class ConversationState {

  private final ThreadIdentity identity;
  private final List<ConversationMessage> messages = new ArrayList<>();
  private final List<UiPayload> uiPayloads = new ArrayList<>();

  public ConversationState(ThreadIdentity identity) {
    this.identity = identity;
  }

  /** State for a turn whose identity could not be resolved; never stored. */
  public static ConversationState anonymous() {
    return new ConversationState(null);
  }

  public Optional<ThreadIdentity> identity() {
    return Optional.ofNullable(identity);
  }

  public synchronized void append(ConversationMessage message) {
    if (message == null) {
      throw new IllegalArgumentException("message must not be null");
    }
    messages.add(message);
  }

  public synchronized void appendAll(List<ConversationMessage> newMessages) {
    if (newMessages == null) {
      return;
    }
    newMessages.forEach(this::append);
  }

  public synchronized void attach(UiPayload payload) {
    if (payload == null) {
      throw new IllegalArgumentException("payload must not be null");
    }
    uiPayloads.add(payload);
  }

  public synchronized List<ConversationMessage> messages() {
    return Collections.unmodifiableList(new ArrayList<>(messages));
  }

  public synchronized List<UiPayload> uiPayloads() {
    return Collections.unmodifiableList(new ArrayList<>(uiPayloads));
  }

  public synchronized Optional<ConversationMessage> lastMessage() {
    return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
  }
}
