package com.careerpilot.backend.chat.state;

import com.careerpilot.backend.chat.config.ChatAgentProperties;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.ConversationState;
import com.careerpilot.backend.chat.domain.ThreadIdentity;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Keeps live thread states in a bounded Caffeine cache. Threads that are idle too long or pushed
 * out by the size bound are dropped; their next turn rebuilds the state from stored history.
 */
@Component
public class InMemoryConversationStateStore implements ConversationStateStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryConversationStateStore.class);

  private final ConversationHistoryLoader historyLoader;
  private final Cache<ThreadIdentity, ConversationState> states;

  @Autowired
  public InMemoryConversationStateStore(
      ConversationHistoryLoader historyLoader, ChatAgentProperties properties) {
    this(
        historyLoader,
        properties.getStateCacheMaximumSize(),
        properties.getStateIdleTimeout(),
        Ticker.systemTicker());
  }

  InMemoryConversationStateStore(
      ConversationHistoryLoader historyLoader,
      long maximumSize,
      Duration idleTimeout,
      Ticker ticker) {
    this.historyLoader = historyLoader;
    this.states =
        Caffeine.newBuilder()
            .maximumSize(Math.max(1, maximumSize))
            .expireAfterAccess(idleTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .ticker(ticker)
            .executor(Runnable::run)
            .build();
  }

  @Override
  public ConversationState getOrCreate(ThreadIdentity identity) {
    if (identity == null) {
      throw new IllegalArgumentException("Thread identity is required");
    }
    return states.get(identity, this::restore);
  }

  @Override
  public Optional<ConversationState> find(ThreadIdentity identity) {
    return identity == null ? Optional.empty() : Optional.ofNullable(states.getIfPresent(identity));
  }

  long size() {
    states.cleanUp();
    return states.estimatedSize();
  }

  private ConversationState restore(ThreadIdentity identity) {
    ConversationState state = new ConversationState(identity);
    try {
      List<ConversationMessage> stored = historyLoader.load(identity);
      if (stored != null && !stored.isEmpty()) {
        state.appendAll(stored);
        log.debug("Restored {} message(s) for thread {}", stored.size(), identity.threadId());
      }
    } catch (RuntimeException ex) {
      log.warn(
          "Could not restore history of thread {}, starting empty: {}",
          identity.threadId(),
          ex.getMessage());
    }
    return state;
  }
}
