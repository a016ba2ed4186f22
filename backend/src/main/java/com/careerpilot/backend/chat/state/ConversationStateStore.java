package com.careerpilot.backend.chat.state;

import com.careerpilot.backend.chat.domain.ConversationState;
import com.careerpilot.backend.chat.domain.ThreadIdentity;
import java.util.Optional;

/** Keeps the live conversation of each thread between turns. */
public interface ConversationStateStore {

  /** Returns the state of the thread, creating an empty one on its first turn. */
  ConversationState getOrCreate(ThreadIdentity identity);

  Optional<ConversationState> find(ThreadIdentity identity);
}
