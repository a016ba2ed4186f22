package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.domain.ThreadIdentity;
import java.util.Optional;

/**
 * @param identity thread owner, {@code null} for anonymous turns
 * @param userContext formatted user summary or the no-context sentinel
 */
public record DelegationContext(ThreadIdentity identity, String userContext) {

  public DelegationContext {
    userContext = userContext != null ? userContext : "";
  }

  public Optional<String> userId() {
    return identity != null ? Optional.of(identity.userId()) : Optional.empty();
  }
}
