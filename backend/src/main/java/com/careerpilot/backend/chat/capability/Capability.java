package com.careerpilot.backend.chat.capability;

import com.careerpilot.backend.chat.domain.CapabilityResult;

/**
 * Specialised task handler the supervisor can delegate to. Implementations are created per turn and
 * hold no state across turns.
 */
public interface Capability {

  CapabilityName name();

  /**
   * Performs the task described by {@code request}.
   *
   * @param request instruction written by the supervisor for this capability
   * @param context conversation view and user facts for the current turn
   */
  CapabilityResult invoke(String request, CapabilityContext context);
}
