package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.capability.CapabilityName;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.List;
import java.util.Set;

/** Chooses the next supervisor step from the conversation so far. */
public interface SupervisorPlanner {

  /**
   * @param conversation trimmed history followed by the capability outputs of the current turn
   * @param available capabilities the decision may name
   */
  RoutingDecision plan(
      List<ConversationMessage> conversation, String userContext, Set<CapabilityName> available);
}
