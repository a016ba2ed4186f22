package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.capability.Capability;
import com.careerpilot.backend.chat.capability.CapabilityContext;
import com.careerpilot.backend.chat.capability.CapabilityFactory;
import com.careerpilot.backend.chat.capability.CapabilityName;
import com.careerpilot.backend.chat.capability.CapabilityRegistry;
import com.careerpilot.backend.chat.domain.CapabilityResult;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.JobRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Planner-driven delegation: the planner picks a capability, the capability runs, its output is
 * fed back to the planner, until the planner answers. Planning calls and capability calls each
 * consume one budget step.
 */
@Component
public class SupervisorDelegationBoundary implements DelegationBoundary {

  private static final Logger log = LoggerFactory.getLogger(SupervisorDelegationBoundary.class);

  static final String SUPERVISOR_SOURCE = "supervisor";

  private final CapabilityFactory capabilityFactory;
  private final SupervisorPlanner planner;

  public SupervisorDelegationBoundary(
      CapabilityFactory capabilityFactory, SupervisorPlanner planner) {
    this.capabilityFactory = capabilityFactory;
    this.planner = planner;
  }

  @Override
  public DelegationResult delegate(
      List<ConversationMessage> history, DelegationContext context, DelegationBudget budget) {
    CapabilityRegistry registry = capabilityFactory.createRegistry();
    CapabilityContext capabilityContext =
        new CapabilityContext(context.userId().orElse(null), context.userContext(), history);

    List<ConversationMessage> emitted = new ArrayList<>();
    List<JobRecord> structured = null;
    CapabilityResult lastResult = null;

    while (true) {
      budget.consumeStep();
      RoutingDecision decision =
          planner.plan(conversation(history, emitted), context.userContext(), registry.names());

      if (!decision.isDelegate()) {
        String text = decision.response();
        if (!StringUtils.hasText(text) && lastResult != null) {
          text = lastResult.text();
        }
        log.debug(
            "Supervisor answered after {} step(s) and {} capability call(s)",
            budget.usedSteps(),
            emitted.size());
        return new DelegationResult(text, structured, emitted, false);
      }

      Optional<Capability> capability = registry.find(decision.capability());
      if (capability.isEmpty()) {
        log.debug("Planner picked unknown capability '{}'", decision.capability());
        emit(
            emitted,
            budget,
            ConversationMessage.tool(
                SUPERVISOR_SOURCE,
                "Unknown agent '"
                    + decision.capability()
                    + "'. Choose one of the available agents or answer the user."));
        continue;
      }

      budget.consumeStep();
      CapabilityName name = capability.get().name();
      CapabilityResult result = capability.get().invoke(decision.instructions(), capabilityContext);
      log.debug("Capability {} finished at step {}", name.code(), budget.usedSteps());
      emit(emitted, budget, ConversationMessage.tool(name.code(), result.text()));
      budget.recordPartial(result.text());
      if (name == CapabilityName.JOB_MATCHER) {
        // typed records always belong to the latest job matcher message
        structured = result.structured();
      }
      lastResult = result;
    }
  }

  private static void emit(
      List<ConversationMessage> emitted, DelegationBudget budget, ConversationMessage message) {
    emitted.add(message);
    budget.recordEmitted(message);
  }

  private static List<ConversationMessage> conversation(
      List<ConversationMessage> history, List<ConversationMessage> emitted) {
    List<ConversationMessage> conversation = new ArrayList<>(history.size() + emitted.size());
    conversation.addAll(history);
    conversation.addAll(emitted);
    return conversation;
  }
}
