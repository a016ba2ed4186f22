package com.careerpilot.backend.chat.routing;

import com.careerpilot.backend.chat.capability.CapabilityName;
import com.careerpilot.backend.chat.domain.CapabilityResult;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.JobRecord;
import com.careerpilot.backend.chat.extraction.JobRecordExtractor;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a finished turn gets a jobs table. Typed records returned by the delegation are
 * checked first, then the latest job matcher tool result, then the final assistant answer. Has no
 * side effects.
 */
public class UiRouter {

  private final JobRecordExtractor extractor;

  public UiRouter(JobRecordExtractor extractor) {
    this.extractor = extractor;
  }

  public RouteDecision decide(List<ConversationMessage> turnMessages) {
    return route(turnMessages).decision();
  }

  public RoutingOutcome route(List<ConversationMessage> turnMessages) {
    return route(turnMessages, null);
  }

  /**
   * @param typedResult result carrying records already in typed form, may be {@code null}
   */
  public RoutingOutcome route(
      List<ConversationMessage> turnMessages, CapabilityResult typedResult) {
    if (typedResult != null && typedResult.hasStructured()) {
      List<JobRecord> typed = extractor.extract(typedResult);
      if (!typed.isEmpty()) {
        return RoutingOutcome.annotate(typed);
      }
    }
    if (turnMessages == null || turnMessages.isEmpty()) {
      return RoutingOutcome.terminate();
    }
    List<JobRecord> fromTool =
        latestJobMatcherResult(turnMessages).map(this::extractFrom).orElse(List.of());
    if (!fromTool.isEmpty()) {
      return RoutingOutcome.annotate(fromTool);
    }
    List<JobRecord> fromAnswer =
        finalAssistantMessage(turnMessages).map(this::extractFrom).orElse(List.of());
    if (!fromAnswer.isEmpty()) {
      return RoutingOutcome.annotate(fromAnswer);
    }
    return RoutingOutcome.terminate();
  }

  private List<JobRecord> extractFrom(ConversationMessage message) {
    return extractor.extract(message.content());
  }

  private Optional<ConversationMessage> latestJobMatcherResult(List<ConversationMessage> messages) {
    for (int index = messages.size() - 1; index >= 0; index--) {
      ConversationMessage message = messages.get(index);
      if (message.isTool() && CapabilityName.JOB_MATCHER.code().equals(message.capability())) {
        return Optional.of(message);
      }
    }
    return Optional.empty();
  }

  private Optional<ConversationMessage> finalAssistantMessage(List<ConversationMessage> messages) {
    for (int index = messages.size() - 1; index >= 0; index--) {
      ConversationMessage message = messages.get(index);
      if (message.isAssistant()) {
        return Optional.of(message);
      }
    }
    return Optional.empty();
  }
}
