package com.careerpilot.backend.chat.routing;

import com.careerpilot.backend.chat.domain.JobRecord;
import java.util.List;

public record RoutingOutcome(RouteDecision decision, List<JobRecord> jobs) {

  private static final RoutingOutcome TERMINATE =
      new RoutingOutcome(RouteDecision.TERMINATE, List.of());

  public RoutingOutcome {
    jobs = jobs != null ? List.copyOf(jobs) : List.of();
  }

  public static RoutingOutcome terminate() {
    return TERMINATE;
  }

  public static RoutingOutcome annotate(List<JobRecord> jobs) {
    return new RoutingOutcome(RouteDecision.ANNOTATE, jobs);
  }

  public boolean shouldAnnotate() {
    return decision == RouteDecision.ANNOTATE;
  }
}
