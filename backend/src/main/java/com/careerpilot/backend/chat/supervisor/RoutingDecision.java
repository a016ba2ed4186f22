package com.careerpilot.backend.chat.supervisor;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/** Planner output for one supervisor step. */
public record RoutingDecision(
    @JsonPropertyDescription("DELEGATE to hand work to an agent, RESPOND to answer the user")
        Action action,
    @JsonPropertyDescription("Agent to delegate to: researcher, tailor or job_matcher")
        String capability,
    @JsonPropertyDescription("Instructions for the agent when delegating") String instructions,
    @JsonPropertyDescription("Final answer for the user when responding") String response) {

  public enum Action {
    DELEGATE,
    RESPOND
  }

  public static RoutingDecision respond(String response) {
    return new RoutingDecision(Action.RESPOND, null, null, response);
  }

  public static RoutingDecision delegate(String capability, String instructions) {
    return new RoutingDecision(Action.DELEGATE, capability, instructions, null);
  }

  public boolean isDelegate() {
    return action == Action.DELEGATE;
  }
}
