package com.careerpilot.backend.chat.routing;

public enum RouteDecision {
  ANNOTATE,
  TERMINATE
}
