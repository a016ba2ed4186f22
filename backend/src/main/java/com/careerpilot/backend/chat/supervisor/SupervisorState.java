package com.careerpilot.backend.chat.supervisor;

/** Steps of a single turn, in the order {@link TurnSupervisor} walks them. */
public enum SupervisorState {
  RECEIVE,
  LOAD_CONTEXT,
  INVOKE,
  ROUTE,
  ANNOTATE,
  END
}
