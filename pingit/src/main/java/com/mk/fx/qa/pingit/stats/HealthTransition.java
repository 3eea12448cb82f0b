package com.mk.fx.qa.pingit.stats;

import com.mk.fx.qa.pingit.model.TargetState;

/** Every edge of the target health state machine. */
public enum HealthTransition {
  FIRST_UP(TargetState.UNKNOWN, TargetState.UP),
  FIRST_DOWN(TargetState.UNKNOWN, TargetState.DOWN),
  STILL_UP(TargetState.UP, TargetState.UP),
  WENT_DOWN(TargetState.UP, TargetState.DOWN),
  STILL_DOWN(TargetState.DOWN, TargetState.DOWN),
  RECOVERED(TargetState.DOWN, TargetState.UP);

  private final TargetState from;
  private final TargetState to;

  HealthTransition(TargetState from, TargetState to) {
    this.from = from;
    this.to = to;
  }

  public TargetState from() {
    return from;
  }

  public TargetState to() {
    return to;
  }
}
