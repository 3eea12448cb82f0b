package com.mk.fx.qa.pingit.stats;

import com.mk.fx.qa.pingit.model.TargetState;
import java.util.Objects;

/**
 * Three-state health machine ({@code UNKNOWN}, {@code UP}, {@code DOWN}). Not thread-safe, owned
 * by a single {@link TargetAggregator}.
 */
public final class HealthStateMachine {

  private TargetState state = TargetState.UNKNOWN;

  /** Pure transition function. */
  public static HealthTransition transition(TargetState current, boolean success) {
    Objects.requireNonNull(current, "current");
    return switch (current) {
      case UNKNOWN -> success ? HealthTransition.FIRST_UP : HealthTransition.FIRST_DOWN;
      case UP -> success ? HealthTransition.STILL_UP : HealthTransition.WENT_DOWN;
      case DOWN -> success ? HealthTransition.RECOVERED : HealthTransition.STILL_DOWN;
    };
  }

  /** Applies one probe outcome and returns the edge taken. */
  public HealthTransition apply(boolean success) {
    var transition = transition(state, success);
    state = transition.to();
    return transition;
  }

  public TargetState state() {
    return state;
  }
}
