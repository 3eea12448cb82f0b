package com.mk.fx.qa.pingit.stats;

import com.mk.fx.qa.pingit.model.DisconnectEvent;
import com.mk.fx.qa.pingit.model.ProbeResult;
import java.util.Optional;

/**
 * Opens, extends and closes disconnect events from health transitions. Holds at most one open
 * event. Not thread-safe, owned by a single {@link TargetAggregator}.
 */
final class DisconnectTracker {

  private final String targetName;
  private final String host;
  private DisconnectEvent openEvent;

  DisconnectTracker(String targetName, String host) {
    this.targetName = targetName;
    this.host = host;
  }

  /**
   * Applies a transition caused by {@code result}.
   *
   * @return the event as changed by this transition, empty when no event changed
   */
  Optional<DisconnectEvent> apply(HealthTransition transition, ProbeResult result) {
    return switch (transition) {
      case WENT_DOWN -> {
        if (openEvent != null) {
          throw new IllegalStateException(
              "Target " + targetName + " already has an open disconnect event");
        }
        openEvent =
            DisconnectEvent.open(targetName, host, result.timestamp(), result.errorKind());
        yield Optional.of(openEvent);
      }
      case STILL_DOWN -> {
        // a target that started DOWN has nothing open to extend
        if (openEvent == null) {
          yield Optional.empty();
        }
        openEvent = openEvent.withAnotherFailure();
        yield Optional.of(openEvent);
      }
      case RECOVERED -> {
        if (openEvent == null) {
          yield Optional.empty();
        }
        var closed = openEvent.closedAt(result.timestamp());
        openEvent = null;
        yield Optional.of(closed);
      }
      case FIRST_UP, FIRST_DOWN, STILL_UP -> Optional.empty();
    };
  }

  Optional<DisconnectEvent> openEvent() {
    return Optional.ofNullable(openEvent);
  }
}
