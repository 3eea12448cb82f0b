package com.mk.fx.qa.pingit.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * An interval during which a target was continuously unreachable. Open while {@code endTime} is
 * {@code null}. Instances are immutable, every change produces a new instance.
 */
public record DisconnectEvent(
    String targetName,
    String host,
    Instant startTime,
    Instant endTime,
    int consecutiveFailureCount,
    ErrorKind reason) {

  public DisconnectEvent {
    Objects.requireNonNull(targetName, "targetName");
    Objects.requireNonNull(startTime, "startTime");
    if (endTime != null && endTime.isBefore(startTime)) {
      throw new IllegalArgumentException("Disconnect event cannot end before it starts");
    }
    if (consecutiveFailureCount < 1) {
      throw new IllegalArgumentException("Disconnect event needs at least one failure");
    }
  }

  public static DisconnectEvent open(
      String targetName, String host, Instant startTime, ErrorKind reason) {
    return new DisconnectEvent(targetName, host, startTime, null, 1, reason);
  }

  public boolean isOpen() {
    return endTime == null;
  }

  public DisconnectEvent withAnotherFailure() {
    if (!isOpen()) {
      throw new IllegalStateException("Cannot add failures to a closed disconnect event");
    }
    return new DisconnectEvent(
        targetName, host, startTime, null, consecutiveFailureCount + 1, reason);
  }

  public DisconnectEvent closedAt(Instant recoveredAt) {
    if (!isOpen()) {
      throw new IllegalStateException("Disconnect event already closed");
    }
    Instant end = recoveredAt.isBefore(startTime) ? startTime : recoveredAt;
    return new DisconnectEvent(targetName, host, startTime, end, consecutiveFailureCount, reason);
  }

  /** Whole seconds between start and end, empty while the event is open. */
  public Optional<Long> durationSeconds() {
    return isOpen()
        ? Optional.empty()
        : Optional.of(Duration.between(startTime, endTime).toSeconds());
  }
}
