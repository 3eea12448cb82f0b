package com.mk.fx.qa.pingit.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DisconnectEventTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  void open_startsWithOneFailure() {
    var event = DisconnectEvent.open("gw", "10.0.0.1", START, ErrorKind.UNREACHABLE);

    assertTrue(event.isOpen());
    assertEquals(1, event.consecutiveFailureCount());
    assertEquals(Optional.empty(), event.durationSeconds());
  }

  @Test
  void closedAt_clampsToStart() {
    var event = DisconnectEvent.open("gw", "10.0.0.1", START, ErrorKind.TIMEOUT);

    var closed = event.closedAt(START.minusSeconds(3));

    assertEquals(START, closed.endTime());
    assertEquals(Optional.of(0L), closed.durationSeconds());
  }

  @Test
  void closedEvent_rejectsFurtherChanges() {
    var closed =
        DisconnectEvent.open("gw", "10.0.0.1", START, ErrorKind.TIMEOUT)
            .withAnotherFailure()
            .closedAt(START.plusSeconds(90));

    assertEquals(2, closed.consecutiveFailureCount());
    assertEquals(Optional.of(90L), closed.durationSeconds());
    assertThrows(IllegalStateException.class, closed::withAnotherFailure);
    assertThrows(IllegalStateException.class, () -> closed.closedAt(START.plusSeconds(100)));
  }

  @Test
  void constructor_rejectsEndBeforeStart() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new DisconnectEvent(
                "gw", "10.0.0.1", START, START.minusMillis(1), 1, ErrorKind.TIMEOUT));
  }
}
