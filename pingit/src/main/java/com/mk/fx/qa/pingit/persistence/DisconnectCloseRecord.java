package com.mk.fx.qa.pingit.persistence;

import java.time.Instant;
import java.util.Objects;

/**
 * Closes, as of {@code closedAt}, every stored disconnect event of a target that is still open and
 * started no later than that instant. Queued when a target's running state is discarded, so an
 * event left open by a previous aggregator or process does not stay open next to a new one.
 */
public record DisconnectCloseRecord(String targetName, Instant closedAt) implements PendingWrite {

  public DisconnectCloseRecord {
    Objects.requireNonNull(targetName, "targetName");
    Objects.requireNonNull(closedAt, "closedAt");
  }
}
