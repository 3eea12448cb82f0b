package com.mk.fx.qa.pingit.model;

import java.time.Instant;

/**
 * Immutable view of a target's running statistics. Response time fields are {@code null} until the
 * first successful result.
 */
public record TargetStats(
    String targetName,
    String host,
    long pingCount,
    long successCount,
    long failureCount,
    Double minRt,
    Double maxRt,
    Double avgRt,
    TargetState currentState,
    Instant timestamp) {

  /** Success percentage rounded to two decimals, 0 when nothing was probed yet. */
  public double successRate() {
    if (pingCount == 0) {
      return 0.0;
    }
    return Math.round(successCount * 10_000.0 / pingCount) / 100.0;
  }
}
