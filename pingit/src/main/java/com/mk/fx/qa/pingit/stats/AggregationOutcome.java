package com.mk.fx.qa.pingit.stats;

import com.mk.fx.qa.pingit.model.DisconnectEvent;
import com.mk.fx.qa.pingit.model.TargetStats;
import java.util.Optional;

/**
 * What one probe result changed in its target's aggregator.
 *
 * @param transition health edge taken
 * @param disconnectChange disconnect event opened, extended or closed by the result, or null
 * @param reportSnapshot statistics snapshot due for persistence, or null
 */
public record AggregationOutcome(
    HealthTransition transition, DisconnectEvent disconnectChange, TargetStats reportSnapshot) {

  public Optional<DisconnectEvent> disconnect() {
    return Optional.ofNullable(disconnectChange);
  }

  public Optional<TargetStats> report() {
    return Optional.ofNullable(reportSnapshot);
  }

  public boolean disconnectOpened() {
    return transition == HealthTransition.WENT_DOWN;
  }
}
