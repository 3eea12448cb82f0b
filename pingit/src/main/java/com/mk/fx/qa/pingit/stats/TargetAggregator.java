package com.mk.fx.qa.pingit.stats;

import com.mk.fx.qa.pingit.model.DisconnectEvent;
import com.mk.fx.qa.pingit.model.ProbeResult;
import com.mk.fx.qa.pingit.model.Target;
import com.mk.fx.qa.pingit.model.TargetStats;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Running statistics and disconnect detection for one target.
 *
 * <p>Results must be fed in the order the target produced them. All state is guarded by a lock
 * private to this aggregator, so aggregators of different targets never contend. Readers take the
 * same lock and always see {@code successCount + failureCount == pingCount}.
 */
@Slf4j
public final class TargetAggregator {

  private final Target target;
  private final int reportEvery;
  private final ReentrantLock lock = new ReentrantLock();
  private final HealthStateMachine stateMachine = new HealthStateMachine();
  private final DisconnectTracker disconnects;
  private final RunningStats responseTimes = new RunningStats();

  private long pingCount;
  private long successCount;
  private long failureCount;
  private int resultsSinceReport;
  private Instant lastTimestamp;

  public TargetAggregator(Target target, int reportEvery) {
    this.target = Objects.requireNonNull(target, "target");
    if (reportEvery < 1) {
      throw new IllegalArgumentException("reportEvery must be at least 1");
    }
    this.reportEvery = reportEvery;
    this.disconnects = new DisconnectTracker(target.name(), target.host());
  }

  /**
   * Applies a result, waiting for the lock without bound.
   *
   * @throws IllegalArgumentException if the result belongs to another target
   */
  public AggregationOutcome accept(ProbeResult result) {
    lock.lock();
    try {
      return applyLocked(result);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Applies a result unless the lock cannot be taken within {@code grace}.
   *
   * @return the outcome, or empty if the result was not applied
   */
  public Optional<AggregationOutcome> tryAccept(ProbeResult result, Duration grace)
      throws InterruptedException {
    if (!lock.tryLock(grace.toNanos(), TimeUnit.NANOSECONDS)) {
      return Optional.empty();
    }
    try {
      return Optional.of(applyLocked(result));
    } finally {
      lock.unlock();
    }
  }

  private AggregationOutcome applyLocked(ProbeResult result) {
    if (!target.name().equals(result.targetName())) {
      throw new IllegalArgumentException(
          "Result for " + result.targetName() + " fed to aggregator of " + target.name());
    }
    pingCount++;
    if (result.success()) {
      successCount++;
      responseTimes.record(result.responseTimeMs());
    } else {
      failureCount++;
    }
    lastTimestamp = result.timestamp();

    var transition = stateMachine.apply(result.success());
    var change = disconnects.apply(transition, result).orElse(null);
    logTransition(transition, result, change);

    TargetStats report = null;
    if (++resultsSinceReport >= reportEvery) {
      resultsSinceReport = 0;
      report = snapshotLocked();
      log.debug(
          "Report cycle triggered for {} ({} pings, {} success, {}% rate)",
          target.name(),
          report.pingCount(),
          report.successCount(),
          report.successRate());
    }
    return new AggregationOutcome(transition, change, report);
  }

  private void logTransition(
      HealthTransition transition, ProbeResult result, DisconnectEvent change) {
    switch (transition) {
      case FIRST_UP, FIRST_DOWN -> log.info(
          "Target {} ({}) first seen {}", target.name(), target.host(), transition.to());
      case WENT_DOWN -> log.warn(
          "Disconnect detected for {} ({}): {}", target.name(), target.host(), result.errorKind());
      case RECOVERED -> {
        if (change != null) {
          log.info(
              "Target {} ({}) recovered after {} failed probes ({}s)",
              target.name(),
              target.host(),
              change.consecutiveFailureCount(),
              change.durationSeconds().orElse(0L));
        } else {
          log.info("Target {} ({}) is up", target.name(), target.host());
        }
      }
      default -> {}
    }
  }

  public TargetStats snapshot() {
    lock.lock();
    try {
      return snapshotLocked();
    } finally {
      lock.unlock();
    }
  }

  private TargetStats snapshotLocked() {
    return new TargetStats(
        target.name(),
        target.host(),
        pingCount,
        successCount,
        failureCount,
        responseTimes.min().orElse(null),
        responseTimes.max().orElse(null),
        responseTimes.mean().orElse(null),
        stateMachine.state(),
        lastTimestamp);
  }

  public Optional<DisconnectEvent> openDisconnect() {
    lock.lock();
    try {
      return disconnects.openEvent();
    } finally {
      lock.unlock();
    }
  }

  public Target target() {
    return target;
  }
}
