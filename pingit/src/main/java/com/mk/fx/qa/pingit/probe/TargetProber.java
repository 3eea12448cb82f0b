package com.mk.fx.qa.pingit.probe;

import com.mk.fx.qa.pingit.model.ErrorKind;
import com.mk.fx.qa.pingit.model.ProbeResult;
import com.mk.fx.qa.pingit.model.Target;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Probe loop for a single target. Runs on its own thread until the shutdown signal is raised,
 * delivering exactly one {@link ProbeResult} per cycle.
 */
@Slf4j
public final class TargetProber implements Runnable {

  private final Target target;
  private final TargetProbe probe;
  private final ProbeResultSink sink;
  private final OverrunPolicy overrunPolicy;
  private final ShutdownSignal shutdownSignal;
  private final Clock clock;
  private final AtomicLong completedCycles = new AtomicLong();
  private Instant lastTimestamp;

  public TargetProber(
      Target target,
      TargetProbe probe,
      ProbeResultSink sink,
      OverrunPolicy overrunPolicy,
      ShutdownSignal shutdownSignal,
      Clock clock) {
    this.target = Objects.requireNonNull(target, "target");
    this.probe = Objects.requireNonNull(probe, "probe");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.overrunPolicy = Objects.requireNonNull(overrunPolicy, "overrunPolicy");
    this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void run() {
    long intervalNanos = target.interval().toNanos();
    Thread.currentThread().setName("pingit-prober-" + target.name());
    log.info(
        "Target {} prober started (host={}, interval={}, timeout={})",
        target.name(),
        target.host(),
        target.interval(),
        target.timeout());
    try {
      while (!shutdownSignal.isRaised()) {
        long cycleStart = System.nanoTime();
        runCycle();
        long now = System.nanoTime();
        long wait = overrunPolicy.nextCycleStart(cycleStart, intervalNanos, now) - now;
        if (wait <= 0) {
          log.debug("Target {} probe overran its interval of {}", target.name(), target.interval());
          continue;
        }
        if (shutdownSignal.await(wait, TimeUnit.NANOSECONDS)) {
          break;
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.info("Target {} prober interrupted", target.name());
    }
    log.info("Target {} prober stopped after {} cycles", target.name(), completedCycles.get());
  }

  private void runCycle() {
    var timestamp = nextTimestamp();
    ProbeResult result;
    try {
      result = probe.probe(target, timestamp);
    } catch (RuntimeException ex) {
      log.error("Target {} probe raised unexpectedly: {}", target.name(), ex.getMessage(), ex);
      result = ProbeResult.failure(target.name(), timestamp, ErrorKind.UNREACHABLE);
    }
    try {
      sink.deliver(target, result);
    } catch (RuntimeException ex) {
      log.error("Target {} result delivery failed: {}", target.name(), ex.getMessage(), ex);
    }
    completedCycles.incrementAndGet();
  }

  /** Wall clock time of the cycle start, never earlier than the previous cycle's. */
  private Instant nextTimestamp() {
    var now = clock.instant();
    if (lastTimestamp != null && now.isBefore(lastTimestamp)) {
      now = lastTimestamp;
    }
    lastTimestamp = now;
    return now;
  }

  public Target target() {
    return target;
  }

  public long completedCycles() {
    return completedCycles.get();
  }
}
