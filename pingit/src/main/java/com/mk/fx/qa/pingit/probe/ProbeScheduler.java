package com.mk.fx.qa.pingit.probe;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.pingit.model.Target;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one {@link TargetProber} per target, each on a dedicated thread, for one generation of
 * targets. Probers never share a thread, so a target blocked on its probe timeout cannot delay
 * another.
 */
@Slf4j
public final class ProbeScheduler {

  private final long generation;
  private final ShutdownSignal shutdownSignal = new ShutdownSignal();
  private final List<TargetProber> probers;
  private final ExecutorService executor;
  private final AtomicBoolean started = new AtomicBoolean(false);

  public ProbeScheduler(
      long generation,
      List<Target> targets,
      TargetProbe probe,
      ProbeResultSink sink,
      OverrunPolicy overrunPolicy,
      Clock clock) {
    Objects.requireNonNull(targets, "targets");
    Objects.requireNonNull(probe, "probe");
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(overrunPolicy, "overrunPolicy");
    Objects.requireNonNull(clock, "clock");
    this.generation = generation;
    List<TargetProber> created = new ArrayList<>(targets.size());
    for (Target target : targets) {
      created.add(new TargetProber(target, probe, sink, overrunPolicy, shutdownSignal, clock));
    }
    this.probers = List.copyOf(created);
    this.executor = probers.isEmpty() ? null : newFixedThreadPool(probers.size(), threadFactory());
  }

  private ThreadFactory threadFactory() {
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("pingit-prober-g" + generation + "-" + thread.getId());
      thread.setDaemon(true);
      return thread;
    };
  }

  /** Starts every prober. Calling it more than once has no effect. */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    if (executor == null) {
      log.warn("Generation {} has no targets, nothing to probe", generation);
      return;
    }
    for (TargetProber prober : probers) {
      executor.execute(prober);
    }
    log.info("Generation {} probing {} targets", generation, probers.size());
  }

  /**
   * Raises the shutdown signal and waits for in-flight probes to finish. Probers that are still
   * running after {@code grace} are interrupted.
   *
   * @return true if every prober stopped within the grace period
   */
  public boolean stop(Duration grace) {
    shutdownSignal.raise();
    if (executor == null) {
      return true;
    }
    executor.shutdown();
    try {
      if (executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        log.info("Generation {} probers stopped", generation);
        return true;
      }
      log.warn("Generation {} probers still running after {}, interrupting", generation, grace);
      executor.shutdownNow();
      return false;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
      return false;
    }
  }

  public boolean isRunning() {
    return started.get() && !shutdownSignal.isRaised();
  }

  public long generation() {
    return generation;
  }

  public List<TargetProber> probers() {
    return probers;
  }
}
