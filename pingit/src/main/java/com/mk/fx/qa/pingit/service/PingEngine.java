package com.mk.fx.qa.pingit.service;

import com.mk.fx.qa.pingit.cfg.PingitCfg;
import com.mk.fx.qa.pingit.model.Target;
import com.mk.fx.qa.pingit.persistence.DisconnectCloseRecord;
import com.mk.fx.qa.pingit.persistence.PersistenceWriter;
import com.mk.fx.qa.pingit.probe.ProbeScheduler;
import com.mk.fx.qa.pingit.probe.TargetProbe;
import com.mk.fx.qa.pingit.registry.TargetRegistry;
import com.mk.fx.qa.pingit.registry.TargetSnapshot;
import com.mk.fx.qa.pingit.stats.AggregatorRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Owns the probing lifecycle.
 *
 * <p>Starts one {@link ProbeScheduler} for the current target generation once the application is
 * ready, replaces it on reload and stops it on shutdown. Lifecycle methods are serialized on the
 * engine instance.
 */
@Slf4j
@Service
public class PingEngine {

  private static final Duration STOP_MARGIN = Duration.ofSeconds(1);

  private final PingitCfg cfg;
  private final TargetRegistry registry;
  private final AggregatorRegistry aggregators;
  private final TargetProbe probe;
  private final ResultPipeline pipeline;
  private final PersistenceWriter writer;
  private final Clock clock;

  private ProbeScheduler scheduler;

  public PingEngine(
      PingitCfg cfg,
      TargetRegistry registry,
      AggregatorRegistry aggregators,
      TargetProbe probe,
      ResultPipeline pipeline,
      PersistenceWriter writer,
      Clock clock) {
    this.cfg = cfg;
    this.registry = registry;
    this.aggregators = aggregators;
    this.probe = probe;
    this.pipeline = pipeline;
    this.writer = writer;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!cfg.isEnabled()) {
      log.info("Probing disabled (pingit.enabled=false)");
      return;
    }
    start();
  }

  /** Starts probing the current generation. Has no effect when already running. */
  public synchronized void start() {
    if (scheduler != null) {
      return;
    }
    launch(registry.snapshot());
  }

  /**
   * Replaces the targets with the next generation built from {@code targets}.
   *
   * @throws IllegalStateException if target names are not unique
   */
  public synchronized TargetSnapshot reload(List<Target> targets) {
    log.info("Reloading {} targets after generation {}", targets.size(), generation());
    return restart(registry.swap(targets));
  }

  /**
   * Stops the running generation, installs {@code next} and starts probing it. Targets kept with
   * the same name and host keep their running statistics.
   *
   * @throws IllegalArgumentException if {@code next} is not newer than the current generation
   */
  public synchronized TargetSnapshot reload(TargetSnapshot next) {
    log.info(
        "Reloading targets: generation {} -> {}",
        registry.snapshot().generation(),
        next.generation());
    return restart(registry.replace(next));
  }

  private TargetSnapshot restart(TargetSnapshot next) {
    boolean wasRunning = scheduler != null;
    stopScheduler();
    if (wasRunning || cfg.isEnabled()) {
      launch(next);
    } else {
      activate(next);
    }
    return next;
  }

  /**
   * Activates the aggregators of {@code snapshot}. Targets starting from scratch have no open
   * disconnect in memory, so any event still open in the store for them is closed first.
   */
  private void activate(TargetSnapshot snapshot) {
    var closedAt = clock.instant();
    for (String name : aggregators.activate(snapshot)) {
      writer.submit(new DisconnectCloseRecord(name, closedAt));
    }
  }

  private void launch(TargetSnapshot snapshot) {
    activate(snapshot);
    scheduler =
        new ProbeScheduler(
            snapshot.generation(),
            snapshot.targets(),
            probe,
            pipeline,
            cfg.getOverrunPolicy(),
            clock);
    scheduler.start();
  }

  @PreDestroy
  public synchronized void stop() {
    if (scheduler == null) {
      return;
    }
    log.info("Stopping probing for generation {}", scheduler.generation());
    stopScheduler();
  }

  private void stopScheduler() {
    if (scheduler == null) {
      return;
    }
    Duration grace = stopGrace(scheduler);
    if (!scheduler.stop(grace)) {
      log.warn("Generation {} did not stop cleanly within {}", scheduler.generation(), grace);
    }
    scheduler = null;
  }

  /** Longest probe timeout plus the delivery grace, so an in-flight cycle can complete. */
  private Duration stopGrace(ProbeScheduler running) {
    Duration longest = Duration.ZERO;
    for (var prober : running.probers()) {
      if (prober.target().timeout().compareTo(longest) > 0) {
        longest = prober.target().timeout();
      }
    }
    return longest.plus(cfg.getDeliveryGrace()).plus(STOP_MARGIN);
  }

  public synchronized boolean isRunning() {
    return scheduler != null && scheduler.isRunning();
  }

  /** Up while the persistence writer is alive and, when enabled, probing is running. */
  public boolean isHealthy() {
    boolean probing = !cfg.isEnabled() || isRunning();
    return probing && writer.isRunning();
  }

  public synchronized long generation() {
    return registry.snapshot().generation();
  }
}
