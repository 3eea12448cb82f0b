package com.mk.fx.qa.pingit.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.pingit.cfg.PingitCfg;
import com.mk.fx.qa.pingit.metrics.MetricsCollector;
import com.mk.fx.qa.pingit.model.ProbeResult;
import com.mk.fx.qa.pingit.model.Target;
import com.mk.fx.qa.pingit.persistence.DisconnectRecord;
import com.mk.fx.qa.pingit.persistence.PersistenceWriter;
import com.mk.fx.qa.pingit.persistence.PingRecord;
import com.mk.fx.qa.pingit.persistence.StatsRecord;
import com.mk.fx.qa.pingit.probe.ProbeResultSink;
import com.mk.fx.qa.pingit.stats.AggregationOutcome;
import com.mk.fx.qa.pingit.stats.AggregatorRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fans each probe result out to the metrics collector, the target's aggregator and the persistence
 * queue. Runs on the prober thread of the result's target.
 *
 * <p>Handing a result to its aggregator waits at most the delivery grace. A result that misses it
 * is still stored and exported, but is counted as skipped and left out of the running statistics.
 */
@Slf4j
@Component
public class ResultPipeline implements ProbeResultSink {

  private final AggregatorRegistry aggregators;
  private final MetricsCollector metrics;
  private final PersistenceWriter writer;
  private final Duration deliveryGrace;
  private final AtomicLong skipped = new AtomicLong();

  public ResultPipeline(
      AggregatorRegistry aggregators,
      MetricsCollector metrics,
      PersistenceWriter writer,
      PingitCfg cfg) {
    this.aggregators = aggregators;
    this.metrics = metrics;
    this.writer = writer;
    this.deliveryGrace = cfg.getDeliveryGrace();
  }

  @Override
  public void deliver(Target target, ProbeResult result) {
    metrics.recordResult(target, result);
    writer.submit(new PingRecord(target.host(), result));

    var aggregator = aggregators.get(target.name());
    if (aggregator.isEmpty()) {
      log.warn("Target {} has no active aggregator, result not aggregated", target.name());
      return;
    }

    Optional<AggregationOutcome> outcome;
    try {
      outcome = aggregator.get().tryAccept(result, deliveryGrace);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.debug("Target {} interrupted while delivering a result", target.name());
      return;
    }
    if (outcome.isEmpty()) {
      log.warn(
          "Target {} aggregator busy for more than {}, result at {} not aggregated "
              + "({} skipped so far)",
          target.name(),
          deliveryGrace,
          result.timestamp(),
          skipped.incrementAndGet());
      return;
    }

    var applied = outcome.get();
    if (applied.disconnectOpened()) {
      metrics.recordDisconnect(target);
    }
    applied.disconnect().ifPresent(event -> writer.submit(new DisconnectRecord(event)));
    applied.report().ifPresent(stats -> writer.submit(new StatsRecord(stats)));
  }

  @VisibleForTesting
  long skippedCount() {
    return skipped.get();
  }
}
