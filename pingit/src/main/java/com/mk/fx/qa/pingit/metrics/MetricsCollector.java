package com.mk.fx.qa.pingit.metrics;

import com.mk.fx.qa.pingit.cfg.MetricsCfg;
import com.mk.fx.qa.pingit.model.ProbeResult;
import com.mk.fx.qa.pingit.model.Target;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-memory store behind the pull metrics endpoint.
 *
 * <p>Keeps the last successful response time per target and the number of disconnect events
 * opened per target. A scrape drains both metrics, so each scrape only reports activity since the
 * previous one. Each metric has its own lock; probers of different targets never wait on each
 * other here.
 */
@Slf4j
@Component
public class MetricsCollector {

  public static final String PING_TIME_METRIC = "pingit_ping_time_ms";
  public static final String DISCONNECT_METRIC = "pingit_disconnect_events";

  private final boolean drainOnScrape;
  private final DrainableSeries pingTimes = new DrainableSeries();
  private final DrainableSeries disconnects = new DrainableSeries();

  @Autowired
  public MetricsCollector(MetricsCfg cfg) {
    this(cfg.isDrainOnScrape());
  }

  MetricsCollector(boolean drainOnScrape) {
    this.drainOnScrape = drainOnScrape;
  }

  /** Updates the response time gauge from a successful result, failures leave it untouched. */
  public void recordResult(Target target, ProbeResult result) {
    if (result.success()) {
      pingTimes.set(target.name(), target.host(), result.responseTimeMs());
    }
  }

  /** Counts one newly opened disconnect event. */
  public void recordDisconnect(Target target) {
    disconnects.add(target.name(), target.host(), 1.0);
  }

  /**
   * Returns the current values. When draining is enabled every gauge and counter is cleared as
   * part of the same step.
   */
  public MetricsScrape scrape() {
    var scrape =
        drainOnScrape
            ? new MetricsScrape(pingTimes.drain(), disconnects.drain())
            : new MetricsScrape(pingTimes.peek(), disconnects.peek());
    log.debug(
        "Metrics scrape: {} ping samples, {} disconnect counters (drain={})",
        scrape.pingTimes().size(),
        scrape.disconnects().size(),
        drainOnScrape);
    return scrape;
  }

  public boolean isDrainOnScrape() {
    return drainOnScrape;
  }
}
