package com.mk.fx.qa.pingit.metrics;

import java.util.List;

/**
 * Values returned by one scrape.
 *
 * @param pingTimes last successful response time per target, in milliseconds
 * @param disconnects disconnect events opened per target since the previous drain
 */
public record MetricsScrape(List<MetricSample> pingTimes, List<MetricSample> disconnects) {

  public boolean isEmpty() {
    return pingTimes.isEmpty() && disconnects.isEmpty();
  }
}
