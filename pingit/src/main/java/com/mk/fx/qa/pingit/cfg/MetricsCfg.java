package com.mk.fx.qa.pingit.cfg;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "pingit.metrics")
public class MetricsCfg {

  /** Clears gauges and counters after every scrape. Disable to inspect metrics manually. */
  private boolean drainOnScrape = true;
}
