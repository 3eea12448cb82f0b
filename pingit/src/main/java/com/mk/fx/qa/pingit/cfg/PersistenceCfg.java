package com.mk.fx.qa.pingit.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Persistence writer settings bound from {@code pingit.persistence}. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "pingit.persistence")
public class PersistenceCfg {

  /** Pending writes held in memory before the oldest is dropped. */
  @Min(1)
  private int queueCapacity = 10_000;

  /** Maximum writes stored in one transaction. */
  @Min(1)
  private int batchSize = 200;

  /** Longest the writer waits to fill a batch. */
  @NotNull private Duration flushInterval = Duration.ofSeconds(1);

  /** Attempts after the first failed write of a batch. */
  @Min(0)
  @Max(10)
  private int maxRetries = 3;

  /** Backoff unit, attempt {@code n} waits {@code n * retryBackoff}. */
  @NotNull private Duration retryBackoff = Duration.ofMillis(200);

  /** Time allowed to drain pending writes on shutdown. */
  @NotNull private Duration shutdownGrace = Duration.ofSeconds(5);
}
