package com.mk.fx.qa.pingit.cfg;

import com.mk.fx.qa.pingit.probe.OverrunPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Probe engine settings bound from the {@code pingit} prefix.
 *
 * <pre>{@code
 * pingit:
 *   interval: 60s
 *   timeout: 5s
 *   reporting:
 *     interval: 10
 *   targets:
 *     - name: google_dns
 *       host: 8.8.8.8
 *       timeout: 2s
 * }</pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "pingit")
public class PingitCfg {

  /** Starts probing once the application is ready. */
  private boolean enabled = true;

  /** Default interval between probe cycle starts. */
  @NotNull private Duration interval = Duration.ofSeconds(60);

  /** Default probe timeout. */
  @NotNull private Duration timeout = Duration.ofSeconds(5);

  /** What a prober does when a probe outlasts its interval. */
  @NotNull private OverrunPolicy overrunPolicy = OverrunPolicy.IMMEDIATE;

  /** Longest a prober waits to hand a result to its aggregator. */
  @NotNull private Duration deliveryGrace = Duration.ofMillis(500);

  @Valid @NotNull private Reporting reporting = new Reporting();

  @Valid @NotNull private List<TargetEntry> targets = new ArrayList<>();

  @Data
  public static class Reporting {

    /** Statistics snapshot cadence, in probe results per target. */
    @Min(1)
    private int interval = 10;
  }

  @Data
  public static class TargetEntry {

    @NotBlank private String name;

    @NotBlank private String host;

    /** Optional, falls back to {@link PingitCfg#getInterval()}. */
    private Duration interval;

    /** Optional, falls back to {@link PingitCfg#getTimeout()}. */
    private Duration timeout;
  }
}
