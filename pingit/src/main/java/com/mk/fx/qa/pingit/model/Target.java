package com.mk.fx.qa.pingit.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A configured probe target. Immutable for the life of a process generation.
 *
 * @param name unique target name
 * @param host host name or literal address to probe
 * @param interval time between the starts of two consecutive probe cycles
 * @param timeout maximum time to wait for a single probe reply
 */
public record Target(String name, String host, Duration interval, Duration timeout) {

  public Target {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(timeout, "timeout");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Target name must not be blank");
    }
    if (host.isBlank()) {
      throw new IllegalArgumentException("Target host must not be blank for " + name);
    }
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("Target interval must be positive for " + name);
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("Target timeout must be positive for " + name);
    }
  }
}
