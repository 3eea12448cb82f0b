package com.mk.fx.qa.pingit.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one probe cycle. A successful result carries a response time and no error kind, a
 * failed result carries an error kind and no response time.
 */
public record ProbeResult(
    String targetName,
    Instant timestamp,
    boolean success,
    Double responseTimeMs,
    ErrorKind errorKind) {

  public ProbeResult {
    Objects.requireNonNull(targetName, "targetName");
    Objects.requireNonNull(timestamp, "timestamp");
    if (success && (responseTimeMs == null || errorKind != null)) {
      throw new IllegalArgumentException(
          "Successful result requires a response time and no error kind");
    }
    if (!success && (errorKind == null || responseTimeMs != null)) {
      throw new IllegalArgumentException(
          "Failed result requires an error kind and no response time");
    }
  }

  public static ProbeResult success(String targetName, Instant timestamp, double responseTimeMs) {
    return new ProbeResult(targetName, timestamp, true, Math.max(0.0, responseTimeMs), null);
  }

  public static ProbeResult failure(String targetName, Instant timestamp, ErrorKind errorKind) {
    return new ProbeResult(targetName, timestamp, false, null, errorKind);
  }
}
