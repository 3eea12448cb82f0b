package com.mk.fx.qa.pingit.persistence;

import com.mk.fx.qa.pingit.model.ProbeResult;
import java.util.Objects;

/** One raw probe result bound for {@code ping_history}. */
public record PingRecord(String host, ProbeResult result) implements PendingWrite {

  public PingRecord {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(result, "result");
  }

  @Override
  public String targetName() {
    return result.targetName();
  }
}
