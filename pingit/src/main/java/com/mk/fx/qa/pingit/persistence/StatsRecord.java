package com.mk.fx.qa.pingit.persistence;

import com.mk.fx.qa.pingit.model.TargetStats;
import java.util.Objects;

/** A periodic statistics snapshot bound for {@code ping_statistics}. */
public record StatsRecord(TargetStats stats) implements PendingWrite {

  public StatsRecord {
    Objects.requireNonNull(stats, "stats");
    Objects.requireNonNull(stats.timestamp(), "stats.timestamp");
  }

  @Override
  public String targetName() {
    return stats.targetName();
  }
}
