package com.mk.fx.qa.pingit.stats;

import java.util.Optional;

/**
 * Running min/max/mean over successful response times without keeping the samples. Not
 * thread-safe, guarded by the owning aggregator's lock.
 */
final class RunningStats {

  private long count;
  private double min = Double.MAX_VALUE;
  private double max = -Double.MAX_VALUE;
  private double mean;

  void record(double value) {
    count++;
    min = Math.min(min, value);
    max = Math.max(max, value);
    mean += (value - mean) / count;
  }

  Optional<Double> min() {
    return count == 0 ? Optional.empty() : Optional.of(min);
  }

  Optional<Double> max() {
    return count == 0 ? Optional.empty() : Optional.of(max);
  }

  /** Clamped into [min, max] so rounding drift never breaks the ordering. */
  Optional<Double> mean() {
    return count == 0 ? Optional.empty() : Optional.of(Math.max(min, Math.min(max, mean)));
  }
}
