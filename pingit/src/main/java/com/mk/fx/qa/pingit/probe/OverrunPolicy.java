package com.mk.fx.qa.pingit.probe;

/**
 * Decides when the next probe cycle starts. Cycles are paced from the start of the previous cycle;
 * the policies only differ once a probe outlasts its interval.
 */
public enum OverrunPolicy {

  /** Start the next cycle right after the overrunning one completes. */
  IMMEDIATE {
    @Override
    long nextCycleStart(long cycleStartNanos, long intervalNanos, long nowNanos) {
      return Math.max(cycleStartNanos + intervalNanos, nowNanos);
    }
  },

  /** Skip the slots that were missed and wait for the next one on the fixed-rate grid. */
  SKIP_MISSED {
    @Override
    long nextCycleStart(long cycleStartNanos, long intervalNanos, long nowNanos) {
      long next = cycleStartNanos + intervalNanos;
      if (next >= nowNanos) {
        return next;
      }
      long missed = (nowNanos - cycleStartNanos + intervalNanos - 1) / intervalNanos;
      return cycleStartNanos + missed * intervalNanos;
    }
  };

  abstract long nextCycleStart(long cycleStartNanos, long intervalNanos, long nowNanos);
}
