package com.mk.fx.qa.pingit.probe;

import com.mk.fx.qa.pingit.model.ProbeResult;
import com.mk.fx.qa.pingit.model.Target;
import java.time.Instant;

/** Performs one reachability check. Implementations must be thread-safe and must not throw. */
public interface TargetProbe {

  /**
   * Probes the target once, bounded by {@link Target#timeout()}.
   *
   * @param target target to probe
   * @param startedAt cycle start, used as the result timestamp
   * @return the probe result, failed results carry an error kind
   */
  ProbeResult probe(Target target, Instant startedAt);
}
