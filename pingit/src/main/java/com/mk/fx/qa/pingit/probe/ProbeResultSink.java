package com.mk.fx.qa.pingit.probe;

import com.mk.fx.qa.pingit.model.ProbeResult;
import com.mk.fx.qa.pingit.model.Target;

/** Downstream consumer of probe results. Called from the target's own prober thread. */
public interface ProbeResultSink {

  void deliver(Target target, ProbeResult result);
}
