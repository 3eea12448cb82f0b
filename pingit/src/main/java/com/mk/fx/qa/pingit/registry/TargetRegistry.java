package com.mk.fx.qa.pingit.registry;

import com.mk.fx.qa.pingit.cfg.PingitCfg;
import com.mk.fx.qa.pingit.model.Target;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Holds the current {@link TargetSnapshot}. The snapshot itself never changes; a configuration
 * reload replaces it with a new generation.
 */
@Slf4j
@Component
public class TargetRegistry {

  private final AtomicReference<TargetSnapshot> current;

  @Autowired
  public TargetRegistry(PingitCfg cfg, TargetMapper mapper) {
    this(new TargetSnapshot(1, mapper.toDomain(cfg.getTargets(), cfg)));
  }

  TargetRegistry(TargetSnapshot initial) {
    this.current = new AtomicReference<>(initial);
    log.info(
        "Target registry loaded generation {} with {} targets",
        initial.generation(),
        initial.size());
    for (Target target : initial.targets()) {
      log.debug(
          "Loaded target {} ({}) interval={} timeout={}",
          target.name(),
          target.host(),
          target.interval(),
          target.timeout());
    }
  }

  public TargetSnapshot snapshot() {
    return current.get();
  }

  public Optional<Target> find(String name) {
    return current.get().find(name);
  }

  /**
   * Replaces the current snapshot with a new generation holding the given targets.
   *
   * @return the new snapshot
   * @throws IllegalStateException if target names are not unique
   */
  public TargetSnapshot swap(List<Target> targets) {
    TargetSnapshot next =
        current.updateAndGet(previous -> new TargetSnapshot(previous.generation() + 1, targets));
    log.info(
        "Target registry swapped to generation {} with {} targets", next.generation(), next.size());
    return next;
  }

  /**
   * Installs a snapshot built elsewhere.
   *
   * @throws IllegalArgumentException if its generation is not newer than the current one
   */
  public TargetSnapshot replace(TargetSnapshot next) {
    TargetSnapshot previous =
        current.getAndUpdate(
            existing -> next.generation() > existing.generation() ? next : existing);
    if (next.generation() <= previous.generation()) {
      throw new IllegalArgumentException(
          "Generation "
              + next.generation()
              + " is not newer than current generation "
              + previous.generation());
    }
    log.info(
        "Target registry replaced with generation {} ({} targets)", next.generation(), next.size());
    return next;
  }
}
