package com.mk.fx.qa.pingit.registry;

import com.mk.fx.qa.pingit.model.Target;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of targets owned by one process generation.
 *
 * @param generation monotonically increasing generation number, starting at 1
 * @param targets targets in configuration order, names unique
 */
public record TargetSnapshot(long generation, List<Target> targets) {

  public TargetSnapshot {
    Objects.requireNonNull(targets, "targets");
    targets = List.copyOf(targets);
    Set<String> names = new HashSet<>();
    for (Target target : targets) {
      if (!names.add(target.name())) {
        throw new IllegalStateException("Duplicate target name " + target.name());
      }
    }
  }

  public Optional<Target> find(String name) {
    return targets.stream().filter(t -> t.name().equals(name)).findFirst();
  }

  public int size() {
    return targets.size();
  }
}
