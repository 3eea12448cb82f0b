package com.mk.fx.qa.pingit.stats;

import com.mk.fx.qa.pingit.cfg.PingitCfg;
import com.mk.fx.qa.pingit.model.Target;
import com.mk.fx.qa.pingit.model.TargetStats;
import com.mk.fx.qa.pingit.registry.TargetSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Thread-safe registry of per-target aggregators.
 *
 * <p>One {@link TargetAggregator} exists per active target. Activating a new target snapshot keeps
 * the aggregators of targets that are still configured with the same host and drops the rest.
 */
@Slf4j
@Component
public class AggregatorRegistry {

  private final int reportEvery;
  private final Map<String, TargetAggregator> aggregators = new ConcurrentHashMap<>();
  private volatile List<String> order = List.of();

  @Autowired
  public AggregatorRegistry(PingitCfg cfg) {
    this(cfg.getReporting().getInterval());
  }

  AggregatorRegistry(int reportEvery) {
    this.reportEvery = reportEvery;
  }

  /**
   * Makes {@code snapshot} the active set of targets.
   *
   * @return names of the targets whose running state was discarded or started from scratch: new
   *     targets, targets whose host changed and targets no longer configured
   */
  public synchronized List<String> activate(TargetSnapshot snapshot) {
    List<String> names = new ArrayList<>(snapshot.size());
    List<String> reset = new ArrayList<>();
    for (Target target : snapshot.targets()) {
      names.add(target.name());
      var existing = aggregators.get(target.name());
      if (existing == null || !existing.target().host().equals(target.host())) {
        aggregators.put(target.name(), new TargetAggregator(target, reportEvery));
        reset.add(target.name());
      }
    }
    for (String name : List.copyOf(aggregators.keySet())) {
      if (!names.contains(name)) {
        aggregators.remove(name);
        reset.add(name);
      }
    }
    order = List.copyOf(names);
    log.info("Aggregators active for generation {}: {}", snapshot.generation(), order);
    return reset;
  }

  public Optional<TargetAggregator> get(String targetName) {
    return Optional.ofNullable(aggregators.get(targetName));
  }

  /** Live statistics of every active target, in configuration order. */
  public List<TargetStats> snapshots() {
    List<TargetStats> result = new ArrayList<>();
    for (String name : order) {
      var aggregator = aggregators.get(name);
      if (aggregator != null) {
        result.add(aggregator.snapshot());
      }
    }
    return result;
  }
}
