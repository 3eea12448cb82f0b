package com.mk.fx.qa.pingit.registry;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.pingit.cfg.PingitCfg;
import com.mk.fx.qa.pingit.model.Target;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class TargetRegistryTest {

  private static PingitCfg.TargetEntry entry(String name, String host, Duration timeout) {
    var entry = new PingitCfg.TargetEntry();
    entry.setName(name);
    entry.setHost(host);
    entry.setTimeout(timeout);
    return entry;
  }

  private static PingitCfg cfg(PingitCfg.TargetEntry... entries) {
    var cfg = new PingitCfg();
    cfg.setInterval(Duration.ofSeconds(30));
    cfg.setTimeout(Duration.ofSeconds(4));
    cfg.setTargets(List.of(entries));
    return cfg;
  }

  @Test
  void constructor_mapsEntriesAndAppliesDefaults() {
    var registry =
        new TargetRegistry(
            cfg(entry("dns", "8.8.8.8", null), entry("gw", "10.0.0.1", Duration.ofSeconds(1))),
            Mappers.getMapper(TargetMapper.class));

    var snapshot = registry.snapshot();
    assertEquals(1, snapshot.generation());
    assertEquals(2, snapshot.size());

    var dns = registry.find("dns").orElseThrow();
    assertEquals(Duration.ofSeconds(30), dns.interval());
    assertEquals(Duration.ofSeconds(4), dns.timeout());
    assertEquals(Duration.ofSeconds(1), registry.find("gw").orElseThrow().timeout());
  }

  @Test
  void constructor_rejectsDuplicateNames() {
    var cfg = cfg(entry("dns", "8.8.8.8", null), entry("dns", "1.1.1.1", null));
    var mapper = Mappers.getMapper(TargetMapper.class);
    assertThrows(IllegalStateException.class, () -> new TargetRegistry(cfg, mapper));
  }

  @Test
  void swap_incrementsGeneration() {
    var registry = new TargetRegistry(new TargetSnapshot(1, List.of()));
    var target = new Target("a", "h", Duration.ofSeconds(1), Duration.ofSeconds(1));

    var next = registry.swap(List.of(target));

    assertEquals(2, next.generation());
    assertSame(next, registry.snapshot());
    assertEquals(target, registry.find("a").orElseThrow());
  }

  @Test
  void replace_rejectsStaleGeneration() {
    var registry = new TargetRegistry(new TargetSnapshot(3, List.of()));

    assertThrows(
        IllegalArgumentException.class, () -> registry.replace(new TargetSnapshot(3, List.of())));
    assertEquals(3, registry.snapshot().generation());

    registry.replace(new TargetSnapshot(4, List.of()));
    assertEquals(4, registry.snapshot().generation());
  }
}
