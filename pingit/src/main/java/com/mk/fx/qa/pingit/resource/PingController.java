package com.mk.fx.qa.pingit.resource;

import com.mk.fx.qa.pingit.dto.DisconnectHistoryResponse;
import com.mk.fx.qa.pingit.dto.HealthResponse;
import com.mk.fx.qa.pingit.dto.PingHistoryEntry;
import com.mk.fx.qa.pingit.dto.TargetStatsResponse;
import com.mk.fx.qa.pingit.model.Target;
import com.mk.fx.qa.pingit.persistence.PingRepository;
import com.mk.fx.qa.pingit.registry.TargetRegistry;
import com.mk.fx.qa.pingit.service.PingEngine;
import com.mk.fx.qa.pingit.stats.AggregatorRegistry;
import com.mk.fx.qa.pingit.stats.TargetAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Targets", description = "Read-only view of probe targets, statistics and history")
@RestController
@Validated
@RequiredArgsConstructor
public class PingController {

  private final TargetRegistry targetRegistry;
  private final AggregatorRegistry aggregatorRegistry;
  private final PingRepository repository;
  private final PingEngine pingEngine;
  private final ResponseMapper mapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Live statistics
  // -----------------------------------------------------
  @Operation(
      summary = "List targets",
      description = "Returns live statistics of every configured target, in configuration order.")
  @GetMapping("/api/targets")
  public ResponseEntity<List<TargetStatsResponse>> getTargets() {
    List<TargetStatsResponse> body = new ArrayList<>();
    for (Target target : targetRegistry.snapshot().targets()) {
      aggregatorRegistry.get(target.name()).map(this::liveStats).ifPresent(body::add);
    }
    return responseFactory.ok(body);
  }

  @Operation(summary = "Get target", description = "Returns live statistics of one target.")
  @GetMapping("/api/targets/{name}")
  public ResponseEntity<TargetStatsResponse> getTarget(@PathVariable String name) {
    requireTarget(name);
    return aggregatorRegistry
        .get(name)
        .map(this::liveStats)
        .map(responseFactory::ok)
        .orElseThrow(() -> new TargetNotFoundException(name));
  }

  // -----------------------------------------------------
  // Persisted data
  // -----------------------------------------------------
  @Operation(
      summary = "Latest statistics snapshot",
      description = "Returns the most recent statistics snapshot stored for a target.")
  @GetMapping("/api/statistics/{name}")
  public ResponseEntity<?> getStatistics(@PathVariable String name) {
    requireTarget(name);
    return repository
        .latestStatistics(name)
        .<ResponseEntity<?>>map(stats -> responseFactory.ok(mapper.toResponse(stats, null)))
        .orElseGet(
            () -> {
              log.debug("No statistics stored yet for {}", name);
              return responseFactory.notFound("No statistics stored for target: " + name);
            });
  }

  @Operation(
      summary = "Disconnect history",
      description = "Returns stored disconnect events of a target, newest first.")
  @GetMapping("/api/disconnects/{name}")
  public ResponseEntity<DisconnectHistoryResponse> getDisconnects(
      @PathVariable String name,
      @RequestParam(defaultValue = "100") @Min(1) @Max(10_000) int limit) {
    requireTarget(name);
    var events = mapper.toDisconnectResponses(repository.disconnects(name, limit));
    return responseFactory.ok(new DisconnectHistoryResponse(name, events.size(), events));
  }

  @Operation(
      summary = "Ping history",
      description = "Returns stored probe results of a target since a point in time, newest first.")
  @GetMapping("/api/history/{name}")
  public ResponseEntity<List<PingHistoryEntry>> getHistory(
      @PathVariable String name,
      @RequestParam(defaultValue = "0") @PositiveOrZero long sinceMs,
      @RequestParam(defaultValue = "1000") @Min(1) @Max(10_000) int limit) {
    requireTarget(name);
    return responseFactory.ok(mapper.toHistoryEntries(repository.history(name, sinceMs, limit)));
  }

  // -----------------------------------------------------
  // Health
  // -----------------------------------------------------
  @Operation(summary = "Health check", description = "Reports whether probing is running.")
  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = pingEngine.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    var body = new HealthResponse(healthy ? "UP" : "DOWN");
    return healthy ? responseFactory.ok(body) : responseFactory.unavailable(body);
  }

  // -----------------------------------------------------
  // Helpers
  // -----------------------------------------------------
  private void requireTarget(String name) {
    if (targetRegistry.find(name).isEmpty()) {
      throw new TargetNotFoundException(name);
    }
  }

  private TargetStatsResponse liveStats(TargetAggregator aggregator) {
    return mapper.toResponse(aggregator.snapshot(), aggregator.openDisconnect().orElse(null));
  }
}
