package com.mk.fx.qa.pingit.resource;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.mk.fx.qa.pingit.cfg.ObjectMapperConfig;
import com.mk.fx.qa.pingit.model.DisconnectEvent;
import com.mk.fx.qa.pingit.model.ErrorKind;
import com.mk.fx.qa.pingit.model.ProbeResult;
import com.mk.fx.qa.pingit.model.Target;
import com.mk.fx.qa.pingit.model.TargetState;
import com.mk.fx.qa.pingit.model.TargetStats;
import com.mk.fx.qa.pingit.persistence.PersistenceException;
import com.mk.fx.qa.pingit.persistence.PingRecord;
import com.mk.fx.qa.pingit.persistence.PingRepository;
import com.mk.fx.qa.pingit.registry.TargetRegistry;
import com.mk.fx.qa.pingit.registry.TargetSnapshot;
import com.mk.fx.qa.pingit.service.PingEngine;
import com.mk.fx.qa.pingit.stats.AggregatorRegistry;
import com.mk.fx.qa.pingit.stats.TargetAggregator;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = PingController.class)
@Import({
  ApiResponseFactory.class,
  GlobalExceptionHandler.class,
  ResponseMapperImpl.class,
  ObjectMapperConfig.class
})
class PingControllerTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Target GW =
      new Target("gw", "10.0.0.1", Duration.ofSeconds(10), Duration.ofSeconds(1));

  @Autowired MockMvc mvc;

  @MockBean TargetRegistry targetRegistry;
  @MockBean AggregatorRegistry aggregatorRegistry;
  @MockBean PingRepository repository;
  @MockBean PingEngine pingEngine;

  private TargetAggregator aggregator;

  @BeforeEach
  void setUp() {
    when(targetRegistry.snapshot()).thenReturn(new TargetSnapshot(1, List.of(GW)));
    when(targetRegistry.find("gw")).thenReturn(Optional.of(GW));
    when(targetRegistry.find("missing")).thenReturn(Optional.empty());
    aggregator = new TargetAggregator(GW, 10);
    when(aggregatorRegistry.get("gw")).thenReturn(Optional.of(aggregator));
  }

  @Test
  void getTargets_returnsLiveStats() throws Exception {
    aggregator.accept(ProbeResult.success("gw", T0, 8.0));
    aggregator.accept(ProbeResult.failure("gw", T0.plusSeconds(10), ErrorKind.TIMEOUT));

    mvc.perform(get("/api/targets"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].targetName").value("gw"))
        .andExpect(jsonPath("$[0].pingCount").value(2))
        .andExpect(jsonPath("$[0].successRate").value(50.0))
        .andExpect(jsonPath("$[0].currentState").value("DOWN"))
        .andExpect(jsonPath("$[0].statusCode").value(0))
        .andExpect(jsonPath("$[0].openDisconnect.disconnectCount").value(1))
        .andExpect(jsonPath("$[0].openDisconnect.reason").value("TIMEOUT"));
  }

  @Test
  void getTarget_unknownIsNotFound() throws Exception {
    mvc.perform(get("/api/targets/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Not Found"))
        .andExpect(jsonPath("$.details").value("Unknown target: missing"));
  }

  @Test
  void getTarget_returnsOneTarget() throws Exception {
    aggregator.accept(ProbeResult.success("gw", T0, 8.0));

    mvc.perform(get("/api/targets/gw"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.host").value("10.0.0.1"))
        .andExpect(jsonPath("$.avgRt").value(8.0))
        .andExpect(jsonPath("$.statusCode").value(1));
  }

  @Test
  void getStatistics_returnsLatestSnapshot() throws Exception {
    when(repository.latestStatistics("gw"))
        .thenReturn(
            Optional.of(
                new TargetStats("gw", "10.0.0.1", 10, 9, 1, 1.0, 3.0, 2.0, TargetState.UP, T0)));

    mvc.perform(get("/api/statistics/gw"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pingCount").value(10))
        .andExpect(jsonPath("$.successRate").value(90.0));
  }

  @Test
  void getStatistics_noneStoredIsNotFound() throws Exception {
    when(repository.latestStatistics("gw")).thenReturn(Optional.empty());

    mvc.perform(get("/api/statistics/gw"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Not Found"));
  }

  @Test
  void getDisconnects_returnsEventsWithCount() throws Exception {
    var closed =
        DisconnectEvent.open("gw", "10.0.0.1", T0, ErrorKind.UNREACHABLE)
            .withAnotherFailure()
            .closedAt(T0.plusSeconds(30));
    when(repository.disconnects("gw", 5)).thenReturn(List.of(closed));

    mvc.perform(get("/api/disconnects/gw").param("limit", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.targetName").value("gw"))
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.events[0].disconnectCount").value(2))
        .andExpect(jsonPath("$.events[0].durationSeconds").value(30));
  }

  @Test
  void getHistory_passesCutoffAndLimit() throws Exception {
    when(repository.history(eq("gw"), eq(1000L), eq(2)))
        .thenReturn(
            List.of(
                new PingRecord("10.0.0.1", ProbeResult.success("gw", T0, 4.0)),
                new PingRecord(
                    "10.0.0.1",
                    ProbeResult.failure("gw", T0.minusSeconds(10), ErrorKind.TIMEOUT))));

    mvc.perform(get("/api/history/gw").param("sinceMs", "1000").param("limit", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].success").value(true))
        .andExpect(jsonPath("$[0].responseTimeMs").value(4.0))
        .andExpect(jsonPath("$[1].errorKind").value("TIMEOUT"));
  }

  @Test
  void getHistory_nonNumericCutoffIsBadRequest() throws Exception {
    mvc.perform(get("/api/history/gw").param("sinceMs", "yesterday"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid Argument"));
  }

  @Test
  void storeFailure_isServerError() throws Exception {
    when(repository.history(eq("gw"), anyLong(), anyInt()))
        .thenThrow(new PersistenceException("Failed to read ping history of gw", null));

    mvc.perform(get("/api/history/gw"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Server Error"));
  }

  @Test
  void health_reflectsEngineState() throws Exception {
    when(pingEngine.isHealthy()).thenReturn(true);
    mvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"));

    when(pingEngine.isHealthy()).thenReturn(false);
    mvc.perform(get("/health"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.status").value("DOWN"));
  }
}
