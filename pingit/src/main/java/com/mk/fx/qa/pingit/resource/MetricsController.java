package com.mk.fx.qa.pingit.resource;

import com.mk.fx.qa.pingit.metrics.MetricsCollector;
import com.mk.fx.qa.pingit.metrics.PrometheusTextRenderer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Metrics", description = "Prometheus scrape endpoint")
@RestController
@RequiredArgsConstructor
public class MetricsController {

  private final MetricsCollector collector;
  private final PrometheusTextRenderer renderer;

  @Operation(
      summary = "Scrape metrics",
      description =
          "Returns ping times and disconnect counts in Prometheus text format. Values are cleared"
              + " once served unless draining is disabled.")
  @GetMapping("/metrics")
  public ResponseEntity<String> scrape() {
    var scrape = collector.scrape();
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_TYPE, PrometheusTextRenderer.CONTENT_TYPE)
        .body(renderer.render(scrape));
  }
}
