package com.mk.fx.qa.pingit.resource;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.mk.fx.qa.pingit.metrics.MetricSample;
import com.mk.fx.qa.pingit.metrics.MetricsCollector;
import com.mk.fx.qa.pingit.metrics.MetricsScrape;
import com.mk.fx.qa.pingit.metrics.PrometheusTextRenderer;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = MetricsController.class)
@Import({PrometheusTextRenderer.class, GlobalExceptionHandler.class})
class MetricsControllerTest {

  @Autowired MockMvc mvc;

  @MockBean MetricsCollector collector;

  @Test
  void scrape_servesPrometheusText() throws Exception {
    when(collector.scrape())
        .thenReturn(
            new MetricsScrape(
                List.of(new MetricSample("google_dns", "8.8.8.8", 11.5)),
                List.of(new MetricSample("google_dns", "8.8.8.8", 1))));

    mvc.perform(get("/metrics"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Type", containsString("text/plain")))
        .andExpect(content().string(containsString("pingit_ping_time_ms{")))
        .andExpect(content().string(containsString("pingit_disconnect_events_total{")));
  }

  @Test
  void scrape_emptyAfterDrain() throws Exception {
    when(collector.scrape()).thenReturn(new MetricsScrape(List.of(), List.of()));

    mvc.perform(get("/metrics")).andExpect(status().isOk()).andExpect(content().string(""));
  }
}
