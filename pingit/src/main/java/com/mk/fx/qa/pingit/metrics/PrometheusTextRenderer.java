package com.mk.fx.qa.pingit.metrics;

import io.prometheus.metrics.expositionformats.PrometheusTextFormatWriter;
import io.prometheus.metrics.model.snapshots.CounterSnapshot;
import io.prometheus.metrics.model.snapshots.GaugeSnapshot;
import io.prometheus.metrics.model.snapshots.Labels;
import io.prometheus.metrics.model.snapshots.MetricSnapshot;
import io.prometheus.metrics.model.snapshots.MetricSnapshots;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Renders a {@link MetricsScrape} in the Prometheus text exposition format. */
@Component
public class PrometheusTextRenderer {

  public static final String CONTENT_TYPE = PrometheusTextFormatWriter.CONTENT_TYPE;

  private final PrometheusTextFormatWriter writer = new PrometheusTextFormatWriter(false);

  public String render(MetricsScrape scrape) {
    List<MetricSnapshot> snapshots = new ArrayList<>(2);
    if (!scrape.pingTimes().isEmpty()) {
      snapshots.add(pingTimeGauge(scrape.pingTimes()));
    }
    if (!scrape.disconnects().isEmpty()) {
      snapshots.add(disconnectCounter(scrape.disconnects()));
    }

    var out = new ByteArrayOutputStream();
    try {
      writer.write(out, new MetricSnapshots(snapshots));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to render metrics", e);
    }
    return out.toString(StandardCharsets.UTF_8);
  }

  private GaugeSnapshot pingTimeGauge(List<MetricSample> samples) {
    var builder =
        GaugeSnapshot.builder()
            .name(MetricsCollector.PING_TIME_METRIC)
            .help("Ping response time in milliseconds");
    for (MetricSample sample : samples) {
      builder.dataPoint(
          GaugeSnapshot.GaugeDataPointSnapshot.builder()
              .labels(labels(sample))
              .value(sample.value())
              .build());
    }
    return builder.build();
  }

  // the writer appends the _total suffix to counter names
  private CounterSnapshot disconnectCounter(List<MetricSample> samples) {
    var builder =
        CounterSnapshot.builder()
            .name(MetricsCollector.DISCONNECT_METRIC)
            .help("Disconnect events opened since the previous scrape");
    for (MetricSample sample : samples) {
      builder.dataPoint(
          CounterSnapshot.CounterDataPointSnapshot.builder()
              .labels(labels(sample))
              .value(sample.value())
              .build());
    }
    return builder.build();
  }

  private static Labels labels(MetricSample sample) {
    return Labels.of("target_name", sample.targetName(), "host", sample.host());
  }
}
