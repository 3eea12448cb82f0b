package com.mk.fx.qa.pingit.metrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Labelled values of a single metric that can be taken and cleared in one step.
 *
 * <p>Writers share the read lock and update the backing map concurrently. A drain takes the write
 * lock and swaps the map, so every update lands either in the drained map or in its replacement.
 */
final class DrainableSeries {

  private record SeriesKey(String targetName, String host) {}

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private Map<SeriesKey, Double> values = new ConcurrentHashMap<>();

  /** Overwrites the value for the series, last value wins. */
  void set(String targetName, String host, double value) {
    lock.readLock().lock();
    try {
      values.put(new SeriesKey(targetName, host), value);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Adds {@code delta} to the value for the series. */
  void add(String targetName, String host, double delta) {
    lock.readLock().lock();
    try {
      values.merge(new SeriesKey(targetName, host), delta, Double::sum);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns every sample and leaves the series empty. */
  List<MetricSample> drain() {
    Map<SeriesKey, Double> taken;
    lock.writeLock().lock();
    try {
      taken = values;
      values = new ConcurrentHashMap<>();
    } finally {
      lock.writeLock().unlock();
    }
    return toSamples(taken);
  }

  /** Returns every sample without clearing. */
  List<MetricSample> peek() {
    lock.readLock().lock();
    try {
      return toSamples(values);
    } finally {
      lock.readLock().unlock();
    }
  }

  private static List<MetricSample> toSamples(Map<SeriesKey, Double> source) {
    List<MetricSample> samples = new ArrayList<>(source.size());
    source.forEach(
        (key, value) -> samples.add(new MetricSample(key.targetName(), key.host(), value)));
    samples.sort(Comparator.comparing(MetricSample::targetName).thenComparing(MetricSample::host));
    return samples;
  }
}
