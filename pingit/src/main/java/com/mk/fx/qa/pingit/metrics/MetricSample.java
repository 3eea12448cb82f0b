package com.mk.fx.qa.pingit.metrics;

/** One labelled value of a metric at scrape time. */
public record MetricSample(String targetName, String host, double value) {}
