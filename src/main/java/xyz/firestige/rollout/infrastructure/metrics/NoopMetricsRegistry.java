package xyz.firestige.rollout.infrastructure.metrics;

import java.util.Map;

public class NoopMetricsRegistry implements MetricsRegistry {
    @Override public void incrementCounter(String name, Map<String, String> tags) { }
    @Override public void setGauge(String name, double value, Map<String, String> tags) { }
    @Override public void recordHistogram(String name, double value, Map<String, String> tags) { }
}
