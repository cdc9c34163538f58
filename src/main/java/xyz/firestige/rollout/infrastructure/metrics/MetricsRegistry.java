package xyz.firestige.rollout.infrastructure.metrics;

import java.util.Map;

public interface MetricsRegistry {
    void incrementCounter(String name, Map<String, String> tags);
    void setGauge(String name, double value, Map<String, String> tags);
    void recordHistogram(String name, double value, Map<String, String> tags);
}
