package xyz.firestige.rollout.infrastructure.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class MicrometerMetricsRegistry implements MetricsRegistry {
    private final MeterRegistry registry;
    private final ConcurrentMap<String, DoubleHolder> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) { this.registry = registry; }

    @Override
    public void incrementCounter(String name, Map<String, String> tags) {
        registry.counter(name, toTags(tags)).increment();
    }

    @Override
    public void setGauge(String name, double value, Map<String, String> tags) {
        Tags t = toTags(tags);
        DoubleHolder holder = gauges.computeIfAbsent(name + t, n -> {
            DoubleHolder h = new DoubleHolder();
            registry.gauge(name, t, h, DoubleHolder::get);
            return h;
        });
        holder.set(value);
    }

    @Override
    public void recordHistogram(String name, double value, Map<String, String> tags) {
        DistributionSummary.builder(name)
                .tags(toTags(tags))
                .baseUnit("seconds")
                .register(registry)
                .record(value);
    }

    private static Tags toTags(Map<String, String> tags) {
        List<Tag> list = new ArrayList<>(tags.size());
        tags.forEach((k, v) -> list.add(Tag.of(k, v == null ? "none" : v)));
        return Tags.of(list);
    }

    static class DoubleHolder {
        private volatile double v;
        double get() { return v; }
        void set(double v) { this.v = v; }
    }
}
