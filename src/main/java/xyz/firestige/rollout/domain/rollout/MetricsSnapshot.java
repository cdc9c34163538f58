package xyz.firestige.rollout.domain.rollout;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一次指标采样：新旧版本指标 + 采样时的流量与阶段
 * oldVersion 在新版本已承接全部流量时为空
 */
public final class MetricsSnapshot {

    private final Map<String, Double> newVersion;
    private final Map<String, Double> oldVersion;
    private final int trafficPercentage;
    private final Instant timestamp;
    private final int phaseIndex;

    public MetricsSnapshot(Map<String, Double> newVersion, Map<String, Double> oldVersion,
                           int trafficPercentage, Instant timestamp, int phaseIndex) {
        this.newVersion = Collections.unmodifiableMap(new LinkedHashMap<>(newVersion));
        this.oldVersion = Collections.unmodifiableMap(new LinkedHashMap<>(oldVersion));
        this.trafficPercentage = trafficPercentage;
        this.timestamp = timestamp;
        this.phaseIndex = phaseIndex;
    }

    public Map<String, Double> getNewVersion() { return newVersion; }
    public Map<String, Double> getOldVersion() { return oldVersion; }
    public int getTrafficPercentage() { return trafficPercentage; }
    public Instant getTimestamp() { return timestamp; }
    public int getPhaseIndex() { return phaseIndex; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricsSnapshot)) return false;
        MetricsSnapshot that = (MetricsSnapshot) o;
        return trafficPercentage == that.trafficPercentage && phaseIndex == that.phaseIndex
                && newVersion.equals(that.newVersion) && oldVersion.equals(that.oldVersion)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(newVersion, oldVersion, trafficPercentage, timestamp, phaseIndex);
    }

    @Override
    public String toString() {
        return "MetricsSnapshot{phase=" + phaseIndex + ", traffic=" + trafficPercentage
                + ", new=" + newVersion + ", old=" + oldVersion + '}';
    }
}
