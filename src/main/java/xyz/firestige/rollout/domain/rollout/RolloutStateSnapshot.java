package xyz.firestige.rollout.domain.rollout;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * RolloutState 的不可变快照，对外读取的唯一形式
 */
public final class RolloutStateSnapshot {

    private final String rolloutId;
    private final RolloutConfig config;
    private final RolloutPhase currentPhase;
    private final int currentTrafficPercentage;
    private final int phaseIndex;
    private final Instant startTime;
    private final Instant phaseStartTime;
    private final Instant endTime;
    private final Map<String, String> deploymentIds;
    private final List<MetricsSnapshot> metricsHistory;
    private final List<String> errors;
    private final String rollbackReason;
    private final boolean abortRequested;

    RolloutStateSnapshot(String rolloutId, RolloutConfig config, RolloutPhase currentPhase,
                         int currentTrafficPercentage, int phaseIndex, Instant startTime,
                         Instant phaseStartTime, Instant endTime, Map<String, String> deploymentIds,
                         List<MetricsSnapshot> metricsHistory, List<String> errors,
                         String rollbackReason, boolean abortRequested) {
        this.rolloutId = rolloutId;
        this.config = config;
        this.currentPhase = currentPhase;
        this.currentTrafficPercentage = currentTrafficPercentage;
        this.phaseIndex = phaseIndex;
        this.startTime = startTime;
        this.phaseStartTime = phaseStartTime;
        this.endTime = endTime;
        this.deploymentIds = Collections.unmodifiableMap(new LinkedHashMap<>(deploymentIds));
        this.metricsHistory = Collections.unmodifiableList(new ArrayList<>(metricsHistory));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.rollbackReason = rollbackReason;
        this.abortRequested = abortRequested;
    }

    public String getRolloutId() { return rolloutId; }
    public RolloutConfig getConfig() { return config; }
    public String getServiceName() { return config.getServiceName(); }
    public RolloutStrategy getStrategy() { return config.getStrategy(); }
    public RolloutPhase getCurrentPhase() { return currentPhase; }
    public int getCurrentTrafficPercentage() { return currentTrafficPercentage; }
    public int getPhaseIndex() { return phaseIndex; }
    public Instant getStartTime() { return startTime; }
    public Instant getPhaseStartTime() { return phaseStartTime; }
    public Instant getEndTime() { return endTime; }
    public Map<String, String> getDeploymentIds() { return deploymentIds; }
    public List<MetricsSnapshot> getMetricsHistory() { return metricsHistory; }
    public List<String> getErrors() { return errors; }
    public String getRollbackReason() { return rollbackReason; }
    public boolean isAbortRequested() { return abortRequested; }

    public boolean isActive() {
        return !currentPhase.isTerminal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RolloutStateSnapshot)) return false;
        RolloutStateSnapshot that = (RolloutStateSnapshot) o;
        return currentTrafficPercentage == that.currentTrafficPercentage
                && phaseIndex == that.phaseIndex
                && abortRequested == that.abortRequested
                && rolloutId.equals(that.rolloutId)
                && config == that.config
                && currentPhase == that.currentPhase
                && Objects.equals(startTime, that.startTime)
                && Objects.equals(phaseStartTime, that.phaseStartTime)
                && Objects.equals(endTime, that.endTime)
                && deploymentIds.equals(that.deploymentIds)
                && metricsHistory.equals(that.metricsHistory)
                && errors.equals(that.errors)
                && Objects.equals(rollbackReason, that.rollbackReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rolloutId, currentPhase, currentTrafficPercentage, phaseIndex, startTime,
                phaseStartTime, endTime, deploymentIds, metricsHistory, errors, rollbackReason, abortRequested);
    }

    @Override
    public String toString() {
        return "RolloutStateSnapshot{" +
                "rolloutId='" + rolloutId + '\'' +
                ", phase=" + currentPhase +
                ", traffic=" + currentTrafficPercentage +
                ", phaseIndex=" + phaseIndex +
                ", deploymentIds=" + deploymentIds +
                ", errors=" + errors +
                ", rollbackReason='" + rollbackReason + '\'' +
                '}';
    }
}
