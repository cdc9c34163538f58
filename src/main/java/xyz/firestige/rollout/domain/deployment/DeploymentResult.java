package xyz.firestige.rollout.domain.deployment;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 部署结果
 * <p>
 * 只由编排层 / DeploymentAutomation 修改；对外返回 {@link #copy()}。
 * healthCheckResults 只追加，endTime 只在终态设置。
 */
public class DeploymentResult {

    private final String deploymentId;
    private final String serviceName;
    private final DeploymentStrategy strategy;
    private DeploymentStatus status;
    private final Instant startTime;
    private Instant endTime;
    private String errorMessage;
    private String rollbackReason;
    private final Map<String, Double> metrics = new LinkedHashMap<>();
    private final List<HealthCheckRecord> healthCheckResults = new ArrayList<>();

    public DeploymentResult(String deploymentId, String serviceName, DeploymentStrategy strategy,
                            DeploymentStatus status, Instant startTime) {
        this.deploymentId = deploymentId;
        this.serviceName = serviceName;
        this.strategy = strategy;
        this.startTime = startTime;
        updateStatus(status);
    }

    /**
     * 更新状态；进入终态时补写 endTime
     */
    public synchronized void updateStatus(DeploymentStatus newStatus) {
        this.status = newStatus;
        if (newStatus != null && newStatus.isTerminal() && endTime == null) {
            this.endTime = Instant.now();
        }
    }

    public synchronized void appendHealthCheck(HealthCheckRecord record) {
        healthCheckResults.add(record);
    }

    public synchronized void putMetric(String name, double value) {
        metrics.put(name, value);
    }

    public synchronized Duration getDuration() {
        return endTime == null ? null : Duration.between(startTime, endTime);
    }

    public synchronized DeploymentResult copy() {
        DeploymentResult c = new DeploymentResult(deploymentId, serviceName, strategy, null, startTime);
        c.status = status;
        c.endTime = endTime;
        c.errorMessage = errorMessage;
        c.rollbackReason = rollbackReason;
        c.metrics.putAll(metrics);
        c.healthCheckResults.addAll(healthCheckResults);
        return c;
    }

    public String getDeploymentId() { return deploymentId; }
    public String getServiceName() { return serviceName; }
    public DeploymentStrategy getStrategy() { return strategy; }
    public synchronized DeploymentStatus getStatus() { return status; }
    public Instant getStartTime() { return startTime; }
    public synchronized Instant getEndTime() { return endTime; }
    public synchronized String getErrorMessage() { return errorMessage; }
    public synchronized void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public synchronized String getRollbackReason() { return rollbackReason; }
    public synchronized void setRollbackReason(String rollbackReason) { this.rollbackReason = rollbackReason; }
    public synchronized Map<String, Double> getMetrics() { return Collections.unmodifiableMap(new LinkedHashMap<>(metrics)); }
    public synchronized List<HealthCheckRecord> getHealthCheckResults() { return Collections.unmodifiableList(new ArrayList<>(healthCheckResults)); }

    @Override
    public synchronized String toString() {
        return "DeploymentResult{" +
                "deploymentId='" + deploymentId + '\'' +
                ", serviceName='" + serviceName + '\'' +
                ", status=" + status +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                ", errorMessage='" + errorMessage + '\'' +
                ", rollbackReason='" + rollbackReason + '\'' +
                '}';
    }
}
