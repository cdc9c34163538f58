package xyz.firestige.rollout.domain.deployment;

import java.time.Instant;

/**
 * 单次健康探测结果，追加写入 DeploymentResult.healthCheckResults
 */
public final class HealthCheckRecord {

    private final HealthCheckType type;
    private final String endpoint;
    private final boolean healthy;
    private final String detail;
    private final Instant checkedAt;

    public HealthCheckRecord(HealthCheckType type, String endpoint, boolean healthy, String detail, Instant checkedAt) {
        this.type = type;
        this.endpoint = endpoint;
        this.healthy = healthy;
        this.detail = detail;
        this.checkedAt = checkedAt;
    }

    public static HealthCheckRecord passed(HealthCheckConfig check, String detail) {
        return new HealthCheckRecord(check.getType(), check.getEndpoint(), true, detail, Instant.now());
    }

    public static HealthCheckRecord failed(HealthCheckConfig check, String detail) {
        return new HealthCheckRecord(check.getType(), check.getEndpoint(), false, detail, Instant.now());
    }

    public HealthCheckType getType() { return type; }
    public String getEndpoint() { return endpoint; }
    public boolean isHealthy() { return healthy; }
    public String getDetail() { return detail; }
    public Instant getCheckedAt() { return checkedAt; }

    @Override
    public String toString() {
        return "HealthCheckRecord{" + type + " " + endpoint + " healthy=" + healthy + ", detail='" + detail + "'}";
    }
}
