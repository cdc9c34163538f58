package xyz.firestige.rollout.domain.deployment;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查配置
 * <p>
 * HTTP 类型的 endpoint 为完整 URL（http/https），TCP 类型为 host:port。
 */
public final class HealthCheckConfig {

    @NotNull
    private final HealthCheckType type;
    @NotBlank
    private final String endpoint;
    @Min(1)
    private final int intervalSeconds;
    @Min(1)
    private final int timeoutSeconds;
    @Min(0)
    private final int retries;
    @Min(1)
    private final int successThreshold;
    @Min(1)
    private final int failureThreshold;
    private final Map<String, String> headers;
    private final int expectedStatus;

    private HealthCheckConfig(Builder builder) {
        this.type = builder.type;
        this.endpoint = builder.endpoint;
        this.intervalSeconds = builder.intervalSeconds;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.retries = builder.retries;
        this.successThreshold = builder.successThreshold;
        this.failureThreshold = builder.failureThreshold;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.expectedStatus = builder.expectedStatus;
    }

    public static Builder http(String url) {
        return new Builder(HealthCheckType.HTTP, url);
    }

    public static Builder tcp(String hostAndPort) {
        return new Builder(HealthCheckType.TCP, hostAndPort);
    }

    public static Builder builder(HealthCheckType type, String endpoint) {
        return new Builder(type, endpoint);
    }

    public HealthCheckType getType() { return type; }
    public String getEndpoint() { return endpoint; }
    public int getIntervalSeconds() { return intervalSeconds; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public int getRetries() { return retries; }
    public int getSuccessThreshold() { return successThreshold; }
    public int getFailureThreshold() { return failureThreshold; }
    public Map<String, String> getHeaders() { return headers; }
    public int getExpectedStatus() { return expectedStatus; }

    @Override
    public String toString() {
        return "HealthCheckConfig{" + type + " " + endpoint + ", expectedStatus=" + expectedStatus + '}';
    }

    public static final class Builder {
        private final HealthCheckType type;
        private final String endpoint;
        private int intervalSeconds = 30;
        private int timeoutSeconds = 10;
        private int retries = 3;
        private int successThreshold = 1;
        private int failureThreshold = 3;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private int expectedStatus = 200;

        private Builder(HealthCheckType type, String endpoint) {
            this.type = type;
            this.endpoint = endpoint;
        }

        public Builder intervalSeconds(int v) { this.intervalSeconds = v; return this; }
        public Builder timeoutSeconds(int v) { this.timeoutSeconds = v; return this; }
        public Builder retries(int v) { this.retries = v; return this; }
        public Builder successThreshold(int v) { this.successThreshold = v; return this; }
        public Builder failureThreshold(int v) { this.failureThreshold = v; return this; }
        public Builder header(String name, String value) { this.headers.put(name, value); return this; }
        public Builder expectedStatus(int v) { this.expectedStatus = v; return this; }

        public HealthCheckConfig build() {
            return new HealthCheckConfig(this);
        }
    }
}
