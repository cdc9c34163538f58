package xyz.firestige.rollout.domain.deployment;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 部署规格（不可变）
 * <p>
 * 一次部署开始后规格不再变化；rollbackTimeoutSeconds 仅作为元数据保存，引擎不据此计时。
 */
public final class DeploymentSpec {

    @NotBlank(message = "Service name is required")
    private final String serviceName;
    @NotBlank(message = "Image is required")
    private final String image;
    @NotBlank(message = "Tag is required")
    private final String tag;
    @Min(value = 1, message = "Replicas must be at least 1")
    private final int replicas;
    @NotNull
    private final DeploymentStrategy strategy;
    private final ResourceLimits resourceLimits;
    private final Map<String, String> environmentVariables;
    @Valid
    private final List<HealthCheckConfig> healthChecks;
    private final List<String> volumes;
    private final Map<Integer, Integer> ports;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    @Min(0)
    private final int rollbackTimeoutSeconds;
    @Min(0)
    @Max(100)
    private final int canaryPercentage;

    private DeploymentSpec(Builder b) {
        this.serviceName = b.serviceName;
        this.image = b.image;
        this.tag = b.tag;
        this.replicas = b.replicas;
        this.strategy = b.strategy;
        this.resourceLimits = b.resourceLimits;
        this.environmentVariables = Collections.unmodifiableMap(new LinkedHashMap<>(b.environmentVariables));
        this.healthChecks = Collections.unmodifiableList(new ArrayList<>(b.healthChecks));
        this.volumes = Collections.unmodifiableList(new ArrayList<>(b.volumes));
        this.ports = Collections.unmodifiableMap(new LinkedHashMap<>(b.ports));
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(b.labels));
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(b.annotations));
        this.rollbackTimeoutSeconds = b.rollbackTimeoutSeconds;
        this.canaryPercentage = b.canaryPercentage;
    }

    public static Builder builder(String serviceName, String image, String tag) {
        return new Builder(serviceName, image, tag);
    }

    public String getServiceName() { return serviceName; }
    public String getImage() { return image; }
    public String getTag() { return tag; }
    public int getReplicas() { return replicas; }
    public DeploymentStrategy getStrategy() { return strategy; }
    public ResourceLimits getResourceLimits() { return resourceLimits; }
    public Map<String, String> getEnvironmentVariables() { return environmentVariables; }
    public List<HealthCheckConfig> getHealthChecks() { return healthChecks; }
    public List<String> getVolumes() { return volumes; }
    public Map<Integer, Integer> getPorts() { return ports; }
    public Map<String, String> getLabels() { return labels; }
    public Map<String, String> getAnnotations() { return annotations; }
    public int getRollbackTimeoutSeconds() { return rollbackTimeoutSeconds; }
    public int getCanaryPercentage() { return canaryPercentage; }

    /**
     * 镜像全名 image:tag
     */
    public String getImageReference() {
        return image + ":" + tag;
    }

    @Override
    public String toString() {
        return "DeploymentSpec{" + serviceName + " " + getImageReference() + ", replicas=" + replicas
                + ", strategy=" + strategy + '}';
    }

    public static final class Builder {
        private final String serviceName;
        private final String image;
        private final String tag;
        private int replicas = 1;
        private DeploymentStrategy strategy = DeploymentStrategy.ROLLING;
        private ResourceLimits resourceLimits = ResourceLimits.defaults();
        private final Map<String, String> environmentVariables = new LinkedHashMap<>();
        private final List<HealthCheckConfig> healthChecks = new ArrayList<>();
        private final List<String> volumes = new ArrayList<>();
        private final Map<Integer, Integer> ports = new LinkedHashMap<>();
        private final Map<String, String> labels = new LinkedHashMap<>();
        private final Map<String, String> annotations = new LinkedHashMap<>();
        private int rollbackTimeoutSeconds = 300;
        private int canaryPercentage = 10;

        private Builder(String serviceName, String image, String tag) {
            this.serviceName = serviceName;
            this.image = image;
            this.tag = tag;
        }

        public Builder replicas(int replicas) { this.replicas = replicas; return this; }
        public Builder strategy(DeploymentStrategy strategy) { this.strategy = strategy; return this; }
        public Builder resourceLimits(ResourceLimits limits) { this.resourceLimits = limits; return this; }
        public Builder env(String name, String value) { this.environmentVariables.put(name, value); return this; }
        public Builder healthCheck(HealthCheckConfig check) { this.healthChecks.add(check); return this; }
        public Builder volume(String volume) { this.volumes.add(volume); return this; }
        public Builder port(int hostPort, int containerPort) { this.ports.put(hostPort, containerPort); return this; }
        public Builder label(String key, String value) { this.labels.put(key, value); return this; }
        public Builder annotation(String key, String value) { this.annotations.put(key, value); return this; }
        public Builder rollbackTimeoutSeconds(int seconds) { this.rollbackTimeoutSeconds = seconds; return this; }
        public Builder canaryPercentage(int percentage) { this.canaryPercentage = percentage; return this; }

        public DeploymentSpec build() {
            return new DeploymentSpec(this);
        }
    }
}
