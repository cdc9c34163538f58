package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.deployment.DeploymentSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 发布配置：包装一个 DeploymentSpec，加上策略、阶段与阈值
 * <p>
 * phases 为各阶段的目标流量百分比（非递减）；phaseDurationMinutes / validationDurationMinutes
 * 以"分钟"计，实际时长由 rollout.time-unit 决定。
 */
public final class RolloutConfig {

    public static final String FLAG_NAME_KEY = "flag_name";
    public static final String FLAG_FILTERS_KEY = "filters";
    public static final String OLD_VERSION_LABEL = "old";

    private final RolloutStrategy strategy;
    private final String serviceName;
    private final DeploymentSpec deploymentSpec;
    private final List<Integer> phases;
    private final int phaseDurationMinutes;
    private final int validationDurationMinutes;
    private final RolloutMetrics metricsThresholds;
    private final boolean autoPromote;
    private final boolean autoRollback;
    private final TrafficSplitMethod trafficSplitMethod;
    private final List<String> targetGroups;
    private final Map<String, Object> featureFlags;

    private RolloutConfig(Builder b) {
        this.strategy = b.strategy;
        this.serviceName = b.serviceName;
        this.deploymentSpec = b.deploymentSpec;
        this.phases = Collections.unmodifiableList(new ArrayList<>(b.phases));
        this.phaseDurationMinutes = b.phaseDurationMinutes;
        this.validationDurationMinutes = b.validationDurationMinutes;
        this.metricsThresholds = b.metricsThresholds;
        this.autoPromote = b.autoPromote;
        this.autoRollback = b.autoRollback;
        this.trafficSplitMethod = b.trafficSplitMethod;
        this.targetGroups = Collections.unmodifiableList(new ArrayList<>(b.targetGroups));
        this.featureFlags = Collections.unmodifiableMap(new LinkedHashMap<>(b.featureFlags));
    }

    /**
     * serviceName 默认取自 deploymentSpec
     */
    public static Builder builder(RolloutStrategy strategy, DeploymentSpec deploymentSpec) {
        return new Builder(strategy, deploymentSpec);
    }

    /**
     * 新版本标签 v{tag}，作为 deploymentIds 的键与指标采集的 version 参数
     */
    public String newVersionLabel() {
        return "v" + deploymentSpec.getTag();
    }

    public String featureFlagName() {
        Object name = featureFlags.get(FLAG_NAME_KEY);
        if (name instanceof String && !((String) name).isBlank()) {
            return (String) name;
        }
        return serviceName + "_rollout";
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> featureFlagFilters() {
        Object filters = featureFlags.get(FLAG_FILTERS_KEY);
        if (filters instanceof Map) {
            return Collections.unmodifiableMap((Map<String, Object>) filters);
        }
        return Collections.emptyMap();
    }

    public RolloutStrategy getStrategy() { return strategy; }
    public String getServiceName() { return serviceName; }
    public DeploymentSpec getDeploymentSpec() { return deploymentSpec; }
    public List<Integer> getPhases() { return phases; }
    public int getPhaseDurationMinutes() { return phaseDurationMinutes; }
    public int getValidationDurationMinutes() { return validationDurationMinutes; }
    public RolloutMetrics getMetricsThresholds() { return metricsThresholds; }
    public boolean isAutoPromote() { return autoPromote; }
    public boolean isAutoRollback() { return autoRollback; }
    public TrafficSplitMethod getTrafficSplitMethod() { return trafficSplitMethod; }
    public List<String> getTargetGroups() { return targetGroups; }
    public Map<String, Object> getFeatureFlags() { return featureFlags; }

    @Override
    public String toString() {
        return "RolloutConfig{" + strategy + " " + serviceName + " " + newVersionLabel()
                + ", phases=" + phases + ", phaseDuration=" + phaseDurationMinutes
                + ", validationDuration=" + validationDurationMinutes
                + ", autoPromote=" + autoPromote + ", autoRollback=" + autoRollback + '}';
    }

    public static final class Builder {
        private final RolloutStrategy strategy;
        private final DeploymentSpec deploymentSpec;
        private String serviceName;
        private List<Integer> phases = Arrays.asList(10, 25, 50, 100);
        private int phaseDurationMinutes = 15;
        private int validationDurationMinutes = 5;
        private RolloutMetrics metricsThresholds = RolloutMetrics.defaults();
        private boolean autoPromote = true;
        private boolean autoRollback = true;
        private TrafficSplitMethod trafficSplitMethod = TrafficSplitMethod.PERCENTAGE;
        private final List<String> targetGroups = new ArrayList<>();
        private final Map<String, Object> featureFlags = new LinkedHashMap<>();

        private Builder(RolloutStrategy strategy, DeploymentSpec deploymentSpec) {
            this.strategy = strategy;
            this.deploymentSpec = deploymentSpec;
            this.serviceName = deploymentSpec != null ? deploymentSpec.getServiceName() : null;
        }

        public Builder serviceName(String serviceName) { this.serviceName = serviceName; return this; }
        public Builder phases(Integer... phases) { this.phases = Arrays.asList(phases); return this; }
        public Builder phases(List<Integer> phases) { this.phases = new ArrayList<>(phases); return this; }
        public Builder phaseDurationMinutes(int v) { this.phaseDurationMinutes = v; return this; }
        public Builder validationDurationMinutes(int v) { this.validationDurationMinutes = v; return this; }
        public Builder metricsThresholds(RolloutMetrics thresholds) { this.metricsThresholds = thresholds; return this; }
        public Builder autoPromote(boolean v) { this.autoPromote = v; return this; }
        public Builder autoRollback(boolean v) { this.autoRollback = v; return this; }
        public Builder trafficSplitMethod(TrafficSplitMethod method) { this.trafficSplitMethod = method; return this; }
        public Builder targetGroup(String group) { this.targetGroups.add(group); return this; }
        public Builder featureFlag(String key, Object value) { this.featureFlags.put(key, value); return this; }

        public RolloutConfig build() {
            return new RolloutConfig(this);
        }
    }
}
