package xyz.firestige.rollout.application.rollout;

import xyz.firestige.rollout.application.deployment.DeploymentSpecValidator;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutStrategy;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 发布配置校验，在登记发布、启动任务之前执行
 */
public class RolloutConfigValidator {

    /**
     * 逐阶段推进、phases 不能为空的策略
     */
    private static final Set<RolloutStrategy> PHASED = EnumSet.of(
            RolloutStrategy.PROGRESSIVE, RolloutStrategy.RING, RolloutStrategy.FEATURE_FLAG);

    private final DeploymentSpecValidator specValidator;
    private final Set<RolloutStrategy> supportedStrategies;

    public RolloutConfigValidator(DeploymentSpecValidator specValidator, Set<RolloutStrategy> supportedStrategies) {
        this.specValidator = specValidator;
        this.supportedStrategies = supportedStrategies;
    }

    public List<String> validate(RolloutConfig config) {
        List<String> violations = new ArrayList<>();
        if (config == null) {
            violations.add("Rollout config is required");
            return violations;
        }
        if (config.getStrategy() == null) {
            violations.add("Rollout strategy is required");
        } else if (!supportedStrategies.contains(config.getStrategy())) {
            violations.add("Unsupported rollout strategy: " + config.getStrategy());
        }
        if (config.getServiceName() == null || config.getServiceName().isBlank()) {
            violations.add("Service name is required");
        }
        if (config.getDeploymentSpec() == null) {
            violations.add("Deployment spec is required");
        } else {
            violations.addAll(specValidator.validate(config.getDeploymentSpec()));
        }

        validatePhases(config, violations);

        if (config.getPhaseDurationMinutes() < 0) {
            violations.add("Phase duration must not be negative");
        }
        if (config.getValidationDurationMinutes() < 0) {
            violations.add("Validation duration must not be negative");
        }
        if (config.getMetricsThresholds() == null) {
            violations.add("Metrics thresholds are required");
        }
        if (config.getTrafficSplitMethod() == null) {
            violations.add("Traffic split method is required");
        }
        return violations;
    }

    private void validatePhases(RolloutConfig config, List<String> violations) {
        List<Integer> phases = config.getPhases();
        if (phases.isEmpty() && PHASED.contains(config.getStrategy())) {
            violations.add("Phases must not be empty for " + config.getStrategy() + " rollout");
            return;
        }
        int previous = 0;
        for (Integer phase : phases) {
            if (phase == null || phase < 0 || phase > 100) {
                violations.add("Phase percentage must be between 0 and 100: " + phase);
                return;
            }
            if (phase < previous) {
                violations.add("Phases must be non-decreasing: " + phases);
                return;
            }
            previous = phase;
        }
    }
}
