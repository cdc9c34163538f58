package xyz.firestige.rollout.infrastructure.execution;

import io.micrometer.observation.ObservationRegistry;
import xyz.firestige.rollout.application.deployment.DeploymentAutomation;
import xyz.firestige.rollout.infrastructure.execution.validation.AbTestAnalyzer;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;

/**
 * 发布执行依赖
 * <p>
 * 将执行器与各策略步骤共用的协作者封装到一个对象中，避免构造函数参数过多。
 * 这些协作者都是无状态的，可在所有发布之间共享。
 */
public class RolloutExecutionDependencies {

    private final DeploymentAutomation deploymentAutomation;
    private final PhaseMonitor phaseMonitor;
    private final TrafficController trafficController;
    private final RollbackCoordinator rollbackCoordinator;
    private final DeploymentValidator deploymentValidator;
    private final AbTestAnalyzer abTestAnalyzer;
    private final RolloutTimer timer;
    private final MetricsRegistry metrics;
    private final ObservationRegistry observationRegistry;
    private final int defaultCanaryPercentage;

    public RolloutExecutionDependencies(
        DeploymentAutomation deploymentAutomation,
        PhaseMonitor phaseMonitor,
        TrafficController trafficController,
        RollbackCoordinator rollbackCoordinator,
        DeploymentValidator deploymentValidator,
        AbTestAnalyzer abTestAnalyzer,
        RolloutTimer timer,
        MetricsRegistry metrics,
        ObservationRegistry observationRegistry,
        int defaultCanaryPercentage
    ) {
        this.deploymentAutomation = deploymentAutomation;
        this.phaseMonitor = phaseMonitor;
        this.trafficController = trafficController;
        this.rollbackCoordinator = rollbackCoordinator;
        this.deploymentValidator = deploymentValidator;
        this.abTestAnalyzer = abTestAnalyzer;
        this.timer = timer;
        this.metrics = metrics;
        this.observationRegistry = observationRegistry;
        this.defaultCanaryPercentage = defaultCanaryPercentage;
    }

    // ========== Getters ==========

    public DeploymentAutomation getDeploymentAutomation() {
        return deploymentAutomation;
    }

    public PhaseMonitor getPhaseMonitor() {
        return phaseMonitor;
    }

    public TrafficController getTrafficController() {
        return trafficController;
    }

    public RollbackCoordinator getRollbackCoordinator() {
        return rollbackCoordinator;
    }

    public DeploymentValidator getDeploymentValidator() {
        return deploymentValidator;
    }

    public AbTestAnalyzer getAbTestAnalyzer() {
        return abTestAnalyzer;
    }

    public RolloutTimer getTimer() {
        return timer;
    }

    public MetricsRegistry getMetrics() {
        return metrics;
    }

    public ObservationRegistry getObservationRegistry() {
        return observationRegistry;
    }

    public int getDefaultCanaryPercentage() {
        return defaultCanaryPercentage;
    }
}
