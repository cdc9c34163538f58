package xyz.firestige.rollout.application.rollout;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.stubbing.Answer;
import xyz.firestige.rollout.domain.deployment.DeploymentResult;
import xyz.firestige.rollout.domain.deployment.DeploymentSpec;
import xyz.firestige.rollout.domain.deployment.HealthCheckConfig;
import xyz.firestige.rollout.domain.deployment.HealthCheckRecord;
import xyz.firestige.rollout.domain.rollout.MetricsUnavailablePolicy;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutMetrics;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;
import xyz.firestige.rollout.domain.rollout.RolloutStateSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutStrategy;
import xyz.firestige.rollout.exception.ValidationException;
import xyz.firestige.rollout.infrastructure.collector.MetricsCollector;
import xyz.firestige.rollout.infrastructure.flag.FeatureFlagStatus;
import xyz.firestige.rollout.infrastructure.health.HealthCheckClient;
import xyz.firestige.rollout.util.TestRolloutEngine;
import xyz.firestige.rollout.util.TimingExtension;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * RolloutOrchestrator 端到端测试
 * <p>
 * 使用内存适配器与 1ms 的"分钟"，发布在真实的工作线程中执行。
 */
@Tag("integration")
@ExtendWith(TimingExtension.class)
@DisplayName("RolloutOrchestrator 端到端测试")
class RolloutOrchestratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static final MetricsCollector HEALTHY = (service, version, minutes) -> TestRolloutEngine.healthyMetrics();
    private static final HealthCheckClient PASSING = check -> HealthCheckRecord.passed(check, "200");

    private TestRolloutEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    private RolloutStateSnapshot awaitFinished(String rolloutId) {
        await().atMost(TIMEOUT).until(() -> engine.rolloutOrchestrator.getRolloutStatus(rolloutId)
                .map(s -> s.getCurrentPhase().isTerminal())
                .orElse(false));
        return engine.rolloutOrchestrator.getRolloutStatus(rolloutId).orElseThrow();
    }

    /**
     * 让 deploy 阻塞到 release 打开，started 在进入 deploy 时打开
     */
    private static Answer<Object> blockUntil(CountDownLatch started, CountDownLatch release) {
        return invocation -> {
            started.countDown();
            try {
                if (!release.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new IllegalStateException("deploy was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("deploy interrupted", e);
            }
            return invocation.callRealMethod();
        };
    }

    private static RolloutConfig.Builder config(RolloutStrategy strategy, DeploymentSpec spec) {
        return RolloutConfig.builder(strategy, spec)
                .phaseDurationMinutes(0)
                .validationDurationMinutes(0);
    }

    @Nested
    @DisplayName("渐进式发布")
    class Progressive {

        @Test
        @DisplayName("场景 7.1: phases [10,50,100]、时长为 0、指标正常时完成并停在 100%")
        void testProgressiveCompletes() {
            // Given
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            RolloutConfig config = config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(10, 50, 100)
                    .build();

            // When
            String rolloutId = engine.rolloutOrchestrator.startRollout(config);
            RolloutStateSnapshot status = awaitFinished(rolloutId);

            // Then
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            assertThat(status.getCurrentTrafficPercentage()).isEqualTo(100);
            assertThat(status.getPhaseIndex()).isEqualTo(2);
            assertThat(status.getDeploymentIds()).containsKey("v2.0.0");
            assertThat(status.getErrors()).isEmpty();
            assertThat(engine.trafficManager.getSplitHistory("billing"))
                    .extracting(split -> split.get("new"))
                    .containsExactly(10, 50, 100);
            await().atMost(TIMEOUT).untilAsserted(() -> assertThat(
                    engine.meterRegistry.find("rollout_duration_seconds").tag("status", "success").summary()).isNotNull());
            verify(engine.orchestrator, never()).rollback(anyString());
        }

        @Test
        @DisplayName("场景 7.2: 每阶段采样，error_rate 越界时回滚到旧版本")
        void testThresholdBreachTriggersRollback() {
            // Given: 新版本错误率 0.2
            MetricsCollector collector = (service, version, minutes) -> {
                Map<String, Double> metrics = TestRolloutEngine.healthyMetrics();
                if (version.startsWith("v")) {
                    metrics.put(RolloutMetrics.ERROR_RATE, 0.2);
                }
                return metrics;
            };
            engine = new TestRolloutEngine(collector, PASSING);
            RolloutConfig config = config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(10, 50, 100)
                    .validationDurationMinutes(2)
                    .build();

            // When
            String rolloutId = engine.rolloutOrchestrator.startRollout(config);
            RolloutStateSnapshot status = awaitFinished(rolloutId);

            // Then
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(status.getCurrentTrafficPercentage()).isZero();
            assertThat(status.getRollbackReason()).startsWith("Phase 1 validation failed: error_rate too high");
            assertThat(status.getErrors()).anyMatch(e -> e.startsWith("THRESHOLD_BREACH: "));
            assertThat(status.getMetricsHistory()).hasSize(2);
            assertThat(status.getMetricsHistory().get(0).getOldVersion()).isNotEmpty();
            assertThat(engine.trafficManager.getCurrentSplit("billing")).containsEntry("old", 100).containsEntry("new", 0);
            verify(engine.orchestrator, times(1)).rollback(status.getDeploymentIds().get("v2.0.0"));
            await().atMost(TIMEOUT).untilAsserted(() -> assertThat(
                    engine.meterRegistry.find("rollout_duration_seconds").tag("status", "failure").summary()).isNotNull());
        }

        @Test
        @DisplayName("场景 7.3: autoRollback=false 时失败不改变流量，也不回滚部署")
        void testNoAutoRollback() {
            // Given
            MetricsCollector collector = (service, version, minutes) -> Map.of(RolloutMetrics.CPU_USAGE, 99.0);
            engine = new TestRolloutEngine(collector, PASSING);
            RolloutConfig config = config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(10, 100)
                    .validationDurationMinutes(1)
                    .autoRollback(false)
                    .build();

            // When
            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            // Then
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(status.getCurrentTrafficPercentage()).isEqualTo(10);
            assertThat(status.getErrors()).anyMatch(e -> e.contains("cpu_usage too high"));
            verify(engine.orchestrator, never()).rollback(anyString());
        }

        @Test
        @DisplayName("场景 7.4: 无可用指标时 FAIL_CLOSED 判定失败，FAIL_OPEN 放行")
        void testMetricsUnavailablePolicy() {
            // Given
            MetricsCollector empty = (service, version, minutes) -> Collections.emptyMap();
            RolloutConfig config = config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(50, 100)
                    .validationDurationMinutes(1)
                    .build();

            // When: FAIL_CLOSED
            engine = new TestRolloutEngine(empty, PASSING, MetricsUnavailablePolicy.FAIL_CLOSED);
            RolloutStateSnapshot closed = awaitFinished(engine.rolloutOrchestrator.startRollout(config));
            engine.shutdown();

            // When: FAIL_OPEN
            engine = new TestRolloutEngine(empty, PASSING, MetricsUnavailablePolicy.FAIL_OPEN);
            RolloutStateSnapshot open = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            // Then
            assertThat(closed.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(closed.getRollbackReason()).contains("no metrics available");
            assertThat(open.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            assertThat(open.getCurrentTrafficPercentage()).isEqualTo(100);
        }

        @Test
        @DisplayName("场景 7.5: 指标采集异常降级为无指标并记录 METRICS_UNAVAILABLE")
        void testCollectorFailureIsNotFatal() {
            // Given
            MetricsCollector broken = (service, version, minutes) -> {
                throw new IllegalStateException("prometheus unreachable");
            };
            engine = new TestRolloutEngine(broken, PASSING);
            RolloutConfig config = config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(100)
                    .validationDurationMinutes(1)
                    .build();

            // When
            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            // Then
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            assertThat(status.getErrors()).anyMatch(e -> e.startsWith("METRICS_UNAVAILABLE: "));
        }

        @Test
        @DisplayName("场景 7.6: 新版本部署失败时不调整任何流量")
        void testDeploymentFailure() {
            // Given
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            engine.orchestrator.failDeploymentsWhen(spec -> true);
            RolloutConfig config = config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(10, 100)
                    .build();

            // When
            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            // Then
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(status.getCurrentTrafficPercentage()).isZero();
            assertThat(status.getErrors()).anyMatch(e -> e.startsWith("ORCHESTRATOR_ERROR: "));
            assertThat(engine.trafficManager.getSplitHistory("billing")).isEmpty();
            verify(engine.orchestrator, never()).rollback(anyString());
        }
    }

    @Nested
    @DisplayName("金丝雀 / 蓝绿 / A/B")
    class SingleStep {

        @Test
        @DisplayName("场景 8.1: 金丝雀 phases [10]，观察期通过后从 10% 直接提升到 100%")
        void testCanaryPromotes() {
            // Given
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            RolloutConfig config = config(RolloutStrategy.CANARY, TestRolloutEngine.spec("auth", "3.1.0"))
                    .phases(10)
                    .phaseDurationMinutes(2)
                    .build();

            // When
            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            // Then
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            assertThat(status.getCurrentTrafficPercentage()).isEqualTo(100);
            assertThat(status.getMetricsHistory()).hasSize(4)
                    .allMatch(s -> s.getTrafficPercentage() == 10);
            assertThat(engine.trafficManager.getSplitHistory("auth"))
                    .extracting(split -> split.get("new"))
                    .containsExactly(10, 100);
        }

        @Test
        @DisplayName("场景 8.2: autoPromote=false 时金丝雀完成但保持原流量")
        void testCanaryWithoutAutoPromote() {
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            RolloutConfig config = config(RolloutStrategy.CANARY, TestRolloutEngine.spec("auth", "3.1.0"))
                    .phases(10)
                    .autoPromote(false)
                    .build();

            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            assertThat(status.getCurrentTrafficPercentage()).isEqualTo(10);
        }

        @Test
        @DisplayName("场景 8.3: 蓝绿健康检查失败时从未切流，发布失败")
        void testBlueGreenHealthCheckFailure() {
            // Given
            HealthCheckClient failing = check -> HealthCheckRecord.failed(check, "HTTP 503");
            engine = new TestRolloutEngine(HEALTHY, failing);
            DeploymentSpec spec = DeploymentSpec.builder("portal", "registry.local/portal", "5.0.0")
                    .healthCheck(HealthCheckConfig.http("http://portal-green:8080/health").build())
                    .build();
            RolloutConfig config = config(RolloutStrategy.BLUE_GREEN, spec).build();

            // When
            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            // Then
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(status.getCurrentTrafficPercentage()).isZero();
            assertThat(status.getRollbackReason()).startsWith("Green environment validation failed");
            assertThat(engine.trafficManager.getSplitHistory("portal")).allMatch(split -> split.get("new") == 0);
            String deploymentId = status.getDeploymentIds().get("v5.0.0");
            assertThat(engine.deploymentAutomation.getDeploymentStatus(deploymentId))
                    .hasValueSatisfying(r -> assertThat(r.getHealthCheckResults()).hasSize(1));
        }

        @Test
        @DisplayName("场景 8.4: 蓝绿校验通过后一次性切到 100%")
        void testBlueGreenSwitchesInOneStep() {
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            DeploymentSpec spec = DeploymentSpec.builder("portal", "registry.local/portal", "5.0.0")
                    .healthCheck(HealthCheckConfig.tcp("portal-green:8080").build())
                    .build();
            RolloutConfig config = config(RolloutStrategy.BLUE_GREEN, spec).validationDurationMinutes(1).build();

            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            assertThat(engine.trafficManager.getSplitHistory("portal"))
                    .extracting(split -> split.get("new"))
                    .containsExactly(100);
        }

        @Test
        @DisplayName("场景 8.5: A/B 新版本 error_rate 与 p95 都更低时提升到 100%")
        void testAbTestNewWins() {
            engine = new TestRolloutEngine(abCollector(150.0), PASSING);
            RolloutConfig config = config(RolloutStrategy.A_B_TEST, TestRolloutEngine.spec("search", "7.0.0"))
                    .phaseDurationMinutes(3)
                    .build();

            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            assertThat(status.getCurrentTrafficPercentage()).isEqualTo(100);
            assertThat(status.getMetricsHistory()).hasSize(12);
            assertThat(engine.trafficManager.getSplitHistory("search"))
                    .extracting(split -> split.get("new"))
                    .containsExactly(50, 100);
        }

        @Test
        @DisplayName("场景 8.6: A/B 新版本 p95 250 高于旧版本 200 时回滚")
        void testAbTestOldWins() {
            engine = new TestRolloutEngine(abCollector(250.0), PASSING);
            RolloutConfig config = config(RolloutStrategy.A_B_TEST, TestRolloutEngine.spec("search", "7.0.0"))
                    .phaseDurationMinutes(3)
                    .build();

            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(status.getCurrentTrafficPercentage()).isZero();
            assertThat(status.getRollbackReason()).isEqualTo("A/B test showed old version performing better");
            verify(engine.orchestrator, times(1)).rollback(status.getDeploymentIds().get("v7.0.0"));
        }

        @Test
        @DisplayName("场景 8.7: A/B 保持 4 × phaseDurationMinutes 后才做胜者分析")
        void testAbTestHoldsFullWindow() {
            // Given
            engine = new TestRolloutEngine(abCollector(150.0), PASSING);
            RolloutConfig config = config(RolloutStrategy.A_B_TEST, TestRolloutEngine.spec("search", "7.0.0"))
                    .phaseDurationMinutes(3)
                    .build();

            // When
            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            // Then: 12 次采样，每次采样后等待 1 分钟
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            assertThat(status.getMetricsHistory()).hasSize(12);
            assertThat(engine.timer.getSleptMinutes()).isEqualTo(12);
        }

        @Test
        @DisplayName("场景 8.8: 蓝绿切流后观察期指标越界，从 100% 回滚到旧版本")
        void testBlueGreenFailsAfterSwitch() {
            // Given: 新版本在切流后错误率 0.3
            MetricsCollector collector = (service, version, minutes) -> {
                Map<String, Double> metrics = TestRolloutEngine.healthyMetrics();
                if (version.startsWith("v")) {
                    metrics.put(RolloutMetrics.ERROR_RATE, 0.3);
                }
                return metrics;
            };
            engine = new TestRolloutEngine(collector, PASSING);
            RolloutConfig config = config(RolloutStrategy.BLUE_GREEN, TestRolloutEngine.spec("portal", "5.0.0"))
                    .validationDurationMinutes(2)
                    .build();

            // When
            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            // Then
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(status.getCurrentTrafficPercentage()).isZero();
            assertThat(status.getRollbackReason()).startsWith("Blue-green validation failed after traffic switch");
            assertThat(status.getMetricsHistory()).hasSize(2)
                    .allMatch(s -> s.getTrafficPercentage() == 100);
            assertThat(engine.trafficManager.getSplitHistory("portal"))
                    .extracting(split -> split.get("new"))
                    .containsExactly(100, 0);
            verify(engine.orchestrator, times(1)).rollback(status.getDeploymentIds().get("v5.0.0"));
        }

        @Test
        @DisplayName("场景 8.9: 金丝雀观察期中途越界，立即回滚且从未提升到 100%")
        void testCanaryBreachMidWindow() {
            // Given: 新版本前两次采样正常，第三次起错误率 0.2
            AtomicInteger newVersionSamples = new AtomicInteger();
            MetricsCollector collector = (service, version, minutes) -> {
                Map<String, Double> metrics = TestRolloutEngine.healthyMetrics();
                if (version.startsWith("v") && newVersionSamples.incrementAndGet() > 2) {
                    metrics.put(RolloutMetrics.ERROR_RATE, 0.2);
                }
                return metrics;
            };
            engine = new TestRolloutEngine(collector, PASSING);
            RolloutConfig config = config(RolloutStrategy.CANARY, TestRolloutEngine.spec("auth", "3.1.0"))
                    .phases(10)
                    .phaseDurationMinutes(3)
                    .build();

            // When
            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            // Then: 6 分钟窗口在第 3 次采样时结束
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(status.getCurrentTrafficPercentage()).isZero();
            assertThat(status.getRollbackReason()).startsWith("Canary validation failed: error_rate too high");
            assertThat(status.getMetricsHistory()).hasSize(3);
            assertThat(engine.trafficManager.getSplitHistory("auth"))
                    .extracting(split -> split.get("new"))
                    .containsExactly(10, 0)
                    .doesNotContain(100);
            verify(engine.orchestrator, times(1)).rollback(status.getDeploymentIds().get("v3.1.0"));
        }

        private MetricsCollector abCollector(double newP95) {
            return (service, version, minutes) -> {
                Map<String, Double> metrics = TestRolloutEngine.healthyMetrics();
                if ("old".equals(version)) {
                    metrics.put(RolloutMetrics.ERROR_RATE, 0.02);
                    metrics.put(RolloutMetrics.RESPONSE_TIME_P95, 200.0);
                } else {
                    metrics.put(RolloutMetrics.ERROR_RATE, 0.01);
                    metrics.put(RolloutMetrics.RESPONSE_TIME_P95, newP95);
                }
                return metrics;
            };
        }
    }

    @Nested
    @DisplayName("特性开关 / 分环")
    class FlagAndRing {

        @Test
        @DisplayName("场景 9.1: 特性开关策略通过开关百分比放量，不写 TrafficManager")
        void testFeatureFlagRollout() {
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            RolloutConfig config = config(RolloutStrategy.FEATURE_FLAG, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(20, 100)
                    .featureFlag("flag_name", "billing_v2")
                    .featureFlag("filters", Map.of("region", "eu"))
                    .build();

            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            FeatureFlagStatus flag = engine.featureFlagManager.getFlagStatus("billing_v2");
            assertThat(flag.isEnabled()).isTrue();
            assertThat(flag.getPercentage()).isEqualTo(100);
            assertThat(flag.getFilters()).containsEntry("region", "eu");
            assertThat(engine.trafficManager.getSplitHistory("billing")).isEmpty();
        }

        @Test
        @DisplayName("场景 9.2: 特性开关阶段失败时关闭开关")
        void testFeatureFlagDisabledOnFailure() {
            MetricsCollector bad = (service, version, minutes) -> Map.of(RolloutMetrics.ERROR_RATE, 0.5);
            engine = new TestRolloutEngine(bad, PASSING);
            RolloutConfig config = config(RolloutStrategy.FEATURE_FLAG, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(20, 100)
                    .validationDurationMinutes(1)
                    .build();

            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(status.getRollbackReason()).startsWith("Feature flag phase 1 validation failed");
            assertThat(engine.featureFlagManager.getFlagStatus("billing_rollout").isEnabled()).isFalse();
        }

        @Test
        @DisplayName("场景 9.3: 分环发布按 phases 逐环推进")
        void testRingRollout() {
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            RolloutConfig config = config(RolloutStrategy.RING, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(5, 30, 100)
                    .targetGroup("internal")
                    .targetGroup("early-adopters")
                    .targetGroup("everyone")
                    .build();

            RolloutStateSnapshot status = awaitFinished(engine.rolloutOrchestrator.startRollout(config));

            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.COMPLETED);
            assertThat(engine.trafficManager.getSplitHistory("billing"))
                    .extracting(split -> split.get("new"))
                    .containsExactly(5, 30, 100);
        }
    }

    @Nested
    @DisplayName("中止与查询")
    class AbortAndQuery {

        @Test
        @DisplayName("场景 10.1: 中止运行中的发布只回滚一次新版本部署，结束于 FAILED")
        void testAbortRunningRollout() {
            // Given: 第一阶段后长时间等待
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            RolloutConfig config = config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(10, 50, 100)
                    .phaseDurationMinutes(600_000)
                    .build();
            String rolloutId = engine.rolloutOrchestrator.startRollout(config);
            await().atMost(TIMEOUT).until(() -> engine.rolloutOrchestrator.getRolloutStatus(rolloutId)
                    .map(s -> s.getCurrentTrafficPercentage() == 10)
                    .orElse(false));

            // When
            boolean aborted = engine.rolloutOrchestrator.abortRollout(rolloutId, "operator requested");

            // Then: 补偿回滚在返回前已完成
            RolloutStateSnapshot status = engine.rolloutOrchestrator.getRolloutStatus(rolloutId).orElseThrow();
            assertThat(aborted).isTrue();
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(status.getCurrentTrafficPercentage()).isZero();
            assertThat(status.getRollbackReason()).isEqualTo("operator requested");
            assertThat(status.isAbortRequested()).isTrue();
            assertThat(status.getErrors()).contains("ABORT_REQUESTED: operator requested");
            assertThat(engine.trafficManager.getCurrentSplit("billing")).containsEntry("new", 0);

            String deploymentId = status.getDeploymentIds().get("v2.0.0");
            await().pollDelay(Duration.ofMillis(100)).atMost(TIMEOUT).untilAsserted(() ->
                    verify(engine.orchestrator, times(1)).rollback(deploymentId));
            verify(engine.orchestrator, times(1)).rollback(anyString());
            assertThat(engine.rolloutOrchestrator.abortRollout(rolloutId, "again")).isFalse();
        }

        @Test
        @DisplayName("场景 10.2: 中止不存在或已结束的发布返回 false")
        void testAbortUnknownOrFinished() {
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            String rolloutId = engine.rolloutOrchestrator.startRollout(
                    config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0")).phases(100).build());
            awaitFinished(rolloutId);

            assertThat(engine.rolloutOrchestrator.abortRollout("nope", "x")).isFalse();
            assertThat(engine.rolloutOrchestrator.abortRollout(rolloutId, "x")).isFalse();
        }

        @Test
        @DisplayName("场景 10.3: 状态查询幂等，活跃列表只包含未结束的发布")
        void testQueries() {
            // Given
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            String finished = engine.rolloutOrchestrator.startRollout(
                    config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0")).phases(100).build());
            awaitFinished(finished);
            String running = engine.rolloutOrchestrator.startRollout(
                    config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("auth", "4.0.0"))
                            .phases(10, 100).phaseDurationMinutes(600_000).build());
            await().atMost(TIMEOUT).until(() -> engine.rolloutOrchestrator.getRolloutStatus(running)
                    .map(s -> s.getCurrentTrafficPercentage() == 10)
                    .orElse(false));

            // When
            RolloutStateSnapshot first = engine.rolloutOrchestrator.getRolloutStatus(finished).orElseThrow();
            RolloutStateSnapshot second = engine.rolloutOrchestrator.getRolloutStatus(finished).orElseThrow();
            List<RolloutStateSnapshot> active = engine.rolloutOrchestrator.listActiveRollouts();

            // Then
            assertThat(first).isEqualTo(second);
            assertThat(active).extracting(RolloutStateSnapshot::getRolloutId).containsExactly(running);
            assertThat(engine.rolloutOrchestrator.listRollouts()).hasSize(2);
            assertThat(engine.rolloutOrchestrator.getRolloutStatus("missing")).isEmpty();
        }

        @Test
        @DisplayName("场景 10.5: 部署期间中止，等待部署返回后回滚新部署，旧版本重新生效")
        void testAbortDuringDeployment() throws Exception {
            // Given: 旧版本 1.0.0 已成功部署，新版本 deploy 阻塞；回滚时短暂休眠
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            DeploymentResult previous = engine.deploymentAutomation.deployService(TestRolloutEngine.spec("billing", "1.0.0"));
            CountDownLatch deployStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            doAnswer(blockUntil(deployStarted, release))
                    .when(engine.orchestrator).deploy(argThat(spec -> spec != null && "2.0.0".equals(spec.getTag())));
            doAnswer(invocation -> {
                Thread.sleep(1);
                return invocation.callRealMethod();
            }).when(engine.orchestrator).rollback(anyString());
            String rolloutId = engine.rolloutOrchestrator.startRollout(
                    config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0")).phases(10, 100).build());
            assertThat(deployStarted.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();

            // When: 中止方在部署返回前保持阻塞
            CompletableFuture<Boolean> abort = CompletableFuture.supplyAsync(
                    () -> engine.rolloutOrchestrator.abortRollout(rolloutId, "operator requested"));
            await().during(Duration.ofMillis(200)).atMost(TIMEOUT).until(() -> !abort.isDone());
            release.countDown();
            boolean aborted = abort.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);

            // Then: 返回时新部署已被回滚
            RolloutStateSnapshot status = engine.rolloutOrchestrator.getRolloutStatus(rolloutId).orElseThrow();
            String deploymentId = status.getDeploymentIds().get("v2.0.0");
            assertThat(aborted).isTrue();
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
            assertThat(deploymentId).isNotNull();
            verify(engine.orchestrator, times(1)).rollback(deploymentId);
            verify(engine.orchestrator, times(1)).rollback(anyString());
            assertThat(engine.orchestrator.getActiveDeployment("billing")).contains(previous.getDeploymentId());
            assertThat(status.getErrors()).noneMatch(e -> e.contains("did not complete"));
            assertThat(engine.trafficManager.getSplitHistory("billing")).allMatch(split -> split.get("new") == 0);
        }

        @Test
        @DisplayName("场景 10.6: 等待部署超时后中止先返回，部署返回时执行线程补做回滚")
        void testAbortDeployWaitTimeout() throws Exception {
            // Given: 等待上限 50ms
            engine = new TestRolloutEngine(HEALTHY, PASSING, MetricsUnavailablePolicy.FAIL_OPEN, Duration.ofMillis(50));
            DeploymentResult previous = engine.deploymentAutomation.deployService(TestRolloutEngine.spec("billing", "1.0.0"));
            CountDownLatch deployStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            doAnswer(blockUntil(deployStarted, release))
                    .when(engine.orchestrator).deploy(argThat(spec -> spec != null && "2.0.0".equals(spec.getTag())));
            doAnswer(invocation -> {
                Thread.sleep(1);
                return invocation.callRealMethod();
            }).when(engine.orchestrator).rollback(anyString());
            String rolloutId = engine.rolloutOrchestrator.startRollout(
                    config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0")).phases(10, 100).build());
            assertThat(deployStarted.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();

            // When
            boolean aborted = engine.rolloutOrchestrator.abortRollout(rolloutId, "operator requested");
            RolloutPhase phaseAtReturn = engine.rolloutOrchestrator.getRolloutStatus(rolloutId).orElseThrow().getCurrentPhase();
            release.countDown();

            // Then: 执行线程没有被中断，补偿回滚成功
            assertThat(aborted).isTrue();
            assertThat(phaseAtReturn).isEqualTo(RolloutPhase.FAILED);
            await().atMost(TIMEOUT).untilAsserted(() -> {
                verify(engine.orchestrator, times(1)).rollback(anyString());
                assertThat(engine.orchestrator.getActiveDeployment("billing")).contains(previous.getDeploymentId());
            });
            RolloutStateSnapshot status = engine.rolloutOrchestrator.getRolloutStatus(rolloutId).orElseThrow();
            verify(engine.orchestrator, times(1)).rollback(status.getDeploymentIds().get("v2.0.0"));
            assertThat(status.getErrors()).noneMatch(e -> e.contains("did not complete"));
            assertThat(status.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
        }

        @Test
        @DisplayName("场景 10.7: 关闭时队列中尚未开始的发布标记为 FAILED")
        void testShutdownFailsQueuedRollouts() {
            // Given: 所有部署阻塞，占满线程池后再排队两个
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            CountDownLatch release = new CountDownLatch(1);
            doAnswer(blockUntil(new CountDownLatch(TestRolloutEngine.POOL_SIZE + 2), release))
                    .when(engine.orchestrator).deploy(any());
            for (int i = 0; i < TestRolloutEngine.POOL_SIZE + 2; i++) {
                engine.rolloutOrchestrator.startRollout(
                        config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("svc" + i, "2.0.0")).phases(100).build());
            }
            await().atMost(TIMEOUT).until(() -> engine.rolloutOrchestrator.listRollouts().stream()
                    .filter(s -> s.getCurrentPhase() == RolloutPhase.DEPLOYING)
                    .count() == TestRolloutEngine.POOL_SIZE);

            // When
            engine.shutdown();
            release.countDown();

            // Then
            List<RolloutStateSnapshot> drained = engine.rolloutOrchestrator.listRollouts().stream()
                    .filter(s -> s.getErrors().contains("SYSTEM_ERROR: Rollout executor shut down before the rollout started"))
                    .collect(Collectors.toList());
            assertThat(drained).hasSize(2)
                    .allMatch(s -> s.getCurrentPhase() == RolloutPhase.FAILED)
                    .allMatch(s -> s.getEndTime() != null);
            assertThat(engine.rolloutOrchestrator.listRollouts())
                    .noneMatch(s -> s.getCurrentPhase() == RolloutPhase.INITIALIZING);
            verify(engine.orchestrator, times(TestRolloutEngine.POOL_SIZE)).deploy(any());
        }

        @Test
        @DisplayName("场景 10.4: 非法配置同步抛出 ValidationException，不登记也不部署")
        void testInvalidConfigRejected() {
            engine = new TestRolloutEngine(HEALTHY, PASSING);
            RolloutConfig decreasing = config(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0"))
                    .phases(50, 10)
                    .build();
            RolloutConfig badSpec = config(RolloutStrategy.CANARY,
                    DeploymentSpec.builder("billing", "", "2.0.0").build()).build();

            assertThatThrownBy(() -> engine.rolloutOrchestrator.startRollout(decreasing))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("non-decreasing");
            assertThatThrownBy(() -> engine.rolloutOrchestrator.startRollout(badSpec))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Image is required");
            assertThat(engine.rolloutOrchestrator.listRollouts()).isEmpty();
            verify(engine.orchestrator, never()).deploy(any());
        }
    }
}
