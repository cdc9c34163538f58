package xyz.firestige.rollout.domain.rollout;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.rollout.util.TestRolloutEngine;
import xyz.firestige.rollout.util.TimingExtension;

import java.time.Instant;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RolloutState 聚合单元测试：流量单调、中止 / 回滚的互斥与快照
 */
@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("RolloutState 单元测试")
class RolloutStateTest {

    private RolloutState state;

    @BeforeEach
    void setUp() {
        RolloutConfig config = RolloutConfig.builder(RolloutStrategy.PROGRESSIVE, TestRolloutEngine.spec("billing", "2.0.0"))
                .phases(10, 50, 100)
                .build();
        state = new RolloutState("billing-rollout-1", config);
        state.transitionTo(RolloutPhase.DEPLOYING);
    }

    @Test
    @DisplayName("场景 2.1: 正向流量只增不减，phaseIndex 不超过 phases.size()-1")
    void testTrafficIsMonotonicAndPhaseIndexClamped() {
        // When
        assertThat(state.shiftTraffic(10, 0, RolloutPhase.MONITORING)).isTrue();
        assertThat(state.shiftTraffic(50, 1, RolloutPhase.MONITORING)).isTrue();
        assertThat(state.shiftTraffic(100, 7, RolloutPhase.PROMOTING)).isTrue();

        // Then
        assertThat(state.getCurrentTrafficPercentage()).isEqualTo(100);
        assertThat(state.getPhaseIndex()).isEqualTo(2);
        assertThatThrownBy(() -> state.shiftTraffic(50, 1, RolloutPhase.MONITORING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("场景 2.2: 回滚开始后流量归零，正向调整与完成均被拒绝")
    void testRollbackBlocksForwardProgress() {
        // Given
        state.recordNewDeployment("v2.0.0", "billing-dep-1");
        state.shiftTraffic(50, 1, RolloutPhase.MONITORING);

        // When
        boolean started = state.beginRollback("error rate too high");

        // Then
        assertThat(started).isTrue();
        assertThat(state.getCurrentPhase()).isEqualTo(RolloutPhase.ROLLING_BACK);
        assertThat(state.getCurrentTrafficPercentage()).isZero();
        assertThat(state.getRollbackDeploymentId()).isEqualTo("billing-dep-1");
        assertThat(state.shiftTraffic(100, 2, RolloutPhase.PROMOTING)).isFalse();
        assertThat(state.complete()).isFalse();
        assertThat(state.beginRollback("again")).as("回滚至多开始一次").isFalse();
        assertThat(state.fail()).isTrue();
        assertThat(state.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
    }

    @Test
    @DisplayName("场景 2.3: 部署期间已开始回滚时，登记部署 ID 返回需要补偿")
    void testDeploymentRecordedAfterRollbackStarted() {
        // Given: 回滚先于部署完成开始
        assertThat(state.requestAbort(null)).isTrue();
        assertThat(state.beginRollback(null)).isTrue();

        // When
        boolean compensate = state.recordNewDeployment("v2.0.0", "billing-dep-2");

        // Then
        assertThat(compensate).isTrue();
        assertThat(state.getRollbackReason()).isEqualTo("Rollout aborted");
        assertThat(state.getNewDeploymentId()).isEqualTo("billing-dep-2");
    }

    @Test
    @DisplayName("场景 2.4: 已结束的发布不能再请求中止")
    void testAbortAfterCompletionIsRejected() {
        state.shiftTraffic(100, 2, RolloutPhase.PROMOTING);
        assertThat(state.complete()).isTrue();

        assertThat(state.requestAbort("too late")).isFalse();
        assertThat(state.isAbortRequested()).isFalse();
    }

    @Test
    @DisplayName("场景 2.5: 无变化时两次快照字段相等，快照不随后续修改变化")
    void testSnapshotsAreEqualAndDetached() {
        // Given
        state.shiftTraffic(10, 0, RolloutPhase.MONITORING);
        state.appendSnapshot(new MetricsSnapshot(TestRolloutEngine.healthyMetrics(), Collections.emptyMap(),
                10, Instant.now(), 0));

        // When
        RolloutStateSnapshot first = state.snapshot();
        RolloutStateSnapshot second = state.snapshot();
        state.addError("SYSTEM_ERROR: later");

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first.getErrors()).isEmpty();
        assertThat(first.getMetricsHistory()).hasSize(1);
        assertThat(state.snapshot()).isNotEqualTo(first);
    }

    @Test
    @DisplayName("场景 2.6: 只有尚未开始执行的发布可以直接标记失败")
    void testFailBeforeStart() {
        // Given
        RolloutState queued = new RolloutState("billing-rollout-2", RolloutConfig.builder(RolloutStrategy.CANARY,
                TestRolloutEngine.spec("billing", "2.0.0")).build());

        // When
        boolean queuedFailed = queued.failBeforeStart("SYSTEM_ERROR: shut down");
        boolean runningFailed = state.failBeforeStart("SYSTEM_ERROR: shut down");

        // Then
        assertThat(queuedFailed).isTrue();
        assertThat(queued.getCurrentPhase()).isEqualTo(RolloutPhase.FAILED);
        assertThat(queued.getErrors()).containsExactly("SYSTEM_ERROR: shut down");
        assertThat(runningFailed).isFalse();
        assertThat(state.getCurrentPhase()).isEqualTo(RolloutPhase.DEPLOYING);
        assertThat(state.getErrors()).isEmpty();
    }
}
