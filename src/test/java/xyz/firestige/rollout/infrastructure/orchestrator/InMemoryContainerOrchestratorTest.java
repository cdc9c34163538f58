package xyz.firestige.rollout.infrastructure.orchestrator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.rollout.domain.deployment.DeploymentStatus;
import xyz.firestige.rollout.exception.OrchestratorException;
import xyz.firestige.rollout.util.TestRolloutEngine;
import xyz.firestige.rollout.util.TimingExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 内存编排器：部署 / 状态 / 回滚 / 扩缩容语义
 */
@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("InMemoryContainerOrchestrator 单元测试")
class InMemoryContainerOrchestratorTest {

    private InMemoryContainerOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new InMemoryContainerOrchestrator();
    }

    @Test
    @DisplayName("场景 5.1: 每次部署返回不同的 ID，状态为 SUCCEEDED")
    void testDeployReturnsUniqueIds() {
        String first = orchestrator.deploy(TestRolloutEngine.spec("auth", "1.0.0"));
        String second = orchestrator.deploy(TestRolloutEngine.spec("auth", "1.0.0"));

        assertThat(first).isNotEqualTo(second).startsWith("auth-");
        assertThat(orchestrator.getDeploymentStatus(first)).isEqualTo(DeploymentStatus.SUCCEEDED);
        assertThat(orchestrator.getActiveDeployment("auth")).contains(second);
    }

    @Test
    @DisplayName("场景 5.2: 未知 ID 查询返回 FAILED 而不是抛异常")
    void testUnknownIdIsFailed() {
        assertThat(orchestrator.getDeploymentStatus("missing")).isEqualTo(DeploymentStatus.FAILED);
        assertThat(orchestrator.getDeploymentStatus(null)).isEqualTo(DeploymentStatus.FAILED);
    }

    @Test
    @DisplayName("场景 5.3: 回滚恢复同服务上一次成功的部署")
    void testRollbackRestoresPreviousSuccess() {
        // Given
        String v1 = orchestrator.deploy(TestRolloutEngine.spec("auth", "1.0.0"));
        orchestrator.deploy(TestRolloutEngine.spec("gateway", "9.0.0"));
        String v2 = orchestrator.deploy(TestRolloutEngine.spec("auth", "2.0.0"));

        // When
        boolean rolledBack = orchestrator.rollback(v2);

        // Then
        assertThat(rolledBack).isTrue();
        assertThat(orchestrator.getDeploymentStatus(v2)).isEqualTo(DeploymentStatus.ROLLED_BACK);
        assertThat(orchestrator.getActiveDeployment("auth")).contains(v1);
    }

    @Test
    @DisplayName("场景 5.4: 没有可恢复的历史部署时回滚返回 false")
    void testRollbackWithoutPrevious() {
        String only = orchestrator.deploy(TestRolloutEngine.spec("auth", "1.0.0"));

        assertThat(orchestrator.rollback(only)).isFalse();
        assertThat(orchestrator.rollback("missing")).isFalse();
        assertThat(orchestrator.getDeploymentStatus(only)).isEqualTo(DeploymentStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("场景 5.5: 部署失败先记录 FAILED 再抛出异常")
    void testFailedDeploymentIsRecorded() {
        // Given
        orchestrator.failDeploymentsWhen(spec -> "broken".equals(spec.getTag()));

        // When / Then
        assertThatThrownBy(() -> orchestrator.deploy(TestRolloutEngine.spec("auth", "broken")))
                .isInstanceOfSatisfying(OrchestratorException.class, e -> {
                    String deploymentId = (String) e.getContext().get("deploymentId");
                    assertThat(orchestrator.getDeploymentStatus(deploymentId)).isEqualTo(DeploymentStatus.FAILED);
                });
        assertThat(orchestrator.getActiveDeployment("auth")).isEmpty();
    }

    @Test
    @DisplayName("场景 5.6: 扩缩容未知服务或负数副本返回 false")
    void testScale() {
        orchestrator.deploy(TestRolloutEngine.spec("auth", "1.0.0"));

        assertThat(orchestrator.scale("auth", 5)).isTrue();
        assertThat(orchestrator.getReplicas("auth")).contains(5);
        assertThat(orchestrator.scale("auth", -1)).isFalse();
        assertThat(orchestrator.scale("unknown", 3)).isFalse();
    }
}
