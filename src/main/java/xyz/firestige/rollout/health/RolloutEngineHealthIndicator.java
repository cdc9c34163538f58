package xyz.firestige.rollout.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import xyz.firestige.rollout.application.rollout.RolloutOrchestrator;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;
import xyz.firestige.rollout.domain.rollout.RolloutStateSnapshot;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 发布引擎健康检查
 *
 * <p>上报内容：
 * <ul>
 *   <li>activeRollouts：未结束的发布总数</li>
 *   <li>phases：按当前阶段分组的数量</li>
 *   <li>rollingBack：正在补偿回滚的发布</li>
 * </ul>
 * 有发布正在回滚时状态为 WARNING，引擎本身仍可用。
 */
public class RolloutEngineHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(RolloutEngineHealthIndicator.class);

    private final RolloutOrchestrator rolloutOrchestrator;

    public RolloutEngineHealthIndicator(RolloutOrchestrator rolloutOrchestrator) {
        this.rolloutOrchestrator = rolloutOrchestrator;
    }

    @Override
    public Health health() {
        try {
            List<RolloutStateSnapshot> active = rolloutOrchestrator.listActiveRollouts();

            Map<RolloutPhase, Integer> byPhase = new EnumMap<>(RolloutPhase.class);
            Map<String, String> rollingBack = new TreeMap<>();
            for (RolloutStateSnapshot snapshot : active) {
                byPhase.merge(snapshot.getCurrentPhase(), 1, Integer::sum);
                if (snapshot.getCurrentPhase() == RolloutPhase.ROLLING_BACK) {
                    rollingBack.put(snapshot.getRolloutId(), snapshot.getServiceName());
                }
            }

            Health.Builder builder = rollingBack.isEmpty() ? Health.up() : Health.status("WARNING");
            return builder
                .withDetail("activeRollouts", active.size())
                .withDetail("phases", byPhase)
                .withDetail("rollingBack", rollingBack)
                .build();

        } catch (RuntimeException e) {
            log.error("[RolloutEngineHealthIndicator] 健康检查异常", e);
            return Health.down()
                .withException(e)
                .withDetail("message", "健康检查异常，但引擎仍可运行")
                .build();
        }
    }
}
