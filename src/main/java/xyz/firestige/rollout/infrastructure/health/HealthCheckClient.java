package xyz.firestige.rollout.infrastructure.health;

import xyz.firestige.rollout.domain.deployment.HealthCheckConfig;
import xyz.firestige.rollout.domain.deployment.HealthCheckRecord;

/**
 * 健康探测客户端：执行一次探测并返回结果记录，探测失败体现在记录里而不是异常
 */
public interface HealthCheckClient {

    HealthCheckRecord probe(HealthCheckConfig check);
}
