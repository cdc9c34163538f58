package xyz.firestige.rollout.infrastructure.traffic;

import java.util.Map;

/**
 * 流量切分（Istio / NGINX 等由外部实现）
 */
public interface TrafficManager {

    /**
     * @param versionWeights 版本 → 权重，如 {"old": 90, "new": 10}
     */
    void setTrafficSplit(String serviceName, Map<String, Integer> versionWeights);

    Map<String, Integer> getCurrentSplit(String serviceName);
}
