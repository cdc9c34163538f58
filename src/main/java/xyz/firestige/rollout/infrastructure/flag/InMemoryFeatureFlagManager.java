package xyz.firestige.rollout.infrastructure.flag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内特性开关表
 */
public class InMemoryFeatureFlagManager implements FeatureFlagManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFeatureFlagManager.class);

    private final Map<String, FeatureFlagStatus> flags = new ConcurrentHashMap<>();

    @Override
    public void enableFlag(String flagName, int percentage, Map<String, Object> filters) {
        Map<String, Object> f = filters == null ? Collections.emptyMap() : filters;
        flags.put(flagName, new FeatureFlagStatus(flagName, true, percentage, f));
        log.info("[InMemoryFeatureFlagManager] 开关已开启: flag={}, percentage={}, filters={}", flagName, percentage, f);
    }

    @Override
    public void disableFlag(String flagName) {
        flags.put(flagName, new FeatureFlagStatus(flagName, false, 0, Collections.emptyMap()));
        log.info("[InMemoryFeatureFlagManager] 开关已关闭: flag={}", flagName);
    }

    @Override
    public FeatureFlagStatus getFlagStatus(String flagName) {
        return flags.getOrDefault(flagName, FeatureFlagStatus.unknown(flagName));
    }
}
