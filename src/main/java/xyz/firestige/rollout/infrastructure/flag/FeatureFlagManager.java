package xyz.firestige.rollout.infrastructure.flag;

import java.util.Map;

/**
 * 特性开关（LaunchDarkly 等由外部实现）
 */
public interface FeatureFlagManager {

    void enableFlag(String flagName, int percentage, Map<String, Object> filters);

    void disableFlag(String flagName);

    FeatureFlagStatus getFlagStatus(String flagName);
}
