package xyz.firestige.rollout.domain.rollout;

/**
 * 流量切分方式，交由 TrafficManager 实现解释
 */
public enum TrafficSplitMethod {
    PERCENTAGE,
    USER_ATTRIBUTE,
    GEOGRAPHIC,
    DEVICE_TYPE,
    RANDOM
}
