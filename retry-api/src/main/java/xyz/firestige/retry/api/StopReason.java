package xyz.firestige.retry.api;

/**
 * 停止原因
 */
public enum StopReason {

    /** 达到最大尝试次数 */
    MAX_ATTEMPTS,

    /** 达到最长重试时间 */
    TIMEOUT,

    /** 自定义停止策略 */
    CUSTOM
}
