package xyz.firestige.retry.core;

/**
 * 进入 FAIL 状态的原因
 */
public enum FailReason {

    /** 结果被判定为不可重试（或判定函数失败），不经过停止策略直接传播 */
    IMMEDIATE,

    /** 停止策略终止了循环 */
    EXHAUSTED
}
