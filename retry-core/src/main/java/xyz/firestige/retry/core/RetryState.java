package xyz.firestige.retry.core;

/**
 * 单次调用的状态
 * <p>
 * ATTEMPT → EVALUATE → WAIT → ATTEMPT ...，终态为 SUCCEED 或 FAIL。
 */
enum RetryState {
    ATTEMPT,
    EVALUATE,
    WAIT,
    SUCCEED,
    FAIL
}
