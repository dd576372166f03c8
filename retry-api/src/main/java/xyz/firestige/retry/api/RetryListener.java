package xyz.firestige.retry.api;

import java.time.Duration;

/**
 * 重试生命周期监听器
 * <p>
 * 监听器抛出的异常只记录日志，不影响重试流程。
 */
public interface RetryListener {

    /** 一次尝试的结果被判定为可重试（异常或不可接受的返回值） */
    default void onAttemptFailed(RetryContext context) {}

    /** 即将等待 {@code wait} 后发起下一次尝试 */
    default void onRetry(RetryContext context, Duration wait) {}

    /** 调用成功 */
    default void onSuccess(RetryContext context, Object result) {}

    /** 因停止策略终止 */
    default void onExhausted(RetryContext context, StopReason reason, Throwable error) {}

    /** 结果被判定为不可重试、判定函数失败或调用被取消，立即终止 */
    default void onAborted(RetryContext context, Throwable error) {}

    static RetryListener noop() {
        return new RetryListener() {};
    }
}
