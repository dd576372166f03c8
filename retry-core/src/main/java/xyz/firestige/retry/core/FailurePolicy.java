package xyz.firestige.retry.core;

import xyz.firestige.retry.api.Attempt;
import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.StopReason;
import xyz.firestige.retry.exception.AttemptsExhaustedException;
import xyz.firestige.retry.exception.RejectedResultException;
import xyz.firestige.retry.exception.RetryExhaustedException;
import xyz.firestige.retry.exception.TimeExhaustedException;
import xyz.firestige.retry.exception.WrappedFailureException;

/**
 * 失败策略
 * <p>
 * 决定 FAIL 状态向调用方抛出哪一个异常：
 * <ul>
 *   <li>立即传播：原始异常；wrapException 时包装为 {@link WrappedFailureException}</li>
 *   <li>耗尽 + reraise：最后一次异常，或承载最后返回值的 {@link RejectedResultException}；wrapException 时包装</li>
 *   <li>耗尽：{@link AttemptsExhaustedException} / {@link TimeExhaustedException} / {@link RetryExhaustedException}，
 *       cause 为最后一次的原因，本身已是重试异常，不再包装</li>
 * </ul>
 *
 * @author AI
 * @since 1.0
 */
public final class FailurePolicy {

    private final boolean wrapException;
    private final boolean reraise;

    public FailurePolicy(boolean wrapException, boolean reraise) {
        this.wrapException = wrapException;
        this.reraise = reraise;
    }

    /**
     * 结果被判定为不可重试
     */
    public Exception onImmediate(RetryContext context) {
        Exception cause = lastCause(context);
        return wrapException ? wrap(cause, context) : cause;
    }

    /**
     * 停止策略终止了循环
     */
    public Exception onExhausted(RetryContext context, StopReason reason) {
        Exception cause = lastCause(context);
        if (reraise) {
            return wrapException ? wrap(cause, context) : cause;
        }
        int attempts = context.getAttemptCount();
        return switch (reason) {
            case MAX_ATTEMPTS -> new AttemptsExhaustedException(
                "Max attempts reached: attempts=" + attempts, context, cause);
            case TIMEOUT -> new TimeExhaustedException(
                "Retry time limit reached: attempts=" + attempts + ", elapsed=" + context.getElapsed().toMillis() + "ms",
                context, cause);
            case CUSTOM -> new RetryExhaustedException(
                "Stop condition reached: attempts=" + attempts, context, reason, cause);
        };
    }

    private static Exception lastCause(RetryContext context) {
        Attempt last = context.getLastAttempt();
        if (last == null) {
            throw new IllegalStateException("No completed attempt");
        }
        return last.isFailure() ? last.exception() : new RejectedResultException(last.result());
    }

    private static WrappedFailureException wrap(Exception cause, RetryContext context) {
        return new WrappedFailureException(String.valueOf(cause), context, cause);
    }

    public boolean isWrapException() {
        return wrapException;
    }

    public boolean isReraise() {
        return reraise;
    }
}
