package xyz.firestige.retry.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.api.Attempt;
import xyz.firestige.retry.api.BackoffSequence;
import xyz.firestige.retry.api.StopReason;
import xyz.firestige.retry.exception.RetryDecisionException;
import xyz.firestige.retry.exception.TryAgainException;
import xyz.firestige.retry.stop.ElapsedTimeStopStrategy;

import java.time.Duration;

/**
 * EVALUATE 状态：阻塞与异步执行器共用
 * <p>
 * 判定 → 停止策略 → 退避，给出下一个状态；进入 FAIL 时同时给出唯一要抛出的异常。
 *
 * @author AI
 * @since 1.0
 */
final class RetryEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RetryEvaluator.class);

    private final RetryPolicy policy;
    private final RetryListeners listeners;

    RetryEvaluator(RetryPolicy policy) {
        this.policy = policy;
        this.listeners = new RetryListeners(policy.getListeners());
    }

    RetryListeners listeners() {
        return listeners;
    }

    Verdict evaluate(DefaultRetryContext context, BackoffSequence backoff) {
        Attempt last = context.getLastAttempt();

        boolean retry;
        if (last.exception() instanceof TryAgainException) {
            retry = true;
        } else {
            try {
                retry = policy.getDecision().shouldRetry(last.result(), last.exception(), context);
            } catch (RuntimeException e) {
                log.warn("[Retry] Retry decision failed: attempt={}", context.getAttemptCount(), e);
                RetryDecisionException error = new RetryDecisionException(
                    "Retry decision failed: " + e.getMessage(), context, e);
                listeners.onAborted(context, error);
                return Verdict.failImmediately(error);
            }
        }

        if (!retry) {
            if (!last.isFailure()) {
                log.debug("[Retry] 成功: attempts={}, elapsed={}ms",
                    context.getAttemptCount(), context.getElapsed().toMillis());
                listeners.onSuccess(context, last.result());
                return Verdict.succeed();
            }
            log.debug("[Retry] 异常不可重试，立即传播: attempt={}, error={}",
                context.getAttemptCount(), last.exception().toString());
            Exception error = policy.getFailurePolicy().onImmediate(context);
            listeners.onAborted(context, error);
            return Verdict.failImmediately(error);
        }

        listeners.onAttemptFailed(context);

        // 停止策略优先于重试
        StopReason reason = policy.getStopStrategy().evaluate(context);
        if (reason == null) {
            Duration wait = backoff.next();
            if (wait == null || wait.isNegative()) {
                throw new IllegalStateException("Backoff produced an invalid duration: " + wait);
            }
            ElapsedTimeStopStrategy elapsedStop = policy.getElapsedStop();
            if (elapsedStop != null && elapsedStop.wouldExceed(context, wait)) {
                log.debug("[Retry] Next retry would exceed time limit: wait={}ms", wait.toMillis());
                reason = StopReason.TIMEOUT;
            } else {
                log.debug("[Retry] 第 {} 次尝试失败，{}ms 后重试", context.getAttemptCount(), wait.toMillis());
                listeners.onRetry(context, wait);
                return Verdict.retryAfter(wait);
            }
        }

        log.warn("[Retry] 放弃重试: attempts={}, reason={}, elapsed={}ms",
            context.getAttemptCount(), reason, context.getElapsed().toMillis());
        Exception error = policy.getFailurePolicy().onExhausted(context, reason);
        listeners.onExhausted(context, reason, error);
        return Verdict.exhausted(reason, error);
    }
}
