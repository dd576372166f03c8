package xyz.firestige.retry.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.api.BackoffSequence;
import xyz.firestige.retry.api.RetryCallback;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * 阻塞重试执行器
 * <p>
 * 在调用线程上运行 ATTEMPT → EVALUATE → WAIT 循环，WAIT 期间阻塞调用线程。
 * 线程被中断视为取消：恢复中断标记，不再尝试，抛出 {@link CancellationException}。
 * <p>
 * 执行器本身无状态，每次调用创建自己的上下文与退避序列，可被多个线程同时使用。
 *
 * @author AI
 * @since 1.0
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final RetryEvaluator evaluator;

    public RetryExecutor(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.evaluator = new RetryEvaluator(policy);
    }

    /**
     * 执行目标操作直到成功或失败策略给出异常
     */
    public <T, E extends Exception> T execute(RetryCallback<T, E> callback) throws E {
        Objects.requireNonNull(callback, "callback");
        DefaultRetryContext context = new DefaultRetryContext(policy.getClock());
        BackoffSequence backoff = policy.getBackoff().start();

        RetryState state = RetryState.ATTEMPT;
        Verdict verdict = null;
        T result = null;
        while (true) {
            switch (state) {
                case ATTEMPT -> {
                    if (Thread.currentThread().isInterrupted()) {
                        throw cancelled(context, null);
                    }
                    context.beginAttempt();
                    result = null;
                    try {
                        result = callback.call();
                        context.recordResult(result);
                    } catch (Exception e) {
                        if (e instanceof InterruptedException) {
                            Thread.currentThread().interrupt();
                            throw cancelled(context, e);
                        }
                        context.recordException(e);
                        log.debug("[Retry] Attempt {} failed: {}", context.getAttemptCount(), e.toString());
                    }
                    state = RetryState.EVALUATE;
                }
                case EVALUATE -> {
                    verdict = evaluator.evaluate(context, backoff);
                    state = verdict.next();
                }
                case WAIT -> {
                    pause(verdict.delay(), context);
                    state = RetryState.ATTEMPT;
                }
                case SUCCEED -> {
                    return result;
                }
                case FAIL -> RetryExecutor.<E>rethrow(verdict.error());
            }
        }
    }

    private void pause(Duration wait, DefaultRetryContext context) {
        if (wait.isZero()) {
            return;
        }
        try {
            policy.getSleeper().sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(context, e);
        }
    }

    private CancellationException cancelled(DefaultRetryContext context, Throwable cause) {
        log.debug("[Retry] Interrupted, abandoning after {} attempts", context.getAttemptCount());
        CancellationException cancelled =
            new CancellationException("Retry cancelled after " + context.getAttemptCount() + " attempts");
        if (cause != null) {
            cancelled.initCause(cause);
        }
        evaluator.listeners().onAborted(context, cancelled);
        return cancelled;
    }

    @SuppressWarnings("unchecked")
    private static <E extends Exception> void rethrow(Exception error) throws E {
        if (error instanceof RuntimeException runtime) {
            throw runtime;
        }
        throw (E) error;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
