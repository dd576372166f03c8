package xyz.firestige.retry.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.api.AsyncRetryCallback;
import xyz.firestige.retry.api.BackoffSequence;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 异步重试执行器
 * <p>
 * WAIT 不占用线程：下一次尝试被调度到 {@link ScheduledExecutorService}（若已配置），
 * 否则交给 {@link CompletableFuture#delayedExecutor}。同一次调用的尝试严格串行。
 * <p>
 * 取消返回的 future 会取消进行中的尝试和已调度的下一次尝试，之后不再发起新的尝试。
 *
 * @author AI
 * @since 1.0
 */
public class AsyncRetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(AsyncRetryExecutor.class);

    private final RetryPolicy policy;
    private final RetryEvaluator evaluator;

    public AsyncRetryExecutor(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.evaluator = new RetryEvaluator(policy);
    }

    public <T> CompletableFuture<T> execute(AsyncRetryCallback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        CompletableFuture<T> promise = new CompletableFuture<>();
        new Invocation<>(callback, promise).attempt();
        return promise;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * 一次调用的状态，尝试之间通过 future 回调或调度器交接
     */
    private final class Invocation<T> {

        private final AsyncRetryCallback<T> callback;
        private final CompletableFuture<T> promise;
        private final DefaultRetryContext context;
        private final BackoffSequence backoff;

        private volatile CompletableFuture<T> inFlight;
        private volatile Future<?> pending;

        Invocation(AsyncRetryCallback<T> callback, CompletableFuture<T> promise) {
            this.callback = callback;
            this.promise = promise;
            this.context = new DefaultRetryContext(policy.getClock());
            this.backoff = policy.getBackoff().start();
            promise.whenComplete((result, error) -> {
                if (promise.isCancelled()) {
                    onCancelled();
                }
            });
        }

        /**
         * ATTEMPT
         */
        void attempt() {
            if (promise.isDone()) {
                return;
            }
            try {
                context.beginAttempt();
                CompletionStage<T> stage;
                try {
                    stage = Objects.requireNonNull(callback.call(), "callback returned null stage");
                } catch (Exception e) {
                    onOutcome(null, e);
                    return;
                }
                CompletableFuture<T> future = stage.toCompletableFuture();
                inFlight = future;
                // 取消可能发生在调用目标操作期间，此时 onCancelled 看不到这次的 future
                if (promise.isCancelled()) {
                    future.cancel(true);
                    return;
                }
                future.whenComplete(this::onOutcome);
            } catch (Throwable t) {
                promise.completeExceptionally(t);
            }
        }

        /**
         * EVALUATE
         */
        private void onOutcome(T result, Throwable failure) {
            if (promise.isDone()) {
                return;
            }
            try {
                Throwable error = unwrap(failure);
                if (error instanceof CancellationException) {
                    promise.cancel(false);
                    return;
                }
                if (error != null && !(error instanceof Exception)) {
                    promise.completeExceptionally(error);
                    return;
                }
                if (error != null) {
                    context.recordException((Exception) error);
                    log.debug("[Retry] Async attempt {} failed: {}", context.getAttemptCount(), error.toString());
                } else {
                    context.recordResult(result);
                }

                Verdict verdict = evaluator.evaluate(context, backoff);
                switch (verdict.next()) {
                    case SUCCEED -> promise.complete(result);
                    case FAIL -> promise.completeExceptionally(verdict.error());
                    default -> schedule(verdict.delay());
                }
            } catch (Throwable t) {
                promise.completeExceptionally(t);
            }
        }

        /**
         * WAIT
         */
        private void schedule(Duration wait) {
            ScheduledExecutorService scheduler = policy.getScheduler();
            if (scheduler != null) {
                pending = scheduler.schedule(this::attempt, wait.toNanos(), TimeUnit.NANOSECONDS);
            } else {
                CompletableFuture.delayedExecutor(wait.toNanos(), TimeUnit.NANOSECONDS).execute(this::attempt);
            }
            // 调度与取消并发时补一次取消
            Future<?> scheduled = pending;
            if (promise.isCancelled() && scheduled != null) {
                scheduled.cancel(false);
            }
        }

        private void onCancelled() {
            log.debug("[Retry] Async retry cancelled after {} attempts", context.getAttemptCount());
            Future<?> scheduled = pending;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
            CompletableFuture<T> running = inFlight;
            if (running != null) {
                running.cancel(true);
            }
            evaluator.listeners().onAborted(context,
                new CancellationException("Retry cancelled after " + context.getAttemptCount() + " attempts"));
        }

        private Throwable unwrap(Throwable failure) {
            Throwable error = failure;
            while ((error instanceof CompletionException || error instanceof ExecutionException)
                    && error.getCause() != null) {
                error = error.getCause();
            }
            return error;
        }
    }
}
