package xyz.firestige.retry.api;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 重试策略构建器
 *
 * <p>默认：不限次数、不限时间、无等待、任何异常都重试、从不因返回值重试、不包装、不重抛。
 *
 * <pre>{@code
 * String body = retryService.policy()
 *     .maxAttempts(5)
 *     .giveUpAfter(Duration.ofSeconds(30))
 *     .exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(5))
 *     .retryOn(IOException.class)
 *     .build()
 *     .execute(() -> client.fetch());
 * }</pre>
 *
 * @author AI
 * @since 1.0
 */
public interface RetryPolicyBuilder {

    /** 最大尝试次数（含第一次），必须 >= 1 */
    RetryPolicyBuilder maxAttempts(int maxAttempts);

    /** 从调用开始计算的最长重试时间，必须为正 */
    RetryPolicyBuilder giveUpAfter(Duration giveUpAfter);

    /** 附加的自定义停止策略，在次数与时间限制之后评估 */
    RetryPolicyBuilder stopWhen(StopStrategy stopStrategy);

    RetryPolicyBuilder backoff(Backoff backoff);

    /** 任意时长序列，每次调用重新取迭代器 */
    RetryPolicyBuilder backoff(Iterable<Duration> durations);

    RetryPolicyBuilder noBackoff();

    RetryPolicyBuilder fixedBackoff(Duration delay);

    RetryPolicyBuilder randomBackoff(Duration min, Duration max);

    RetryPolicyBuilder exponentialBackoff(Duration base, Duration cap);

    RetryPolicyBuilder exponentialBackoff(Duration base, Duration cap, double multiplier, double randomizationFactor);

    RetryPolicyBuilder retryOn(ExceptionPredicate predicate);

    /** 只在给定类型（含子类）的异常上重试 */
    @SuppressWarnings("unchecked")
    RetryPolicyBuilder retryOn(Class<? extends Exception>... exceptionTypes);

    RetryPolicyBuilder retryIfResult(ResultPredicate predicate);

    RetryPolicyBuilder retryOnNullResult();

    /** 统一判定，不能与 {@code retryOn} / {@code retryIfResult} 同时使用 */
    RetryPolicyBuilder decision(RetryDecision decision);

    /** 原始异常跨出边界前包装为 {@code WrappedFailureException} */
    RetryPolicyBuilder wrapException(boolean wrapException);

    /** 耗尽时抛出最后一次的原因而不是专用耗尽异常 */
    RetryPolicyBuilder reraise(boolean reraise);

    RetryPolicyBuilder listener(RetryListener listener);

    /** 异步执行时用于调度等待的线程池，未设置时使用 {@code CompletableFuture.delayedExecutor} */
    RetryPolicyBuilder scheduler(ScheduledExecutorService scheduler);

    RetryOperations build();
}
