package xyz.firestige.retry.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.StopReason;

import java.time.Duration;

/**
 * 基于 Micrometer 的重试监听器
 * <p>
 * 记录以下指标：
 * - retry_attempts: 被判定为需要重试的失败尝试次数
 * - retry_success: 成功次数
 * - retry_exhausted: 停止策略终止次数，按 reason 打标签
 * - retry_aborted: 不可重试或被取消的次数
 * - retry_duration: 整个调用的耗时分布
 *
 * @author AI
 * @since 1.0
 */
public class MicrometerRetryListener implements RetryListener {

    private final MeterRegistry registry;
    private final Counter attempts;
    private final Counter success;
    private final Counter aborted;
    private final Timer duration;

    public MicrometerRetryListener(MeterRegistry registry) {
        this.registry = registry;
        this.attempts = Counter.builder("retry_attempts")
            .description("Failed attempts eligible for retry")
            .register(registry);
        this.success = Counter.builder("retry_success")
            .description("Successful retry invocations")
            .register(registry);
        this.aborted = Counter.builder("retry_aborted")
            .description("Invocations aborted without retry")
            .register(registry);
        this.duration = Timer.builder("retry_duration")
            .description("Retry invocation duration")
            .publishPercentileHistogram()
            .register(registry);
    }

    @Override
    public void onAttemptFailed(RetryContext context) {
        attempts.increment();
    }

    @Override
    public void onSuccess(RetryContext context, Object result) {
        success.increment();
        record(context.getElapsed());
    }

    @Override
    public void onExhausted(RetryContext context, StopReason reason, Throwable error) {
        Counter.builder("retry_exhausted")
            .description("Invocations stopped by the stop strategy")
            .tag("reason", reason.name())
            .register(registry)
            .increment();
        record(context.getElapsed());
    }

    @Override
    public void onAborted(RetryContext context, Throwable error) {
        aborted.increment();
        record(context.getElapsed());
    }

    private void record(Duration elapsed) {
        duration.record(elapsed);
    }
}
