package xyz.firestige.retry.core;

import xyz.firestige.retry.api.Backoff;
import xyz.firestige.retry.api.ExceptionPredicate;
import xyz.firestige.retry.api.ResultPredicate;
import xyz.firestige.retry.api.RetryDecision;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.RetryOperations;
import xyz.firestige.retry.api.RetryPolicyBuilder;
import xyz.firestige.retry.api.StopStrategy;
import xyz.firestige.retry.backoff.ExponentialBackoff;
import xyz.firestige.retry.backoff.FixedBackoff;
import xyz.firestige.retry.backoff.IterableBackoff;
import xyz.firestige.retry.backoff.RandomBackoff;
import xyz.firestige.retry.decision.ExceptionTypePredicate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 重试策略构建器实现
 * <p>
 * 参数错误在调用对应方法时立即抛出 {@link IllegalArgumentException}，
 * 组合错误在 {@link #build()} 时抛出 {@link IllegalStateException}。
 *
 * @author AI
 * @since 1.0
 */
public class RetryPolicyBuilderImpl implements RetryPolicyBuilder {

    private Integer maxAttempts;
    private Duration giveUpAfter;
    private StopStrategy customStop;
    private Backoff backoff = FixedBackoff.none();
    private ExceptionPredicate exceptionPredicate;
    private ResultPredicate resultPredicate;
    private RetryDecision customDecision;
    private boolean wrapException;
    private boolean reraise;
    private final List<RetryListener> listeners = new ArrayList<>();
    private ScheduledExecutorService scheduler;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.threadSleep();

    /**
     * 空白构建器，仅用于构造默认策略
     */
    RetryPolicyBuilderImpl() {
    }

    public RetryPolicyBuilderImpl(RetryPolicy base) {
        Objects.requireNonNull(base, "base");
        this.maxAttempts = base.getMaxAttempts();
        this.giveUpAfter = base.getGiveUpAfter();
        this.customStop = base.getCustomStop();
        this.backoff = base.getBackoff();
        this.exceptionPredicate = base.getExceptionPredicate();
        this.resultPredicate = base.getResultPredicate();
        this.customDecision = base.getCustomDecision();
        this.wrapException = base.isWrapException();
        this.reraise = base.isReraise();
        this.listeners.addAll(base.getListeners());
        this.scheduler = base.getScheduler();
        this.clock = base.getClock();
        this.sleeper = base.getSleeper();
    }

    @Override
    public RetryPolicyBuilder maxAttempts(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    @Override
    public RetryPolicyBuilder giveUpAfter(Duration giveUpAfter) {
        if (giveUpAfter == null || giveUpAfter.isNegative() || giveUpAfter.isZero()) {
            throw new IllegalArgumentException("giveUpAfter must be positive");
        }
        this.giveUpAfter = giveUpAfter;
        return this;
    }

    @Override
    public RetryPolicyBuilder stopWhen(StopStrategy stopStrategy) {
        this.customStop = Objects.requireNonNull(stopStrategy, "stopStrategy");
        return this;
    }

    @Override
    public RetryPolicyBuilder backoff(Backoff backoff) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        return this;
    }

    @Override
    public RetryPolicyBuilder backoff(Iterable<Duration> durations) {
        this.backoff = new IterableBackoff(durations);
        return this;
    }

    @Override
    public RetryPolicyBuilder noBackoff() {
        this.backoff = FixedBackoff.none();
        return this;
    }

    @Override
    public RetryPolicyBuilder fixedBackoff(Duration delay) {
        this.backoff = new FixedBackoff(delay);
        return this;
    }

    @Override
    public RetryPolicyBuilder randomBackoff(Duration min, Duration max) {
        this.backoff = new RandomBackoff(min, max);
        return this;
    }

    @Override
    public RetryPolicyBuilder exponentialBackoff(Duration base, Duration cap) {
        this.backoff = new ExponentialBackoff(base, cap);
        return this;
    }

    @Override
    public RetryPolicyBuilder exponentialBackoff(Duration base, Duration cap, double multiplier, double randomizationFactor) {
        this.backoff = new ExponentialBackoff(base, cap, multiplier, randomizationFactor);
        return this;
    }

    @Override
    public RetryPolicyBuilder retryOn(ExceptionPredicate predicate) {
        this.exceptionPredicate = Objects.requireNonNull(predicate, "predicate");
        return this;
    }

    @SafeVarargs
    @Override
    public final RetryPolicyBuilder retryOn(Class<? extends Exception>... exceptionTypes) {
        this.exceptionPredicate = new ExceptionTypePredicate(Arrays.asList(exceptionTypes));
        return this;
    }

    @Override
    public RetryPolicyBuilder retryIfResult(ResultPredicate predicate) {
        this.resultPredicate = Objects.requireNonNull(predicate, "predicate");
        return this;
    }

    @Override
    public RetryPolicyBuilder retryOnNullResult() {
        this.resultPredicate = ResultPredicate.isNull();
        return this;
    }

    @Override
    public RetryPolicyBuilder decision(RetryDecision decision) {
        this.customDecision = Objects.requireNonNull(decision, "decision");
        return this;
    }

    @Override
    public RetryPolicyBuilder wrapException(boolean wrapException) {
        this.wrapException = wrapException;
        return this;
    }

    @Override
    public RetryPolicyBuilder reraise(boolean reraise) {
        this.reraise = reraise;
        return this;
    }

    @Override
    public RetryPolicyBuilder listener(RetryListener listener) {
        this.listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    @Override
    public RetryPolicyBuilder scheduler(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        return this;
    }

    /**
     * 替换时钟（经过时间、尝试时间戳）
     */
    public RetryPolicyBuilderImpl clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    /**
     * 替换阻塞执行时的休眠实现
     */
    public RetryPolicyBuilderImpl sleeper(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        return this;
    }

    @Override
    public RetryOperations build() {
        return new DefaultRetryOperations(buildPolicy());
    }

    /**
     * 构建不可变策略
     */
    public RetryPolicy buildPolicy() {
        if (customDecision != null && (exceptionPredicate != null || resultPredicate != null)) {
            throw new IllegalStateException("decision cannot be combined with retryOn / retryIfResult");
        }
        return new RetryPolicy(this);
    }

    // ===== 供 RetryPolicy 读取 =====
    Integer getMaxAttempts() { return maxAttempts; }
    Duration getGiveUpAfter() { return giveUpAfter; }
    StopStrategy getCustomStop() { return customStop; }
    Backoff getBackoff() { return backoff; }
    ExceptionPredicate getExceptionPredicate() { return exceptionPredicate; }
    ResultPredicate getResultPredicate() { return resultPredicate; }
    RetryDecision getCustomDecision() { return customDecision; }
    boolean isWrapException() { return wrapException; }
    boolean isReraise() { return reraise; }
    List<RetryListener> getListeners() { return listeners; }
    ScheduledExecutorService getScheduler() { return scheduler; }
    Clock getClock() { return clock; }
    Sleeper getSleeper() { return sleeper; }
}
