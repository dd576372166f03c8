package xyz.firestige.retry.core;

import xyz.firestige.retry.api.Backoff;
import xyz.firestige.retry.api.ExceptionPredicate;
import xyz.firestige.retry.api.ResultPredicate;
import xyz.firestige.retry.api.RetryDecision;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.StopStrategy;
import xyz.firestige.retry.backoff.FixedBackoff;
import xyz.firestige.retry.decision.PredicateRetryDecision;
import xyz.firestige.retry.stop.CompositeStopStrategy;
import xyz.firestige.retry.stop.ElapsedTimeStopStrategy;
import xyz.firestige.retry.stop.MaxAttemptsStopStrategy;
import xyz.firestige.retry.stop.NeverStopStrategy;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 不可变的重试策略
 * <p>
 * 由 {@link RetryPolicyBuilderImpl} 构建；默认值 {@link #defaults()} 只构造一次，
 * 构建器从它复制，不存在可变的全局状态。
 *
 * @author AI
 * @since 1.0
 */
public final class RetryPolicy {

    private static final RetryPolicy DEFAULTS = new RetryPolicyBuilderImpl().buildPolicy();

    private final Integer maxAttempts;
    private final Duration giveUpAfter;
    private final StopStrategy customStop;
    private final Backoff backoff;
    private final ExceptionPredicate exceptionPredicate;
    private final ResultPredicate resultPredicate;
    private final RetryDecision customDecision;
    private final boolean wrapException;
    private final boolean reraise;
    private final List<RetryListener> listeners;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Sleeper sleeper;

    // 派生
    private final StopStrategy stopStrategy;
    private final ElapsedTimeStopStrategy elapsedStop;
    private final RetryDecision decision;
    private final FailurePolicy failurePolicy;

    RetryPolicy(RetryPolicyBuilderImpl builder) {
        this.maxAttempts = builder.getMaxAttempts();
        this.giveUpAfter = builder.getGiveUpAfter();
        this.customStop = builder.getCustomStop();
        this.backoff = builder.getBackoff();
        this.exceptionPredicate = builder.getExceptionPredicate();
        this.resultPredicate = builder.getResultPredicate();
        this.customDecision = builder.getCustomDecision();
        this.wrapException = builder.isWrapException();
        this.reraise = builder.isReraise();
        this.listeners = List.copyOf(builder.getListeners());
        this.scheduler = builder.getScheduler();
        this.clock = builder.getClock();
        this.sleeper = builder.getSleeper();

        // 次数在前、时间在后：两者同时满足时上报次数耗尽
        List<StopStrategy> stops = new ArrayList<>();
        if (maxAttempts != null) {
            stops.add(new MaxAttemptsStopStrategy(maxAttempts));
        }
        this.elapsedStop = giveUpAfter != null ? new ElapsedTimeStopStrategy(giveUpAfter) : null;
        if (elapsedStop != null) {
            stops.add(elapsedStop);
        }
        if (customStop != null) {
            stops.add(customStop);
        }
        this.stopStrategy = stops.isEmpty() ? new NeverStopStrategy() : CompositeStopStrategy.anyOf(stops);

        if (customDecision != null) {
            this.decision = customDecision;
        } else if (exceptionPredicate == null && resultPredicate == null) {
            this.decision = PredicateRetryDecision.defaults();
        } else {
            this.decision = new PredicateRetryDecision(
                exceptionPredicate != null ? exceptionPredicate : ExceptionPredicate.any(),
                resultPredicate != null ? resultPredicate : ResultPredicate.never());
        }
        this.failurePolicy = new FailurePolicy(wrapException, reraise);
    }

    /**
     * 默认策略：不限次数、不限时间、无等待、任何异常都重试、从不因返回值重试
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    public Integer getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getGiveUpAfter() {
        return giveUpAfter;
    }

    public StopStrategy getCustomStop() {
        return customStop;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public ExceptionPredicate getExceptionPredicate() {
        return exceptionPredicate;
    }

    public ResultPredicate getResultPredicate() {
        return resultPredicate;
    }

    public RetryDecision getCustomDecision() {
        return customDecision;
    }

    public boolean isWrapException() {
        return wrapException;
    }

    public boolean isReraise() {
        return reraise;
    }

    public List<RetryListener> getListeners() {
        return listeners;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public Clock getClock() {
        return clock;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public StopStrategy getStopStrategy() {
        return stopStrategy;
    }

    ElapsedTimeStopStrategy getElapsedStop() {
        return elapsedStop;
    }

    public RetryDecision getDecision() {
        return decision;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts
            + ", giveUpAfter=" + giveUpAfter
            + ", backoff=" + backoff.getName()
            + ", stop=" + stopStrategy.getName()
            + ", wrapException=" + wrapException
            + ", reraise=" + reraise + '}';
    }
}
