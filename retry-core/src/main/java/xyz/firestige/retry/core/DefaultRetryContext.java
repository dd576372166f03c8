package xyz.firestige.retry.core;

import xyz.firestige.retry.api.Attempt;
import xyz.firestige.retry.api.RetryContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 重试上下文默认实现
 * <p>
 * 由一次调用独占，只有执行器会修改，每次尝试修改一次。
 * 尝试历史只保留最近 {@value #HISTORY_LIMIT} 条，避免无限重试时无界增长。
 *
 * @author AI
 * @since 1.0
 */
public class DefaultRetryContext implements RetryContext {

    static final int HISTORY_LIMIT = 64;

    private final Clock clock;
    private final Instant startTime;
    private final Deque<Attempt> attempts = new ArrayDeque<>();

    private int attemptCount;
    private Instant attemptStartedAt;
    private Exception lastException;
    private Object lastResult;

    public DefaultRetryContext(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startTime = clock.instant();
    }

    /**
     * 开始一次新的尝试
     */
    public void beginAttempt() {
        attemptCount++;
        attemptStartedAt = clock.instant();
    }

    /**
     * 记录本次尝试的返回值
     */
    public void recordResult(Object result) {
        this.lastResult = result;
        finish(result, null);
    }

    /**
     * 记录本次尝试抛出的异常
     */
    public void recordException(Exception exception) {
        this.lastException = Objects.requireNonNull(exception, "exception");
        finish(null, exception);
    }

    private void finish(Object result, Exception exception) {
        if (attemptStartedAt == null) {
            throw new IllegalStateException("No attempt in progress");
        }
        attempts.addLast(new Attempt(attemptCount, result, exception, attemptStartedAt, clock.instant()));
        if (attempts.size() > HISTORY_LIMIT) {
            attempts.removeFirst();
        }
        attemptStartedAt = null;
    }

    @Override
    public int getAttemptCount() {
        return attemptCount;
    }

    @Override
    public Instant getStartTime() {
        return startTime;
    }

    @Override
    public Duration getElapsed() {
        return Duration.between(startTime, clock.instant());
    }

    @Override
    public Exception getLastException() {
        return lastException;
    }

    @Override
    public Object getLastResult() {
        return lastResult;
    }

    @Override
    public Attempt getLastAttempt() {
        return attempts.peekLast();
    }

    @Override
    public List<Attempt> getAttempts() {
        return List.copyOf(attempts);
    }

    @Override
    public String toString() {
        return "RetryContext{attempts=" + attemptCount
            + ", elapsed=" + getElapsed().toMillis() + "ms"
            + ", lastException=" + lastException
            + ", lastResult=" + lastResult + '}';
    }
}
