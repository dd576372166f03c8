package xyz.firestige.retry.stop;

import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.StopReason;
import xyz.firestige.retry.api.StopStrategy;

import java.time.Duration;

/**
 * 基于经过时间的停止策略实现
 * <p>
 * 时间从调用开始计算。
 */
public class ElapsedTimeStopStrategy implements StopStrategy {

    private final Duration maxElapsed;

    public ElapsedTimeStopStrategy(Duration maxElapsed) {
        if (maxElapsed == null || maxElapsed.isNegative() || maxElapsed.isZero()) {
            throw new IllegalArgumentException("maxElapsed must be positive");
        }
        this.maxElapsed = maxElapsed;
    }

    @Override
    public boolean shouldStop(RetryContext context) {
        return context.getElapsed().compareTo(maxElapsed) >= 0;
    }

    /**
     * 等待 {@code wait} 之后是否会越过时间上限
     */
    public boolean wouldExceed(RetryContext context, Duration wait) {
        return context.getElapsed().plus(wait).compareTo(maxElapsed) >= 0;
    }

    @Override
    public StopReason getReason() {
        return StopReason.TIMEOUT;
    }

    public Duration getMaxElapsed() {
        return maxElapsed;
    }

    @Override
    public String getName() {
        return "ElapsedTimeStop";
    }
}
