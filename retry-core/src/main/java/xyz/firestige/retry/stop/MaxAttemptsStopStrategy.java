package xyz.firestige.retry.stop;

import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.StopReason;
import xyz.firestige.retry.api.StopStrategy;

/**
 * 基于尝试次数的停止策略实现
 */
public class MaxAttemptsStopStrategy implements StopStrategy {

    private final int maxAttempts;

    public MaxAttemptsStopStrategy(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public boolean shouldStop(RetryContext context) {
        return context.getAttemptCount() >= maxAttempts;
    }

    @Override
    public StopReason getReason() {
        return StopReason.MAX_ATTEMPTS;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public String getName() {
        return "MaxAttemptsStop";
    }
}
