package xyz.firestige.retry.backoff;

import xyz.firestige.retry.api.Backoff;
import xyz.firestige.retry.api.BackoffSequence;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 随机间隔退避
 * <p>
 * 每次在 [min, max) 内均匀取值，各次之间相互独立；min 等于 max 时恒为 min。
 *
 * @author AI
 * @since 1.0
 */
public class RandomBackoff implements Backoff {

    private final Duration min;

    private final Duration max;

    private final long minNanos;

    private final long maxNanos;

    public RandomBackoff(Duration min, Duration max) {
        if (min == null || max == null) {
            throw new IllegalArgumentException("min and max are required");
        }
        if (min.isNegative()) {
            throw new IllegalArgumentException("min must not be negative");
        }
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("min must not be greater than max: min=" + min + ", max=" + max);
        }
        this.minNanos = BackoffDurations.toNanos(min, "min");
        this.maxNanos = BackoffDurations.toNanos(max, "max");
        this.min = min;
        this.max = max;
    }

    @Override
    public BackoffSequence start() {
        long lo = minNanos;
        long hi = maxNanos;
        if (lo == hi) {
            return () -> min;
        }
        return () -> Duration.ofNanos(ThreadLocalRandom.current().nextLong(lo, hi));
    }

    public Duration getMin() {
        return min;
    }

    public Duration getMax() {
        return max;
    }

    @Override
    public String getName() {
        return "RandomBackoff";
    }
}
