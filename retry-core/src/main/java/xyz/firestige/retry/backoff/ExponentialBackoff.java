package xyz.firestige.retry.backoff;

import xyz.firestige.retry.api.Backoff;
import xyz.firestige.retry.api.BackoffSequence;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 指数退避
 * <p>
 * 第 n 次（从 0 开始）等待 {@code min(base * multiplier^n, cap)}，到达上限后保持不变。
 * 随机因子 f 大于 0 时，实际等待在 {@code [current * (1 - f), current * (1 + f)]} 内均匀取值，
 * 未加抖动的基准值仍按上述规则递增并封顶。
 *
 * @author AI
 * @since 1.0
 */
public class ExponentialBackoff implements Backoff {

    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final Duration base;

    private final Duration cap;

    private final double multiplier;

    private final double randomizationFactor;

    private final long baseNanos;

    private final long capNanos;

    public ExponentialBackoff(Duration base, Duration cap) {
        this(base, cap, DEFAULT_MULTIPLIER, 0.0);
    }

    public ExponentialBackoff(Duration base, Duration cap, double multiplier, double randomizationFactor) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(cap, "cap");
        if (base.isNegative()) throw new IllegalArgumentException("base must not be negative");
        if (cap.isNegative()) throw new IllegalArgumentException("cap must not be negative");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier < 1.0");
        if (randomizationFactor < 0.0 || randomizationFactor >= 1.0) {
            throw new IllegalArgumentException("randomizationFactor must be in [0, 1)");
        }
        this.baseNanos = BackoffDurations.toNanos(base, "base");
        this.capNanos = BackoffDurations.toNanos(cap, "cap");
        this.base = base;
        this.cap = cap;
        this.multiplier = multiplier;
        this.randomizationFactor = randomizationFactor;
    }

    @Override
    public BackoffSequence start() {
        return new Sequence();
    }

    public Duration getBase() {
        return base;
    }

    public Duration getCap() {
        return cap;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public double getRandomizationFactor() {
        return randomizationFactor;
    }

    @Override
    public String getName() {
        return "ExponentialBackoff";
    }

    /**
     * 单次调用的序列状态，以纳秒计
     */
    private final class Sequence implements BackoffSequence {

        private long currentNanos = Math.min(baseNanos, capNanos);

        @Override
        public Duration next() {
            long interval = currentNanos;
            if (currentNanos < capNanos) {
                double candidate = currentNanos * multiplier;
                currentNanos = candidate >= capNanos ? capNanos : (long) candidate;
            }
            return Duration.ofNanos(randomize(interval));
        }

        private long randomize(long interval) {
            if (randomizationFactor == 0.0 || interval == 0) {
                return interval;
            }
            long delta = (long) (interval * randomizationFactor);
            if (delta == 0) {
                return interval;
            }
            long upper = BackoffDurations.saturatedAdd(interval, delta);
            return upper == Long.MAX_VALUE
                ? ThreadLocalRandom.current().nextLong(interval - delta, upper)
                : ThreadLocalRandom.current().nextLong(interval - delta, upper + 1);
        }
    }
}
