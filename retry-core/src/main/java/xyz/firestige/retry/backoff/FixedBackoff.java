package xyz.firestige.retry.backoff;

import xyz.firestige.retry.api.Backoff;
import xyz.firestige.retry.api.BackoffSequence;

import java.time.Duration;

/**
 * 固定间隔退避
 *
 * @author AI
 * @since 1.0
 */
public class FixedBackoff implements Backoff {

    private static final FixedBackoff NONE = new FixedBackoff(Duration.ZERO);

    private final Duration delay;

    public FixedBackoff(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        this.delay = delay;
    }

    /**
     * 不等待（默认退避）
     */
    public static FixedBackoff none() {
        return NONE;
    }

    @Override
    public BackoffSequence start() {
        return () -> delay;
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public String getName() {
        return "FixedBackoff";
    }
}
