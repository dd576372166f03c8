package xyz.firestige.retry.backoff;

import xyz.firestige.retry.api.Backoff;
import xyz.firestige.retry.api.BackoffSequence;

import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;

/**
 * 自定义时长序列退避
 * <p>
 * 每次调用重新取迭代器；有限序列用完后重复最后一个值（空序列为 0）。
 *
 * @author AI
 * @since 1.0
 */
public class IterableBackoff implements Backoff {

    private final Iterable<Duration> durations;

    public IterableBackoff(Iterable<Duration> durations) {
        this.durations = Objects.requireNonNull(durations, "durations");
    }

    @Override
    public BackoffSequence start() {
        Iterator<Duration> iterator = durations.iterator();
        return new BackoffSequence() {
            private Duration last = Duration.ZERO;

            @Override
            public Duration next() {
                if (iterator.hasNext()) {
                    Duration value = iterator.next();
                    if (value == null || value.isNegative()) {
                        throw new IllegalStateException("Backoff sequence produced an invalid duration: " + value);
                    }
                    last = value;
                }
                return last;
            }
        };
    }

    @Override
    public String getName() {
        return "IterableBackoff";
    }
}
