package xyz.firestige.retry.spring.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import xyz.firestige.retry.api.RetryOperations;
import xyz.firestige.retry.api.StopReason;
import xyz.firestige.retry.core.DefaultRetryService;
import xyz.firestige.retry.exception.AttemptsExhaustedException;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MicrometerRetryListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void recordsRetriesAndSuccess() throws IOException {
        RetryOperations ops = new DefaultRetryService().policy()
            .listener(new MicrometerRetryListener(registry))
            .build();
        AtomicInteger calls = new AtomicInteger();

        ops.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException();
            }
            return "ok";
        });

        assertThat(registry.get("retry_attempts").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("retry_success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("retry_duration").timer().count()).isEqualTo(1L);
    }

    @Test
    void recordsExhaustionByReason() {
        RetryOperations ops = new DefaultRetryService().policy()
            .maxAttempts(2)
            .listener(new MicrometerRetryListener(registry))
            .build();

        assertThatThrownBy(() -> ops.execute(() -> {
            throw new IOException();
        })).isInstanceOf(AttemptsExhaustedException.class);

        assertThat(registry.get("retry_exhausted").tag("reason", StopReason.MAX_ATTEMPTS.name()).counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void recordsAbortedOnNonRetryableFailure() {
        RetryOperations ops = new DefaultRetryService().policy()
            .retryOn(IOException.class)
            .listener(new MicrometerRetryListener(registry))
            .build();

        assertThatThrownBy(() -> ops.execute(() -> {
            throw new IllegalArgumentException();
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(registry.get("retry_aborted").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("retry_attempts").counter().count()).isZero();
    }
}
