package xyz.firestige.retry.backoff;

import org.junit.jupiter.api.Test;
import xyz.firestige.retry.api.BackoffSequence;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FixedBackoffTest {

    @Test
    void alwaysReturnsSameDelay() {
        BackoffSequence seq = new FixedBackoff(Duration.ofMillis(250)).start();
        for (int i = 0; i < 5; i++) {
            assertEquals(Duration.ofMillis(250), seq.next());
        }
    }

    @Test
    void noneIsZero() {
        assertEquals(Duration.ZERO, FixedBackoff.none().start().next());
    }

    @Test
    void negativeDelayRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FixedBackoff(Duration.ofMillis(-1)));
    }
}
