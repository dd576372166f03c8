package xyz.firestige.retry.backoff;

import org.junit.jupiter.api.Test;
import xyz.firestige.retry.api.BackoffSequence;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IterableBackoffTest {

    @Test
    void repeatsLastValueWhenExhausted() {
        BackoffSequence seq = new IterableBackoff(millis(1, 2, 3)).start();
        assertEquals(Duration.ofMillis(1), seq.next());
        assertEquals(Duration.ofMillis(2), seq.next());
        assertEquals(Duration.ofMillis(3), seq.next());
        assertEquals(Duration.ofMillis(3), seq.next());
    }

    @Test
    void emptySequenceIsZero() {
        BackoffSequence seq = new IterableBackoff(Collections.emptyList()).start();
        assertEquals(Duration.ZERO, seq.next());
    }

    @Test
    void restartsOnEachStart() {
        IterableBackoff backoff = new IterableBackoff(millis(5, 10));
        BackoffSequence first = backoff.start();
        first.next();
        assertEquals(Duration.ofMillis(5), backoff.start().next());
        assertEquals(Duration.ofMillis(10), first.next());
    }

    @Test
    void negativeDurationFails() {
        BackoffSequence seq = new IterableBackoff(Arrays.asList(Duration.ofMillis(-5))).start();
        assertThrows(IllegalStateException.class, seq::next);
    }

    private static List<Duration> millis(long... values) {
        return Arrays.stream(values).mapToObj(Duration::ofMillis).toList();
    }
}
