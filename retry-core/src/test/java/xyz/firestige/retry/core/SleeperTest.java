package xyz.firestige.retry.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SleeperTest {

    @Test
    void threadSleepHonoursSubMillisecondWaits() throws InterruptedException {
        Sleeper sleeper = Sleeper.threadSleep();
        long started = System.nanoTime();
        sleeper.sleep(Duration.ofNanos(800_000));
        assertTrue(System.nanoTime() - started >= 800_000, "sub-millisecond wait was skipped");
    }

    @Test
    void threadSleepIsInterruptible() {
        Sleeper sleeper = Sleeper.threadSleep();
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () -> sleeper.sleep(Duration.ofSeconds(5)));
        } finally {
            Thread.interrupted();
        }
    }
}
