package xyz.firestige.retry.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.retry.api.RetryOperations;
import xyz.firestige.retry.exception.AttemptsExhaustedException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class AsyncRetryExecutorTest {

    private ScheduledThreadPoolExecutor scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledThreadPoolExecutor(1);
        scheduler.setRemoveOnCancelPolicy(true);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private RetryPolicyBuilderImpl builder() {
        RetryPolicyBuilderImpl builder = new RetryPolicyBuilderImpl(RetryPolicy.defaults());
        builder.scheduler(scheduler);
        return builder;
    }

    @Test
    void succeedsAfterFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RetryOperations ops = builder()
            .fixedBackoff(Duration.ofMillis(5))
            .build();

        CompletableFuture<String> future = ops.executeAsync(() -> {
            if (calls.incrementAndGet() < 3) {
                return CompletableFuture.<String>failedFuture(new IOException("flaky"));
            }
            return CompletableFuture.completedFuture("ok");
        });

        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void exhaustionCompletesExceptionally() {
        AtomicInteger calls = new AtomicInteger();
        RetryOperations ops = builder().maxAttempts(3).build();

        CompletableFuture<String> future = ops.executeAsync(() -> {
            calls.incrementAndGet();
            return CompletableFuture.<String>supplyAsync(() -> {
                throw new IllegalStateException("remote failure");
            });
        });

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .cause()
            .isInstanceOf(AttemptsExhaustedException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void synchronousThrowCountsAsFailedAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RetryOperations ops = builder().maxAttempts(5).build();

        CompletableFuture<Integer> future = ops.executeAsync(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("not ready");
            }
            return CompletableFuture.completedFuture(7);
        });

        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(7);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void nonRetryableFailurePropagatesImmediately() {
        AtomicInteger calls = new AtomicInteger();
        RetryOperations ops = builder().retryOn(IOException.class).build();

        CompletableFuture<String> future = ops.executeAsync(() -> {
            calls.incrementAndGet();
            return CompletableFuture.<String>failedFuture(new IllegalArgumentException("bad"));
        });

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void cancellationStopsPendingRetry() {
        AtomicInteger calls = new AtomicInteger();
        RetryOperations ops = builder().fixedBackoff(Duration.ofSeconds(30)).build();

        CompletableFuture<String> future = ops.executeAsync(() -> {
            calls.incrementAndGet();
            return CompletableFuture.<String>failedFuture(new IOException());
        });

        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.getQueue().size() == 1);
        future.cancel(false);

        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.getQueue().isEmpty());
        assertThat(future).isCancelled();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void cancellationPropagatesToInFlightAttempt() {
        AtomicReference<CompletableFuture<String>> inFlight = new AtomicReference<>();
        RetryOperations ops = builder().build();

        CompletableFuture<String> future = ops.executeAsync(() -> {
            CompletableFuture<String> attempt = new CompletableFuture<>();
            inFlight.set(attempt);
            return attempt;
        });

        await().atMost(Duration.ofSeconds(5)).until(() -> inFlight.get() != null);
        future.cancel(true);

        assertThat(inFlight.get()).isCancelled();
        assertThatThrownBy(future::join).isInstanceOf(CancellationException.class);
    }

    @Test
    void cancellationDuringAttemptCancelsItsStage() throws Exception {
        AtomicReference<CompletableFuture<String>> promise = new AtomicReference<>();
        AtomicReference<CompletableFuture<String>> secondAttempt = new AtomicReference<>();
        AtomicInteger calls = new AtomicInteger();
        RetryOperations ops = builder().fixedBackoff(Duration.ofMillis(200)).build();

        CompletableFuture<String> future = ops.executeAsync(() -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.<String>failedFuture(new IOException());
            }
            // 在目标操作执行期间取消整个调用
            promise.get().cancel(false);
            CompletableFuture<String> attempt = new CompletableFuture<>();
            secondAttempt.set(attempt);
            return attempt;
        });
        promise.set(future);

        await().atMost(Duration.ofSeconds(5)).until(() -> secondAttempt.get() != null);
        await().atMost(Duration.ofSeconds(5)).until(() -> secondAttempt.get().isCancelled());
        Thread.sleep(100);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(future).isCancelled();
    }

    @Test
    void attemptsNeverOverlap() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        RetryOperations ops = builder().maxAttempts(6).fixedBackoff(Duration.ofMillis(1)).build();

        CompletableFuture<Integer> future = ops.executeAsync(() -> CompletableFuture.<Integer>supplyAsync(() -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                if (calls.incrementAndGet() < 5) {
                    throw new IllegalStateException("again");
                }
                return calls.get();
            } finally {
                running.decrementAndGet();
            }
        }));

        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(5);
        assertThat(maxRunning.get()).isEqualTo(1);
    }

    @Test
    void worksWithoutConfiguredScheduler() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RetryOperations ops = new RetryPolicyBuilderImpl(RetryPolicy.defaults())
            .fixedBackoff(Duration.ofMillis(10))
            .build();

        Supplier<CompletableFuture<String>> decorated = ops.decorateAsync(() ->
            calls.incrementAndGet() < 2
                ? CompletableFuture.<String>failedFuture(new IOException())
                : CompletableFuture.<String>completedFuture("late"));

        assertThat(decorated.get().get(5, TimeUnit.SECONDS)).isEqualTo("late");
    }
}
