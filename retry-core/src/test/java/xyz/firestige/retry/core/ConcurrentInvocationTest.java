package xyz.firestige.retry.core;

import org.junit.jupiter.api.Test;
import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.RetryOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 同一个重试实例被多个线程同时使用时，各次调用的尝试计数与退避位置互不影响
 */
class ConcurrentInvocationTest {

    @Test
    void concurrentInvocationsAreIndependent() throws Exception {
        Map<RetryContext, List<Duration>> waitsByContext = Collections.synchronizedMap(new IdentityHashMap<>());
        Map<Object, Integer> attemptsByResult = new ConcurrentHashMap<>();
        Map<Object, List<Duration>> waitsByResult = new ConcurrentHashMap<>();

        RetryListener recorder = new RetryListener() {
            @Override
            public void onRetry(RetryContext context, Duration wait) {
                waitsByContext.computeIfAbsent(context, c -> new ArrayList<>()).add(wait);
            }

            @Override
            public void onSuccess(RetryContext context, Object result) {
                attemptsByResult.put(result, context.getAttemptCount());
                List<Duration> waits = waitsByContext.remove(context);
                waitsByResult.put(result, waits == null ? List.of() : waits);
            }
        };

        RetryOperations ops = new RetryPolicyBuilderImpl(RetryPolicy.defaults())
            .sleeper(d -> Thread.sleep(0))
            .exponentialBackoff(Duration.ofMillis(1), Duration.ofSeconds(10))
            .listener(recorder)
            .build();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int failures = i % 6;
                String name = "task-" + i;
                AtomicInteger calls = new AtomicInteger();
                futures.add(pool.submit(() -> ops.execute(() -> {
                    if (calls.incrementAndGet() <= failures) {
                        throw new IllegalStateException(name);
                    }
                    return name;
                })));
            }
            for (Future<String> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < 200; i++) {
            String name = "task-" + i;
            int failures = i % 6;
            assertThat(attemptsByResult.get(name)).isEqualTo(failures + 1);
            List<Duration> expected = new ArrayList<>();
            for (int n = 0; n < failures; n++) {
                expected.add(Duration.ofMillis(1L << n));
            }
            assertThat(waitsByResult.get(name)).containsExactlyElementsOf(expected);
        }
    }
}
