package xyz.firestige.retry.backoff;

import java.time.Duration;

/**
 * 退避时长换算
 */
final class BackoffDurations {

    private BackoffDurations() {
    }

    /**
     * 换算为纳秒，超出 long 范围的配置直接拒绝
     */
    static long toNanos(Duration duration, String name) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(name + " is too large: " + duration, e);
        }
    }

    /**
     * 饱和加法，溢出时取 Long.MAX_VALUE
     */
    static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return ((a ^ sum) & (b ^ sum)) < 0 ? Long.MAX_VALUE : sum;
    }
}
