package xyz.firestige.retry.api;

import java.time.Duration;
import java.time.Instant;

/**
 * 一次已完成的尝试
 * <p>
 * 结果与异常二者只有一个有意义：{@code exception} 不为 null 时表示本次尝试抛出了异常。
 *
 * @param number     尝试序号（从 1 开始）
 * @param result     返回值（可能为 null）
 * @param exception  抛出的异常（可能为 null）
 * @param startedAt  开始时间
 * @param finishedAt 结束时间
 */
public record Attempt(int number, Object result, Exception exception, Instant startedAt, Instant finishedAt) {

    public boolean isFailure() {
        return exception != null;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }
}
