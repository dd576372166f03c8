package xyz.firestige.retry.api;

import java.util.Objects;

/**
 * 基于返回值的重试判定
 */
@FunctionalInterface
public interface ResultPredicate {

    /**
     * @param result  本次尝试的返回值（可能为 null）
     * @param context 重试上下文
     * @return true 表示返回值不可接受，需要重试
     */
    boolean shouldRetry(Object result, RetryContext context);

    /**
     * 从不因返回值重试（默认）
     */
    static ResultPredicate never() {
        return (result, context) -> false;
    }

    /**
     * 返回 null 时重试
     */
    static ResultPredicate isNull() {
        return (result, context) -> Objects.isNull(result);
    }
}
