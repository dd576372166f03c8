package xyz.firestige.retry.api;

/**
 * 基于异常的重试判定
 */
@FunctionalInterface
public interface ExceptionPredicate {

    /**
     * @param exception 本次尝试抛出的异常
     * @param context   重试上下文
     * @return true 表示可以重试
     */
    boolean shouldRetry(Exception exception, RetryContext context);

    /**
     * 任何异常都重试（默认）
     */
    static ExceptionPredicate any() {
        return (exception, context) -> true;
    }
}
