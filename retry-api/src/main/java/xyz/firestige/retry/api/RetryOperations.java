package xyz.firestige.retry.api;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 重试执行入口
 * <p>
 * 按构建时的策略执行目标操作，返回成功结果或按失败策略抛出唯一一个异常。
 * 每次调用都是独立的：拥有自己的上下文与退避序列。
 *
 * @author AI
 * @since 1.0
 */
public interface RetryOperations {

    /**
     * 阻塞执行：等待期间占用调用线程
     *
     * @param callback 目标操作
     * @return 操作的成功结果
     * @throws E 重新抛出的原始异常
     */
    <T, E extends Exception> T execute(RetryCallback<T, E> callback) throws E;

    /**
     * 异步执行：等待期间不占用线程，取消返回的 future 会终止后续尝试
     *
     * @param callback 目标操作
     * @return 成功结果或失败异常
     */
    <T> CompletableFuture<T> executeAsync(AsyncRetryCallback<T> callback);

    /**
     * 包装阻塞操作，返回的 {@link Callable} 每次调用都是一次独立的重试执行
     */
    default <T> Callable<T> decorate(Callable<T> callable) {
        return () -> execute(callable::call);
    }

    /**
     * 包装异步操作，返回的 {@link Supplier} 每次调用都是一次独立的重试执行
     */
    default <T> Supplier<CompletableFuture<T>> decorateAsync(AsyncRetryCallback<T> callback) {
        return () -> executeAsync(callback);
    }
}
