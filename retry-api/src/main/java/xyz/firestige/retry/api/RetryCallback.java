package xyz.firestige.retry.api;

/**
 * 阻塞式目标操作
 *
 * @param <T> 返回值类型
 * @param <E> 操作可能抛出的受检异常类型
 */
@FunctionalInterface
public interface RetryCallback<T, E extends Exception> {

    T call() throws E;
}
