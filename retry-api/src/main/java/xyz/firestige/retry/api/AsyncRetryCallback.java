package xyz.firestige.retry.api;

import java.util.concurrent.CompletionStage;

/**
 * 可挂起的目标操作
 * <p>
 * 每次调用返回一个新的 {@link CompletionStage}，代表一次尝试。
 *
 * @param <T> 返回值类型
 */
@FunctionalInterface
public interface AsyncRetryCallback<T> {

    CompletionStage<T> call();
}
