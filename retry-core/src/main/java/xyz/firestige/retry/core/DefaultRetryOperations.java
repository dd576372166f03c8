package xyz.firestige.retry.core;

import xyz.firestige.retry.api.AsyncRetryCallback;
import xyz.firestige.retry.api.RetryCallback;
import xyz.firestige.retry.api.RetryOperations;

import java.util.concurrent.CompletableFuture;

/**
 * 重试执行入口默认实现
 *
 * @author AI
 * @since 1.0
 */
public class DefaultRetryOperations implements RetryOperations {

    private final RetryPolicy policy;
    private final RetryExecutor executor;
    private final AsyncRetryExecutor asyncExecutor;

    public DefaultRetryOperations(RetryPolicy policy) {
        this.policy = policy;
        this.executor = new RetryExecutor(policy);
        this.asyncExecutor = new AsyncRetryExecutor(policy);
    }

    @Override
    public <T, E extends Exception> T execute(RetryCallback<T, E> callback) throws E {
        return executor.execute(callback);
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(AsyncRetryCallback<T> callback) {
        return asyncExecutor.execute(callback);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
