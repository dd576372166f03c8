package xyz.firestige.retry.core;

import xyz.firestige.retry.api.RetryOperations;
import xyz.firestige.retry.api.RetryPolicyBuilder;
import xyz.firestige.retry.api.RetryService;

import java.util.Objects;

/**
 * 重试服务默认实现
 *
 * @author AI
 * @since 1.0
 */
public class DefaultRetryService implements RetryService {

    private final RetryPolicy defaultPolicy;
    private final RetryOperations defaultOperations;

    public DefaultRetryService() {
        this(RetryPolicy.defaults());
    }

    public DefaultRetryService(RetryPolicy defaultPolicy) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
        this.defaultOperations = new DefaultRetryOperations(defaultPolicy);
    }

    @Override
    public RetryPolicyBuilder policy() {
        return new RetryPolicyBuilderImpl(defaultPolicy);
    }

    @Override
    public RetryOperations defaults() {
        return defaultOperations;
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }
}
