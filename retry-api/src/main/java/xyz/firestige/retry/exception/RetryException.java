package xyz.firestige.retry.exception;

import xyz.firestige.retry.api.RetryContext;

/**
 * 重试异常基类
 * <p>
 * 携带结束时的重试上下文，调用结束后上下文不再变化。
 *
 * @author AI
 * @since 1.0
 */
public class RetryException extends RuntimeException {

    private final transient RetryContext context;

    public RetryException(String message, RetryContext context) {
        super(message);
        this.context = context;
    }

    public RetryException(String message, RetryContext context, Throwable cause) {
        super(message, cause);
        this.context = context;
    }

    public RetryContext getContext() {
        return context;
    }

    /**
     * 结束时的尝试次数
     */
    public int getAttemptCount() {
        return context == null ? 0 : context.getAttemptCount();
    }
}
