package xyz.firestige.retry.exception;

import xyz.firestige.retry.api.RetryContext;

/**
 * 重试判定函数自身抛出异常
 *
 * @author AI
 * @since 1.0
 */
public class RetryDecisionException extends RetryException {

    public RetryDecisionException(String message, RetryContext context, Throwable cause) {
        super(message, context, cause);
    }
}
