package xyz.firestige.retry.exception;

import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.StopReason;

/**
 * 达到最大尝试次数
 *
 * @author AI
 * @since 1.0
 */
public class AttemptsExhaustedException extends RetryExhaustedException {

    public AttemptsExhaustedException(String message, RetryContext context, Throwable cause) {
        super(message, context, StopReason.MAX_ATTEMPTS, cause);
    }
}
