package xyz.firestige.retry.exception;

import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.StopReason;

/**
 * 达到最长重试时间
 *
 * @author AI
 * @since 1.0
 */
public class TimeExhaustedException extends RetryExhaustedException {

    public TimeExhaustedException(String message, RetryContext context, Throwable cause) {
        super(message, context, StopReason.TIMEOUT, cause);
    }
}
