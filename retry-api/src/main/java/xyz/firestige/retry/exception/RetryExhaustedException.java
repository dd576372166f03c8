package xyz.firestige.retry.exception;

import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.StopReason;

/**
 * 重试耗尽异常
 * <p>
 * 停止策略终止了循环且未开启 reraise 时抛出，cause 为最后一次失败的原因。
 *
 * @author AI
 * @since 1.0
 */
public class RetryExhaustedException extends RetryException {

    private final StopReason reason;

    public RetryExhaustedException(String message, RetryContext context, StopReason reason, Throwable cause) {
        super(message, context, cause);
        this.reason = reason;
    }

    public StopReason getReason() {
        return reason;
    }
}
