package xyz.firestige.retry.exception;

import xyz.firestige.retry.api.RetryContext;

/**
 * 包装后的原始失败
 * <p>
 * 开启 wrapException 时，任何原始异常（立即传播或 reraise）都以此类型跨出边界。
 *
 * @author AI
 * @since 1.0
 */
public class WrappedFailureException extends RetryException {

    public WrappedFailureException(String message, RetryContext context, Throwable cause) {
        super(message, context, cause);
    }
}
