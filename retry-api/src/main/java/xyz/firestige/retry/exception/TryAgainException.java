package xyz.firestige.retry.exception;

/**
 * 目标操作主动请求重试
 * <p>
 * 不经过重试判定，直接进入停止策略与退避。
 *
 * @author AI
 * @since 1.0
 */
public class TryAgainException extends RuntimeException {

    public TryAgainException() {
        super("Try again requested");
    }

    public TryAgainException(String message) {
        super(message);
    }
}
