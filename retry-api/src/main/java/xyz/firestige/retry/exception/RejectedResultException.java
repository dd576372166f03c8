package xyz.firestige.retry.exception;

/**
 * 不可接受的返回值
 * <p>
 * 最后一次结果是被判定为需要重试的返回值时，用它来承载该返回值。
 *
 * @author AI
 * @since 1.0
 */
public class RejectedResultException extends RuntimeException {

    private final transient Object result;

    public RejectedResultException(Object result) {
        super("Rejected result: " + result);
        this.result = result;
    }

    public Object getResult() {
        return result;
    }
}
