package xyz.firestige.retry.decision;

import xyz.firestige.retry.api.ExceptionPredicate;
import xyz.firestige.retry.api.ResultPredicate;
import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.RetryDecision;

import java.util.Objects;

/**
 * 由异常判定和返回值判定组合而成的重试判定
 * <p>
 * 每个结果只会交给与其类型对应的那一个判定。
 *
 * @author AI
 * @since 1.0
 */
public class PredicateRetryDecision implements RetryDecision {

    private static final PredicateRetryDecision DEFAULT =
        new PredicateRetryDecision(ExceptionPredicate.any(), ResultPredicate.never());

    private final ExceptionPredicate onException;
    private final ResultPredicate onResult;

    public PredicateRetryDecision(ExceptionPredicate onException, ResultPredicate onResult) {
        this.onException = Objects.requireNonNull(onException, "onException");
        this.onResult = Objects.requireNonNull(onResult, "onResult");
    }

    /**
     * 任何异常都重试，从不因返回值重试
     */
    public static PredicateRetryDecision defaults() {
        return DEFAULT;
    }

    @Override
    public boolean shouldRetry(Object result, Exception exception, RetryContext context) {
        if (exception != null) {
            return onException.shouldRetry(exception, context);
        }
        return onResult.shouldRetry(result, context);
    }

    public ExceptionPredicate getOnException() {
        return onException;
    }

    public ResultPredicate getOnResult() {
        return onResult;
    }
}
