package xyz.firestige.retry.decision;

import xyz.firestige.retry.api.ExceptionPredicate;
import xyz.firestige.retry.api.RetryContext;

import java.util.List;

/**
 * 只在指定类型（含子类）的异常上重试
 */
public class ExceptionTypePredicate implements ExceptionPredicate {

    private final List<Class<? extends Exception>> types;

    public ExceptionTypePredicate(List<Class<? extends Exception>> types) {
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("at least one exception type is required");
        }
        this.types = List.copyOf(types);
    }

    @Override
    public boolean shouldRetry(Exception exception, RetryContext context) {
        for (Class<? extends Exception> type : types) {
            if (type.isInstance(exception)) {
                return true;
            }
        }
        return false;
    }

    public List<Class<? extends Exception>> getTypes() {
        return types;
    }
}
