package xyz.firestige.retry.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.StopReason;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * 监听器广播，单个监听器失败不中断流程，仅记录警告
 */
final class RetryListeners implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(RetryListeners.class);

    private final List<RetryListener> listeners;

    RetryListeners(List<RetryListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public void onAttemptFailed(RetryContext context) {
        fire(listener -> listener.onAttemptFailed(context));
    }

    @Override
    public void onRetry(RetryContext context, Duration wait) {
        fire(listener -> listener.onRetry(context, wait));
    }

    @Override
    public void onSuccess(RetryContext context, Object result) {
        fire(listener -> listener.onSuccess(context, result));
    }

    @Override
    public void onExhausted(RetryContext context, StopReason reason, Throwable error) {
        fire(listener -> listener.onExhausted(context, reason, error));
    }

    @Override
    public void onAborted(RetryContext context, Throwable error) {
        fire(listener -> listener.onAborted(context, error));
    }

    private void fire(Consumer<RetryListener> event) {
        for (RetryListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("[Retry] Listener failed (continuing): listener={}, error={}",
                    listener.getClass().getName(), e.getMessage());
            }
        }
    }
}
