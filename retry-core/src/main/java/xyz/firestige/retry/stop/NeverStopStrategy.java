package xyz.firestige.retry.stop;

import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.StopStrategy;

/**
 * 永不停止策略
 */
public class NeverStopStrategy implements StopStrategy {

    @Override
    public boolean shouldStop(RetryContext context) {
        return false;
    }

    @Override
    public String getName() {
        return "NeverStop";
    }
}
