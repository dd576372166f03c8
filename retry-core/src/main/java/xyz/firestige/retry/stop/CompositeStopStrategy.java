package xyz.firestige.retry.stop;

import xyz.firestige.retry.api.RetryContext;
import xyz.firestige.retry.api.StopReason;
import xyz.firestige.retry.api.StopStrategy;

import java.util.Arrays;
import java.util.List;

/**
 * 组合停止策略，实现可以将多个停止条件组合在一起
 * <p>
 * 停止原因取第一个满足条件的子策略（按组合顺序），因此顺序决定了同时满足时上报哪个原因。
 */
public class CompositeStopStrategy implements StopStrategy {
    public enum Mode { ALL, ANY }
    private final List<StopStrategy> conditions;
    private final Mode mode;
    private CompositeStopStrategy(Mode mode, List<StopStrategy> conditions) {
        this.mode = mode;
        this.conditions = conditions;
    }

    public static CompositeStopStrategy allOf(StopStrategy... c) {
        return new CompositeStopStrategy(Mode.ALL, List.copyOf(Arrays.asList(c)));
    }

    public static CompositeStopStrategy anyOf(StopStrategy... c) {
        return new CompositeStopStrategy(Mode.ANY, List.copyOf(Arrays.asList(c)));
    }

    public static CompositeStopStrategy anyOf(List<StopStrategy> c) {
        return new CompositeStopStrategy(Mode.ANY, List.copyOf(c));
    }

    @Override
    public boolean shouldStop(RetryContext context) {
        return evaluate(context) != null;
    }

    @Override
    public StopReason evaluate(RetryContext context) {
        StopReason first = null;
        for (StopStrategy condition : conditions) {
            StopReason reason = condition.evaluate(context);
            if (reason == null && mode == Mode.ALL) {
                return null;
            }
            if (reason != null && first == null) {
                first = reason;
                if (mode == Mode.ANY) {
                    return first;
                }
            }
        }
        return first;
    }

    public Mode getMode() {
        return mode;
    }

    public List<StopStrategy> getConditions() {
        return conditions;
    }

    @Override
    public String getName() {
        return "CompositeStop";
    }
}
