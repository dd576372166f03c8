package xyz.firestige.retry.api;

/**
 * 停止策略接口
 * <p>
 * 每次可重试的结果出现后调用，决定是否终止重试循环。
 * 停止策略优先于重试判定：一旦停止，不再进行下一次尝试。
 */
@FunctionalInterface
public interface StopStrategy extends Named {

    /**
     * 决定是否停止重试
     *
     * @param context 重试上下文
     * @return 是否要停止
     */
    boolean shouldStop(RetryContext context);

    /**
     * 本策略触发停止时上报的原因
     */
    default StopReason getReason() {
        return StopReason.CUSTOM;
    }

    /**
     * 评估停止条件
     *
     * @param context 重试上下文
     * @return 停止原因，null 表示继续
     */
    default StopReason evaluate(RetryContext context) {
        return shouldStop(context) ? getReason() : null;
    }
}
