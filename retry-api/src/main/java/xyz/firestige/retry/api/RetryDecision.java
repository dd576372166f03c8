package xyz.firestige.retry.api;

/**
 * 重试判定接口
 * <p>
 * 对一次尝试的结果做一次判定：返回值与异常只有一个有意义（{@code exception} 不为 null 即为异常结果）。
 * <ul>
 *   <li>异常结果 + true：进入停止策略与退避</li>
 *   <li>异常结果 + false：立即向调用方传播</li>
 *   <li>返回值 + true：视为失败，进入停止策略与退避</li>
 *   <li>返回值 + false：成功返回</li>
 * </ul>
 * 判定函数自身抛出异常时，调用立即以 {@code RetryDecisionException} 结束。
 *
 * @author AI
 * @since 1.0
 */
@FunctionalInterface
public interface RetryDecision {

    /**
     * @param result    返回值（异常结果时为 null）
     * @param exception 异常（返回值结果时为 null）
     * @param context   重试上下文
     * @return 是否重试
     */
    boolean shouldRetry(Object result, Exception exception, RetryContext context);
}
