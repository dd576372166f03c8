/**
 * 重试引擎核心实现
 * <p>
 * {@link xyz.firestige.retry.core.RetryExecutor} 与 {@link xyz.firestige.retry.core.AsyncRetryExecutor}
 * 共用同一套判定逻辑，区别只在 WAIT 状态是阻塞线程还是交给调度器。
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.core;
