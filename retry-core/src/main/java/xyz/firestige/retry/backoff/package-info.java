/**
 * 退避策略实现
 * <p>
 * 提供多种预置的退避策略：
 * <ul>
 *   <li>{@link xyz.firestige.retry.backoff.FixedBackoff} - 固定间隔</li>
 *   <li>{@link xyz.firestige.retry.backoff.RandomBackoff} - 随机间隔</li>
 *   <li>{@link xyz.firestige.retry.backoff.ExponentialBackoff} - 指数退避</li>
 *   <li>{@link xyz.firestige.retry.backoff.IterableBackoff} - 自定义序列</li>
 * </ul>
 * <p>
 * 使用者可实现 {@link xyz.firestige.retry.api.Backoff} 接口以定义自定义退避逻辑。
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.backoff;
