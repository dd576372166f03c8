/**
 * 重试引擎核心 API
 * <p>
 * 只定义契约，不包含实现。
 * <p>
 * 核心接口：
 * <ul>
 *   <li>{@link xyz.firestige.retry.api.RetryService} - 服务入口</li>
 *   <li>{@link xyz.firestige.retry.api.RetryPolicyBuilder} - 策略构建器</li>
 *   <li>{@link xyz.firestige.retry.api.RetryOperations} - 执行入口（阻塞 / 异步）</li>
 *   <li>{@link xyz.firestige.retry.api.Backoff} - 退避策略</li>
 *   <li>{@link xyz.firestige.retry.api.StopStrategy} - 停止策略</li>
 *   <li>{@link xyz.firestige.retry.api.RetryDecision} - 重试判定</li>
 *   <li>{@link xyz.firestige.retry.api.RetryListener} - 生命周期监听器</li>
 * </ul>
 * <p>
 * 数据模型：
 * <ul>
 *   <li>{@link xyz.firestige.retry.api.RetryContext} - 重试上下文</li>
 *   <li>{@link xyz.firestige.retry.api.Attempt} - 单次尝试记录</li>
 *   <li>{@link xyz.firestige.retry.api.StopReason} - 停止原因</li>
 * </ul>
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.api;
