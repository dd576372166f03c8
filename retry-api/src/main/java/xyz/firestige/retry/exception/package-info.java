/**
 * 重试异常类型
 * <p>
 * 定义跨层语义异常，供 API 使用者和实现者共同使用。
 * <ul>
 *   <li>{@link xyz.firestige.retry.exception.RetryException} - 基础异常</li>
 *   <li>{@link xyz.firestige.retry.exception.RetryExhaustedException} - 耗尽异常</li>
 *   <li>{@link xyz.firestige.retry.exception.AttemptsExhaustedException} - 次数耗尽</li>
 *   <li>{@link xyz.firestige.retry.exception.TimeExhaustedException} - 时间耗尽</li>
 *   <li>{@link xyz.firestige.retry.exception.WrappedFailureException} - 包装的原始失败</li>
 *   <li>{@link xyz.firestige.retry.exception.RetryDecisionException} - 判定函数失败</li>
 *   <li>{@link xyz.firestige.retry.exception.RejectedResultException} - 承载被拒绝的返回值</li>
 *   <li>{@link xyz.firestige.retry.exception.TryAgainException} - 操作主动请求重试</li>
 * </ul>
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.exception;
