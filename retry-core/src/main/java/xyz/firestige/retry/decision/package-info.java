/**
 * 重试判定实现
 * <p>
 * {@link xyz.firestige.retry.decision.PredicateRetryDecision} 将异常判定与返回值判定组合为一个
 * {@link xyz.firestige.retry.api.RetryDecision}。
 */
package xyz.firestige.retry.decision;
