/**
 * 重试指标
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.spring.metrics;
