/**
 * Spring Boot 自动配置
 * <p>
 * 核心组件：
 * <ul>
 *   <li>{@link xyz.firestige.retry.spring.autoconfigure.RetryAutoConfiguration} - 自动配置类</li>
 *   <li>{@link xyz.firestige.retry.spring.autoconfigure.RetryProperties} - 配置属性</li>
 * </ul>
 * <p>
 * 使用方式：
 * <pre>
 * # application.yml
 * retry:
 *   enabled: true
 *   max-attempts: 5
 *   give-up-after: 30s
 *   backoff:
 *     type: exponential
 *     initial: 100ms
 *     cap: 5s
 * </pre>
 *
 * @author AI
 * @since 1.0
 */
package xyz.firestige.retry.spring.autoconfigure;
