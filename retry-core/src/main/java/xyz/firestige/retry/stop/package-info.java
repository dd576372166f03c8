/**
 * 停止策略实现
 * <ul>
 *   <li>{@link xyz.firestige.retry.stop.MaxAttemptsStopStrategy} - 尝试次数上限</li>
 *   <li>{@link xyz.firestige.retry.stop.ElapsedTimeStopStrategy} - 时间上限</li>
 *   <li>{@link xyz.firestige.retry.stop.NeverStopStrategy} - 永不停止</li>
 *   <li>{@link xyz.firestige.retry.stop.CompositeStopStrategy} - 组合</li>
 * </ul>
 */
package xyz.firestige.retry.stop;
