package xyz.firestige.retry.api;

/**
 * 退避策略接口
 *
 * <p>决定两次尝试之间的等待时间。退避策略本身是无状态的配置，
 * 每次调用通过 {@link #start()} 取得一个全新的 {@link BackoffSequence}，
 * 序列位置不会在不同调用之间共享。
 *
 * <h3>预置实现</h3>
 * <ul>
 *   <li>{@code FixedBackoff} - 固定间隔</li>
 *   <li>{@code RandomBackoff} - 区间 [min, max) 内均匀随机</li>
 *   <li>{@code ExponentialBackoff} - 指数退避，封顶后保持不变</li>
 *   <li>{@code IterableBackoff} - 任意 {@code Iterable<Duration>}</li>
 * </ul>
 *
 * <h3>使用示例</h3>
 * <pre>{@code
 * Backoff backoff = new ExponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(5));
 * BackoffSequence sequence = backoff.start();
 * sequence.next(); // 100ms
 * sequence.next(); // 200ms
 * }</pre>
 *
 * @author AI
 * @since 1.0
 * @see BackoffSequence
 */
@FunctionalInterface
public interface Backoff extends Named {

    /**
     * 开始一个新的退避序列
     *
     * @return 从头开始的序列
     */
    BackoffSequence start();
}
