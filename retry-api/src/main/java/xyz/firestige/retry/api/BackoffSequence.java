package xyz.firestige.retry.api;

import java.time.Duration;

/**
 * 退避序列
 * <p>
 * 单次调用独占的等待时长序列，按需拉取。
 *
 * @author AI
 * @since 1.0
 */
@FunctionalInterface
public interface BackoffSequence {

    /**
     * 取出下一次重试前的等待时长
     *
     * @return 等待时长，不为 null 且不为负
     */
    Duration next();
}
