package xyz.firestige.retry.api;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 重试上下文（只读视图）
 * <p>
 * 每次调用独占一个上下文，只有执行器会修改它；判定函数、停止策略和监听器看到的都是只读视图。
 *
 * @author AI
 * @since 1.0
 */
public interface RetryContext {

    /**
     * 已开始的尝试次数（第一次尝试为 1）
     */
    int getAttemptCount();

    /**
     * 调用开始时间，调用期间不变
     */
    Instant getStartTime();

    /**
     * 从调用开始到现在经过的时间
     */
    Duration getElapsed();

    /**
     * 最近一次观察到的异常，可能为 null
     */
    Exception getLastException();

    /**
     * 最近一次观察到的返回值，可能为 null
     */
    Object getLastResult();

    /**
     * 最近一次完成的尝试，尚无完成的尝试时为 null
     */
    Attempt getLastAttempt();

    /**
     * 已完成的尝试历史（按顺序）
     */
    List<Attempt> getAttempts();
}
