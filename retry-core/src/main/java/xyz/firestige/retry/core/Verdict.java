package xyz.firestige.retry.core;

import xyz.firestige.retry.api.StopReason;

import java.time.Duration;

/**
 * EVALUATE 状态的结论
 *
 * @param next       下一个状态：WAIT、SUCCEED 或 FAIL
 * @param delay      WAIT 时的等待时长
 * @param failReason FAIL 时的原因
 * @param stopReason EXHAUSTED 时的停止原因
 * @param error      FAIL 时要抛给调用方的异常
 */
record Verdict(RetryState next, Duration delay, FailReason failReason, StopReason stopReason, Exception error) {

    static Verdict succeed() {
        return new Verdict(RetryState.SUCCEED, null, null, null, null);
    }

    static Verdict retryAfter(Duration delay) {
        return new Verdict(RetryState.WAIT, delay, null, null, null);
    }

    static Verdict failImmediately(Exception error) {
        return new Verdict(RetryState.FAIL, null, FailReason.IMMEDIATE, null, error);
    }

    static Verdict exhausted(StopReason stopReason, Exception error) {
        return new Verdict(RetryState.FAIL, null, FailReason.EXHAUSTED, stopReason, error);
    }
}
