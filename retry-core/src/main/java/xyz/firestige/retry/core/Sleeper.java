package xyz.firestige.retry.core;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 阻塞等待
 * <p>
 * 阻塞执行器通过它休眠，测试中可替换为不真正休眠的实现。
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}
