package xyz.firestige.retry.spring.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 异步重试调度线程池配置
 *
 * <p>支持通过 application.yml 配置：
 * <pre>
 * retry:
 *   scheduler:
 *     pool-size: 2
 *     thread-name-prefix: "retry-scheduler-"
 * </pre>
 *
 * @author AI
 * @since 1.0
 */
@Configuration
@ConfigurationProperties(prefix = "retry.scheduler")
public class RetrySchedulerConfig {

    private int poolSize = 2;
    private String threadNamePrefix = "retry-scheduler-";
    private int awaitTerminationSeconds = 30;

    @Bean("retryScheduler")
    public ThreadPoolTaskScheduler retryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);
        return scheduler;
    }

    // Getters and Setters

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public int getAwaitTerminationSeconds() {
        return awaitTerminationSeconds;
    }

    public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
        this.awaitTerminationSeconds = awaitTerminationSeconds;
    }
}
