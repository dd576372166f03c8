package xyz.firestige.retry.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 重试服务默认策略配置属性
 *
 * @author AI
 * @since 1.0
 */
@ConfigurationProperties(prefix = "retry")
public class RetryProperties {

    /**
     * 是否启用重试服务
     */
    private boolean enabled = true;

    /**
     * 最大尝试次数（含第一次），为空表示不限制
     */
    private Integer maxAttempts;

    /**
     * 最长重试时间，为空表示不限制
     */
    private Duration giveUpAfter;

    /**
     * 失败时是否包装为 WrappedFailureException
     */
    private boolean wrapException = false;

    /**
     * 耗尽时是否抛出最后一次的原始异常
     */
    private boolean reraise = false;

    /**
     * 退避配置
     */
    private BackoffConfig backoff = new BackoffConfig();

    /**
     * 监控配置
     */
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Integer getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(Integer maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getGiveUpAfter() {
        return giveUpAfter;
    }

    public void setGiveUpAfter(Duration giveUpAfter) {
        this.giveUpAfter = giveUpAfter;
    }

    public boolean isWrapException() {
        return wrapException;
    }

    public void setWrapException(boolean wrapException) {
        this.wrapException = wrapException;
    }

    public boolean isReraise() {
        return reraise;
    }

    public void setReraise(boolean reraise) {
        this.reraise = reraise;
    }

    public BackoffConfig getBackoff() {
        return backoff;
    }

    public void setBackoff(BackoffConfig backoff) {
        this.backoff = backoff;
    }

    public MetricsConfig getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsConfig metrics) {
        this.metrics = metrics;
    }

    /**
     * 退避配置
     */
    public static class BackoffConfig {
        /**
         * 退避类型：none, fixed, random, exponential
         */
        private String type = "none";

        /**
         * 固定等待（fixed）
         */
        private Duration delay = Duration.ofSeconds(1);

        /**
         * 等待下限（random）
         */
        private Duration min = Duration.ZERO;

        /**
         * 等待上限（random）
         */
        private Duration max = Duration.ofSeconds(1);

        /**
         * 初始等待（exponential）
         */
        private Duration initial = Duration.ofMillis(100);

        /**
         * 等待上限（exponential）
         */
        private Duration cap = Duration.ofSeconds(30);

        /**
         * 倍增因子（exponential）
         */
        private double multiplier = 2.0;

        /**
         * 随机扰动比例，取值 [0, 1)（exponential）
         */
        private double randomizationFactor = 0.0;

        // Getters and Setters

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }

        public Duration getMin() {
            return min;
        }

        public void setMin(Duration min) {
            this.min = min;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }

        public Duration getInitial() {
            return initial;
        }

        public void setInitial(Duration initial) {
            this.initial = initial;
        }

        public Duration getCap() {
            return cap;
        }

        public void setCap(Duration cap) {
            this.cap = cap;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getRandomizationFactor() {
            return randomizationFactor;
        }

        public void setRandomizationFactor(double randomizationFactor) {
            this.randomizationFactor = randomizationFactor;
        }
    }

    /**
     * 监控配置
     */
    public static class MetricsConfig {
        /**
         * 是否启用指标收集（需要 MeterRegistry）
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
