package xyz.firestige.retry.spring.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import xyz.firestige.retry.api.RetryListener;
import xyz.firestige.retry.api.RetryService;
import xyz.firestige.retry.core.DefaultRetryService;
import xyz.firestige.retry.core.RetryPolicy;
import xyz.firestige.retry.core.RetryPolicyBuilderImpl;
import xyz.firestige.retry.spring.config.RetrySchedulerConfig;
import xyz.firestige.retry.spring.metrics.MicrometerRetryListener;

/**
 * 重试服务自动配置
 *
 * @author AI
 * @since 1.0
 */
@AutoConfiguration
@ConditionalOnClass(RetryService.class)
@ConditionalOnProperty(prefix = "retry", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RetryProperties.class)
@Import(RetrySchedulerConfig.class)
public class RetryAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RetryAutoConfiguration.class);

    /**
     * 重试服务 Bean，默认策略来自 retry.* 配置
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryService retryService(
            RetryProperties properties,
            @Qualifier("retryScheduler") ThreadPoolTaskScheduler retryScheduler,
            ObjectProvider<RetryListener> listeners,
            ObjectProvider<MeterRegistry> meterRegistryProvider) {
        RetryPolicyBuilderImpl builder = new RetryPolicyBuilderImpl(RetryPolicy.defaults());
        if (properties.getMaxAttempts() != null) {
            builder.maxAttempts(properties.getMaxAttempts());
        }
        if (properties.getGiveUpAfter() != null) {
            builder.giveUpAfter(properties.getGiveUpAfter());
        }
        applyBackoff(builder, properties.getBackoff());
        builder.wrapException(properties.isWrapException());
        builder.reraise(properties.isReraise());
        builder.scheduler(retryScheduler.getScheduledExecutor());

        listeners.orderedStream().forEach(builder::listener);

        MeterRegistry registry = meterRegistryProvider.getIfAvailable();
        if (registry != null && properties.getMetrics().isEnabled()) {
            builder.listener(new MicrometerRetryListener(registry));
        }

        RetryPolicy policy = builder.buildPolicy();
        log.info("[Retry] 重试服务已装配: {}", policy);
        return new DefaultRetryService(policy);
    }

    static void applyBackoff(RetryPolicyBuilderImpl builder, RetryProperties.BackoffConfig backoff) {
        String type = backoff.getType() == null ? "none" : backoff.getType().trim().toLowerCase();
        switch (type) {
            case "none" -> builder.noBackoff();
            case "fixed" -> builder.fixedBackoff(backoff.getDelay());
            case "random" -> builder.randomBackoff(backoff.getMin(), backoff.getMax());
            case "exponential" -> builder.exponentialBackoff(
                backoff.getInitial(), backoff.getCap(), backoff.getMultiplier(), backoff.getRandomizationFactor());
            default -> throw new IllegalArgumentException("Unknown retry.backoff.type: " + backoff.getType());
        }
    }
}
