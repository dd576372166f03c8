package xyz.firestige.retry.spring.autoconfigure;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import xyz.firestige.retry.api.RetryService;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 验证 retry.enabled=false 时不装配 RetryService
 */
class RetryAutoConfigurationDisabledTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RetryAutoConfiguration.class))
        .withPropertyValues(
            "retry.enabled=false"
        );

    @Test
    void shouldNotCreateRetryServiceWhenDisabled() {
        contextRunner.run(ctx -> {
            assertThat(ctx).doesNotHaveBean(RetryService.class);
            assertThat(ctx).doesNotHaveBean("retryScheduler");
        });
    }
}
