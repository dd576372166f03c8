package xyz.firestige.retry.api;

/**
 * 重试服务主入口
 *
 * @author AI
 * @since 1.0
 */
public interface RetryService {

    /**
     * 开始构建一个重试策略，初始值为服务的默认配置
     *
     * @return 策略构建器
     */
    RetryPolicyBuilder policy();

    /**
     * 直接使用默认配置的执行入口
     */
    RetryOperations defaults();
}
