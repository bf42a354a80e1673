package io.github.samzhu.finops.collector;

import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.samzhu.finops.config.FinopsProperties;

/**
 * 建立收集層共用的重試策略。
 *
 * <p>指數退避：第 n 次重試前等待 {@code initialBackoff × 2^(n-1)}，上限 {@code maxBackoff}，
 * 總嘗試次數為 {@code finops.collection.max-retry-attempts}。
 *
 * @see <a href="https://resilience4j.readme.io/docs/retry">Resilience4j Retry</a>
 */
@Component
public class CollectorRetryFactory {

    private static final Logger log = LoggerFactory.getLogger(CollectorRetryFactory.class);

    private final FinopsProperties.CollectionConfig config;

    public CollectorRetryFactory(FinopsProperties properties) {
        this.config = properties.collection();
    }

    /**
     * 建立具名重試實例。
     *
     * @param name 名稱，用於日誌
     * @param retryable 判斷例外是否值得重試
     * @return 重試實例
     */
    public Retry create(String name, Predicate<Throwable> retryable) {
        RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(config.maxRetryAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                config.initialBackoff(), 2.0, config.maxBackoff()))
            .retryOnException(retryable)
            .build();

        Retry retry = Retry.of(name, retryConfig);
        retry.getEventPublisher().onRetry(event ->
            log.warn("Retrying {}: attempt={}, wait={}ms, error={}",
                name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    public int maxAttempts() {
        return config.maxRetryAttempts();
    }
}
