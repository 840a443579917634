package com.companya.scd.config;

import com.companya.scd.exception.ScdException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ScdProperties.class)
public class ScdEngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(ScdEngineConfig.class);
    public static final String STORAGE_RETRY = "scdStorageRetry";

    @Bean
    public Clock scdClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RetryRegistry scdRetryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Retry applied to storage reads and to the merge transaction. Only retryable
     * {@link ScdException}s (storage unavailable) are retried; everything else is fatal
     * for the pass on the first attempt.
     */
    @Bean
    public Retry scdStorageRetry(RetryRegistry registry, ScdProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getRetry().getMaxAttempts()))
                .waitDuration(properties.getRetry().getWait())
                .retryOnException(ex -> ex instanceof ScdException scd && scd.isRetryable())
                .build();
        Retry retry = registry.retry(STORAGE_RETRY, config);
        retry.getEventPublisher().onRetry(event ->
                logger.warn("Storage unavailable, retry attempt {} in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
