package net.shelfwatch.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import net.shelfwatch.application.scan.PageNotFoundException;
import net.shelfwatch.application.scan.ScanEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policy for scan jobs: engine failures back off exponentially, missing pages are never retried.
 */
@Configuration
public class ScanRetryConfig {

    private static final Logger log = LoggerFactory.getLogger(ScanRetryConfig.class);

    @Bean
    public Retry scanJobRetry(ScanProperties properties) {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(properties.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                Math.max(1L, properties.getInitialBackoff().toMillis()),
                properties.getBackoffMultiplier()))
            .retryExceptions(ScanEngineException.class)
            .ignoreExceptions(PageNotFoundException.class)
            .build();

        Retry retry = Retry.of("scanJob", config);
        retry.getEventPublisher().onRetry(event -> log.warn(
            "Scan job attempt {} failed, retrying in {}: {}",
            event.getNumberOfRetryAttempts(),
            event.getWaitInterval(),
            event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()));

        log.info("Scan job retry initialized (maxAttempts={}, initialBackoff={}, multiplier={})",
            properties.getMaxAttempts(), properties.getInitialBackoff(), properties.getBackoffMultiplier());
        return retry;
    }
}
