package com.gbu.courseplatform.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;

@Slf4j
@Configuration
public class ResilienceConfig {

    /**
     * Retry for short-lived persistence faults: lock timeouts, racing inserts
     * and lost connections. Business exceptions are never retried.
     */
    @Bean
    public Retry persistenceRetryPolicy(
            @Value("${app.retry.max-attempts:3}") int maxAttempts,
            @Value("${app.retry.wait-ms:100}") long waitMs) {
        RetryConfig cfg = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(waitMs))
                .retryExceptions(TransientDataAccessException.class, DataAccessResourceFailureException.class,
                        CannotCreateTransactionException.class)
                .build();
        Retry retry = Retry.of("persistence", cfg);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} (attempt {}) after {}",
                event.getName(), event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"));
        return retry;
    }
}
