package com.flagship.loyalty_ledger.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;

/**
 * Bounded retry policies for writes that contend on row locks.
 *
 * Only {@link ConcurrencyFailureException} and its subclasses are retried
 * (optimistic version conflicts, lock acquisition failures, deadlocks).
 * Business rejections are never retried.
 */
@Configuration
@Slf4j
public class RetryConfig {

    public static final String LEDGER_RETRY = "ledgerWrite";
    public static final String ENROLLMENT_RETRY = "enrollmentTransition";

    @Value("${loyalty.ledger.retry.max-attempts:5}")
    private int maxAttempts;

    @Value("${loyalty.ledger.retry.initial-backoff-ms:20}")
    private long initialBackoffMs;

    @Value("${loyalty.ledger.retry.backoff-multiplier:2.0}")
    private double backoffMultiplier;

    @Bean
    public RetryRegistry retryRegistry() {
        io.github.resilience4j.retry.RetryConfig config = io.github.resilience4j.retry.RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        initialBackoffMs, backoffMultiplier, 0.5))
                .retryExceptions(ConcurrencyFailureException.class)
                .build();
        return RetryRegistry.of(config);
    }

    @Bean
    public Retry ledgerRetry(RetryRegistry registry) {
        return withLogging(registry.retry(LEDGER_RETRY));
    }

    @Bean
    public Retry enrollmentRetry(RetryRegistry registry) {
        return withLogging(registry.retry(ENROLLMENT_RETRY));
    }

    private Retry withLogging(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.debug("Retrying {} (attempt {}) after {}",
                        event.getName(), event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getClass().getSimpleName() : "unknown"))
                .onError(event -> log.warn("Giving up on {} after {} attempts",
                        event.getName(), event.getNumberOfRetryAttempts()));
        return retry;
    }
}
