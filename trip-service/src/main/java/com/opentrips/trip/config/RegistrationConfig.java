package com.opentrips.trip.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

/**
 * Beans shared by the registration lifecycle.
 */
@Configuration
public class RegistrationConfig {

    /**
     * Retries a whole registration transaction after it lost a race: lock timeouts,
     * deadlocks and stale versions ({@link ConcurrencyFailureException}) and unique keys
     * taken by a concurrent insert ({@link DuplicateKeyException}). Check constraint and
     * overflow failures, like business failures, are not retried.
     */
    @Bean
    public RetryTemplate registrationRetryTemplate(
            @Value("${trip.registration.retry.max-attempts:3}") int maxAttempts,
            @Value("${trip.registration.retry.initial-interval-ms:50}") long initialInterval,
            @Value("${trip.registration.retry.multiplier:2.0}") double multiplier,
            @Value("${trip.registration.retry.max-interval-ms:1000}") long maxInterval) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialInterval, multiplier, maxInterval)
                .retryOn(ConcurrencyFailureException.class)
                .retryOn(DuplicateKeyException.class)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
