package com.auscomply.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policies for audit writes and risk scoring.
 */
@Configuration
public class ResilienceConfig {

    /**
     * Audit writes retry on any data access failure with exponential backoff.
     * Exhaustion is escalated by the recorder, never dropped.
     */
    @Bean
    public RetryTemplate auditRetryTemplate(
            @Value("${auscomply.audit.retry.max-attempts:3}") int maxAttempts,
            @Value("${auscomply.audit.retry.initial-backoff-ms:200}") long initialBackoffMs,
            @Value("${auscomply.audit.retry.max-backoff-ms:2000}") long maxBackoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs)
                .retryOn(DataAccessException.class)
                .traversingCauses()
                .build();
    }

    /**
     * Scoring retries lost races on the per-user window row: a concurrent first insert
     * for the same user, lock timeouts and optimistic version conflicts.
     */
    @Bean
    public RetryTemplate scoringRetryTemplate(
            @Value("${auscomply.aml.retry.max-attempts:5}") int maxAttempts,
            @Value("${auscomply.aml.retry.initial-backoff-ms:20}") long initialBackoffMs,
            @Value("${auscomply.aml.retry.max-backoff-ms:500}") long maxBackoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs)
                .retryOn(DataIntegrityViolationException.class)
                .retryOn(ConcurrencyFailureException.class)
                .retryOn(TransientDataAccessException.class)
                .traversingCauses()
                .build();
    }
}
