package com.flagship.leave_ledger.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Enables {@code @Retryable} on workflow and balance commands.
 * The retry advice wraps the transactional one, so every attempt runs in a fresh transaction.
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
