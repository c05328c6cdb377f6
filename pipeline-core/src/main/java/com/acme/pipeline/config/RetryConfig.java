package com.acme.pipeline.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry behaviour for the publisher's transient-failure loop.
 *
 * @param maxRetries retries after the first attempt; 0 means a single attempt
 * @param baseDelay delay before the first retry, doubled on each further retry
 * @param maxDelay upper bound on any single delay
 */
public record RetryConfig(int maxRetries, Duration baseDelay, Duration maxDelay) {

  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

  public RetryConfig {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be non-negative, got " + maxRetries);
    }
    Validation.requireOrderedDelays(baseDelay, maxDelay);
  }

  public static RetryConfig defaults() {
    return new RetryConfig(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
  }
}
