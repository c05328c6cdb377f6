package com.acme.pipeline.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Circuit breaker thresholds.
 *
 * @param failureThreshold consecutive failures that open the circuit
 * @param openDuration how long the circuit rejects calls before allowing trial calls
 * @param halfOpenMaxAttempts trial calls allowed while half-open; that many consecutive successes
 *     close the circuit
 */
public record CircuitBreakerConfig(
    int failureThreshold, Duration openDuration, int halfOpenMaxAttempts) {

  public static final int DEFAULT_FAILURE_THRESHOLD = 5;
  public static final Duration DEFAULT_OPEN_DURATION = Duration.ofSeconds(30);
  public static final int DEFAULT_HALF_OPEN_MAX_ATTEMPTS = 1;

  public CircuitBreakerConfig {
    Objects.requireNonNull(openDuration, "openDuration");
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException(
          "failureThreshold must be positive, got " + failureThreshold);
    }
    if (openDuration.isNegative() || openDuration.isZero()) {
      throw new IllegalArgumentException("openDuration must be positive, got " + openDuration);
    }
    if (halfOpenMaxAttempts <= 0) {
      throw new IllegalArgumentException(
          "halfOpenMaxAttempts must be positive, got " + halfOpenMaxAttempts);
    }
  }

  public static CircuitBreakerConfig defaults() {
    return new CircuitBreakerConfig(
        DEFAULT_FAILURE_THRESHOLD, DEFAULT_OPEN_DURATION, DEFAULT_HALF_OPEN_MAX_ATTEMPTS);
  }
}
