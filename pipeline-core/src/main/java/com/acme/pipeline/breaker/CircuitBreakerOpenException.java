package com.acme.pipeline.breaker;

import java.time.Duration;

/**
 * Raised instead of calling the dependency while the circuit is open or its half-open trial budget
 * is in use. Handlers treat it like any other classification failure so the job dead-letters and
 * is retried after backoff.
 */
public class CircuitBreakerOpenException extends RuntimeException {

  private final String breakerName;
  private final Duration retryAfter;

  public CircuitBreakerOpenException(String breakerName, Duration retryAfter) {
    super(
        "Circuit breaker '"
            + breakerName
            + "' is OPEN, call rejected; retry after "
            + retryAfter.toMillis()
            + "ms");
    this.breakerName = breakerName;
    this.retryAfter = retryAfter;
  }

  public String getBreakerName() {
    return breakerName;
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }
}
