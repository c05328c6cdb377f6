package com.acme.pipeline.core;

import java.time.Duration;

/**
 * Exponential backoff calculator shared by the publisher retry loop and the dead-letter
 * reprocessor.
 *
 * <p>{@code delay(base, max, attempt) = min(base * 2^attempt, max)} with a zero-based attempt.
 * Growth is clamped to {@code max} before the multiplication can overflow.
 */
public final class Backoff {

  private Backoff() {}

  public static Duration delay(Duration base, Duration max, int attempt) {
    return Duration.ofMillis(delayMillis(base.toMillis(), max.toMillis(), attempt));
  }

  public static long delayMillis(long baseMillis, long maxMillis, int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be non-negative, got " + attempt);
    }
    if (baseMillis <= 0) {
      throw new IllegalArgumentException("base delay must be positive, got " + baseMillis);
    }
    if (maxMillis < baseMillis) {
      throw new IllegalArgumentException(
          "max delay (" + maxMillis + ") must be >= base delay (" + baseMillis + ")");
    }
    if (attempt >= Long.SIZE - 1 || baseMillis > (maxMillis >> attempt)) {
      return maxMillis;
    }
    return Math.min(baseMillis << attempt, maxMillis);
  }
}
