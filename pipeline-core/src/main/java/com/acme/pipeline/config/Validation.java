package com.acme.pipeline.config;

import java.time.Duration;

final class Validation {

  private Validation() {}

  static void requireOrderedDelays(Duration baseDelay, Duration maxDelay) {
    if (baseDelay.toMillis() <= 0) {
      throw new IllegalArgumentException("baseDelay must be at least 1ms, got " + baseDelay);
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException(
          "maxDelay (" + maxDelay + ") must be >= baseDelay (" + baseDelay + ")");
    }
  }
}
