package com.acme.pipeline.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Dead-letter reprocessing parameters.
 *
 * @param maxRetryCycles dead-letter cycles a job may go through before it is parked; a job whose
 *     death count equals this value is still reprocessed
 * @param baseDelay wait before republishing a job on its first cycle, doubled per cycle
 * @param maxDelay upper bound on the republish wait
 * @param enabled whether the worker starts the reprocessor at all
 */
public record DlqReprocessorConfig(
    int maxRetryCycles, Duration baseDelay, Duration maxDelay, boolean enabled) {

  public static final int DEFAULT_MAX_RETRY_CYCLES = 3;
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(5);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

  public DlqReprocessorConfig {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (maxRetryCycles < 0) {
      throw new IllegalArgumentException(
          "maxRetryCycles must be non-negative, got " + maxRetryCycles);
    }
    Validation.requireOrderedDelays(baseDelay, maxDelay);
  }

  public static DlqReprocessorConfig defaults() {
    return new DlqReprocessorConfig(
        DEFAULT_MAX_RETRY_CYCLES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, true);
  }

  /** Whether a job that has been dead-lettered {@code deathCount} times should be parked. */
  public boolean shouldPark(int deathCount) {
    return deathCount > maxRetryCycles;
  }
}
