package com.acme.pipeline.core;

import com.acme.pipeline.config.RetryConfig;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation up to {@code maxRetries + 1} times, waiting {@link Backoff#delay} between
 * attempts that fail with a retryable exception.
 *
 * <p>The failure that ends the loop (non-retryable, or the last attempt) is rethrown as-is. The
 * wait happens on the calling thread, so callers run this on an I/O executor rather than on a
 * compute or broker callback thread. An interrupt during the wait stops retrying and rethrows the
 * last failure with the {@link InterruptedException} attached as suppressed.
 */
public final class RetryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

  private final RetryConfig config;
  private final Sleeper sleeper;

  public RetryExecutor(RetryConfig config) {
    this(config, Sleeper.SYSTEM);
  }

  public RetryExecutor(RetryConfig config, Sleeper sleeper) {
    this.config = Objects.requireNonNull(config, "config");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public RetryConfig config() {
    return config;
  }

  public <T> T execute(String operationName, Callable<T> operation) throws Exception {
    return execute(operationName, operation, e -> true);
  }

  public <T> T execute(
      String operationName, Callable<T> operation, Predicate<? super Exception> retryOn)
      throws Exception {
    int totalAttempts = config.maxRetries() + 1;
    for (int attempt = 0; ; attempt++) {
      try {
        return operation.call();
      } catch (Exception e) {
        boolean lastAttempt = attempt + 1 >= totalAttempts;
        if (lastAttempt || !retryOn.test(e)) {
          throw e;
        }
        Duration delay = Backoff.delay(config.baseDelay(), config.maxDelay(), attempt);
        LOG.warn(
            "{} failed (attempt {}/{}), retrying in {}ms: {}",
            operationName,
            attempt + 1,
            totalAttempts,
            delay.toMillis(),
            e.getMessage());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          e.addSuppressed(interrupted);
          throw e;
        }
      }
    }
  }
}
