package com.acme.pipeline.breaker;

import com.acme.pipeline.config.CircuitBreakerConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards a single downstream dependency.
 *
 * <ul>
 *   <li>CLOSED: calls pass through; {@code failureThreshold} consecutive failures open the circuit,
 *       any success resets the count.
 *   <li>OPEN: calls fail fast with {@link CircuitBreakerOpenException}. The first call after
 *       {@code openDuration} moves the circuit to HALF_OPEN and runs as a trial.
 *   <li>HALF_OPEN: at most {@code halfOpenMaxAttempts} trial calls are admitted. A failure reopens
 *       the circuit and restarts the open timer; {@code halfOpenMaxAttempts} successes close it.
 * </ul>
 *
 * <p>All state lives in one object guarded by {@code lock}; permission to call is decided and
 * recorded in the same critical section, so racing callers cannot exceed the trial budget. The
 * downstream call itself runs outside the lock.
 */
public class CircuitBreaker {
  private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

  public enum State {
    CLOSED,
    OPEN,
    HALF_OPEN
  }

  /** Point-in-time view of the breaker, for health reporting and tests. */
  public record Snapshot(
      State state, int failureCount, Instant openedAt, int halfOpenAttempts, int halfOpenSuccesses) {}

  /** Observer for call timings and state transitions. Both methods default to no-ops. */
  public interface Listener {
    Listener NOOP = new Listener() {};

    default void onCallCompleted(String name, Duration duration, boolean success) {}

    default void onStateChange(String name, State from, State to) {}
  }

  private final String name;
  private final CircuitBreakerConfig config;
  private final Clock clock;
  private final Listener listener;
  private final Object lock = new Object();

  // guarded by lock
  private State state = State.CLOSED;
  private int failureCount;
  private Instant openedAt;
  private int halfOpenAttempts;
  private int halfOpenSuccesses;

  public CircuitBreaker(String name, CircuitBreakerConfig config) {
    this(name, config, Clock.systemUTC(), Listener.NOOP);
  }

  public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, Listener listener) {
    this.name = Objects.requireNonNull(name, "name");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = listener == null ? Listener.NOOP : listener;
  }

  public String name() {
    return name;
  }

  public CircuitBreakerConfig config() {
    return config;
  }

  public Snapshot state() {
    synchronized (lock) {
      return new Snapshot(state, failureCount, openedAt, halfOpenAttempts, halfOpenSuccesses);
    }
  }

  /**
   * Runs a blocking call through the breaker. Failures, {@link Error}s included, count against
   * the circuit and are rethrown unchanged.
   */
  public <T> T call(Callable<T> operation) throws Exception {
    acquirePermission();
    long start = System.nanoTime();
    try {
      T result = operation.call();
      onSuccess(elapsedSince(start));
      return result;
    } catch (Exception | Error e) {
      onFailure(elapsedSince(start));
      throw e;
    }
  }

  /**
   * Runs an asynchronous call through the breaker. When the circuit is open the returned future
   * is already failed with {@link CircuitBreakerOpenException} and the supplier is not invoked.
   */
  public <T> CompletableFuture<T> callAsync(Supplier<CompletableFuture<T>> operation) {
    try {
      acquirePermission();
    } catch (CircuitBreakerOpenException e) {
      return CompletableFuture.failedFuture(e);
    }
    long start = System.nanoTime();
    CompletableFuture<T> future;
    try {
      future = operation.get();
    } catch (RuntimeException e) {
      onFailure(elapsedSince(start));
      return CompletableFuture.failedFuture(e);
    } catch (Error e) {
      onFailure(elapsedSince(start));
      throw e;
    }
    return future.whenComplete(
        (result, error) -> {
          if (error == null) {
            onSuccess(elapsedSince(start));
          } else {
            onFailure(elapsedSince(start));
          }
        });
  }

  void acquirePermission() {
    State from;
    State to;
    synchronized (lock) {
      from = state;
      if (state == State.OPEN) {
        Duration elapsed = Duration.between(openedAt, clock.instant());
        if (elapsed.compareTo(config.openDuration()) < 0) {
          throw new CircuitBreakerOpenException(name, config.openDuration().minus(elapsed));
        }
        state = State.HALF_OPEN;
        halfOpenAttempts = 0;
        halfOpenSuccesses = 0;
        LOG.info("Circuit breaker '{}' OPEN -> HALF_OPEN after {}ms", name, elapsed.toMillis());
      }
      if (state == State.HALF_OPEN) {
        if (halfOpenAttempts >= config.halfOpenMaxAttempts()) {
          throw new CircuitBreakerOpenException(name, Duration.ZERO);
        }
        halfOpenAttempts++;
      }
      to = state;
    }
    notifyTransition(from, to);
  }

  private void onSuccess(Duration duration) {
    State from;
    State to;
    synchronized (lock) {
      from = state;
      switch (state) {
        case CLOSED -> failureCount = 0;
        case HALF_OPEN -> {
          halfOpenSuccesses++;
          if (halfOpenSuccesses >= config.halfOpenMaxAttempts()) {
            close();
            LOG.info("Circuit breaker '{}' HALF_OPEN -> CLOSED after trial successes", name);
          }
        }
        case OPEN -> {
          // outcome of a call admitted before the circuit reopened; the open timer stands
        }
      }
      to = state;
    }
    listener.onCallCompleted(name, duration, true);
    notifyTransition(from, to);
  }

  private void onFailure(Duration duration) {
    State from;
    State to;
    synchronized (lock) {
      from = state;
      switch (state) {
        case CLOSED -> {
          failureCount++;
          if (failureCount >= config.failureThreshold()) {
            open();
            LOG.warn(
                "Circuit breaker '{}' OPENED after {} consecutive failures", name, failureCount);
          } else {
            LOG.debug(
                "Circuit breaker '{}' failure count: {}/{}",
                name,
                failureCount,
                config.failureThreshold());
          }
        }
        case HALF_OPEN -> {
          open();
          LOG.warn("Circuit breaker '{}' returned to OPEN after half-open failure", name);
        }
        case OPEN -> {
          // already open
        }
      }
      to = state;
    }
    listener.onCallCompleted(name, duration, false);
    notifyTransition(from, to);
  }

  private void open() {
    state = State.OPEN;
    openedAt = clock.instant();
    halfOpenAttempts = 0;
    halfOpenSuccesses = 0;
  }

  private void close() {
    state = State.CLOSED;
    failureCount = 0;
    openedAt = null;
    halfOpenAttempts = 0;
    halfOpenSuccesses = 0;
  }

  private void notifyTransition(State from, State to) {
    if (from != to) {
      listener.onStateChange(name, from, to);
    }
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
