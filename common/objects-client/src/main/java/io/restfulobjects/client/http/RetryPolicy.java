package io.restfulobjects.client.http;

import java.time.Duration;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Immutable retry settings for {@link RetryingExecutor}.
 *
 * @param maxAttempts total number of invocations allowed, including the first
 * @param initialDelay pause before the second attempt
 * @param multiplier factor applied to the pause after every retry
 * @param transientStatus statuses that are discarded and retried while attempts remain
 */
public record RetryPolicy(int maxAttempts,
                          Duration initialDelay,
                          double multiplier,
                          IntPredicate transientStatus) {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(250);
  public static final double DEFAULT_MULTIPLIER = 2.0;

  public RetryPolicy {
    maxAttempts = maxAttempts <= 0 ? 1 : maxAttempts;
    initialDelay = initialDelay == null || initialDelay.isNegative() ? Duration.ZERO : initialDelay;
    multiplier = multiplier <= 0.0 ? 1.0 : multiplier;
    transientStatus = Objects.requireNonNull(transientStatus, "transientStatus");
  }

  /**
   * Three attempts, 250 ms initial delay doubling on each retry, retrying 429 and every 5xx.
   */
  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER,
        RetryPolicy::isTransientStatus);
  }

  /**
   * Single attempt; every outcome is terminal.
   */
  public static RetryPolicy none() {
    return new RetryPolicy(1, Duration.ZERO, 1.0, status -> false);
  }

  public RetryPolicy withMaxAttempts(int attempts) {
    return new RetryPolicy(attempts, initialDelay, multiplier, transientStatus);
  }

  public RetryPolicy withInitialDelay(Duration delay) {
    return new RetryPolicy(maxAttempts, delay, multiplier, transientStatus);
  }

  public boolean isTransient(int statusCode) {
    return transientStatus.test(statusCode);
  }

  public static boolean isTransientStatus(int statusCode) {
    return statusCode == 429 || (statusCode >= 500 && statusCode <= 599);
  }
}
