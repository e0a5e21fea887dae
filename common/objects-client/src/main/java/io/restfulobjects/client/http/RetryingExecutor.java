package io.restfulobjects.client.http;

import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an {@link ExchangeCall} under a {@link RetryPolicy}.
 * <p>
 * Network failures and transient statuses are retried with exponential backoff while attempts
 * remain. Any other response is returned untouched. The outcome of the final attempt is always
 * surfaced: its response is returned whatever the status, and its {@link NetworkException} is
 * rethrown.
 */
public final class RetryingExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryingExecutor.class);

  private final RetryPolicy policy;
  private final Sleeper sleeper;

  public RetryingExecutor(RetryPolicy policy) {
    this(policy, Sleeper.THREAD);
  }

  public RetryingExecutor(RetryPolicy policy, Sleeper sleeper) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public RetryPolicy policy() {
    return policy;
  }

  public RawResponse execute(ExchangeCall call) {
    Objects.requireNonNull(call, "call");
    int maxAttempts = policy.maxAttempts();
    Duration delay = policy.initialDelay();

    for (int attempt = 1; attempt < maxAttempts; attempt++) {
      RawResponse response;
      try {
        response = call.call();
      } catch (NetworkException ex) {
        LOGGER.warn("Attempt {}/{} failed: {}; retrying in {} ms",
            attempt, maxAttempts, ex.getMessage(), delay.toMillis());
        if (!pause(delay)) {
          throw ex;
        }
        delay = next(delay);
        continue;
      }

      if (!policy.isTransient(response.statusCode())) {
        return response;
      }
      LOGGER.warn("Attempt {}/{} returned transient status {}; retrying in {} ms",
          attempt, maxAttempts, response.statusCode(), delay.toMillis());
      if (!pause(delay)) {
        return response;
      }
      delay = next(delay);
    }

    return call.call();
  }

  private boolean pause(Duration delay) {
    if (delay.isZero()) {
      return true;
    }
    try {
      sleeper.sleep(delay);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      LOGGER.debug("Interrupted while backing off; abandoning retries");
      return false;
    }
  }

  private Duration next(Duration delay) {
    return Duration.ofMillis((long) (delay.toMillis() * policy.multiplier()));
  }
}
