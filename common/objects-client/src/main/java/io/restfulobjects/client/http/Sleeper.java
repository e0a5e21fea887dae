package io.restfulobjects.client.http;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
