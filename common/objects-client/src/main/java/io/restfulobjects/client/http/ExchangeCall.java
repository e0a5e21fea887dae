package io.restfulobjects.client.http;

/**
 * One network exchange. Implementations perform exactly one request per invocation and signal
 * transport failures with {@link NetworkException}.
 */
@FunctionalInterface
public interface ExchangeCall {

  RawResponse call();
}
