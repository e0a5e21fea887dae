package io.restfulobjects.client.http;

/**
 * Raised when an exchange could not complete: connection refused or reset, DNS failure, or timeout.
 */
public class NetworkException extends RuntimeException {

  public NetworkException(String message, Throwable cause) {
    super(message, cause);
  }

  public NetworkException(String message) {
    super(message);
  }
}
