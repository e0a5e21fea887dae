package io.restfulobjects.e2e.support;

/**
 * Raised when a named fixture file cannot be located.
 */
public class TestDataNotFoundException extends IllegalStateException {

  public TestDataNotFoundException(String message) {
    super(message);
  }
}
