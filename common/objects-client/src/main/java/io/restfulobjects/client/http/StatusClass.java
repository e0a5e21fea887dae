package io.restfulobjects.client.http;

/**
 * Coarse classification of an HTTP status code.
 */
public enum StatusClass {
  SUCCESS,
  CLIENT_ERROR,
  SERVER_ERROR,
  OTHER;

  public static StatusClass of(int statusCode) {
    if (statusCode >= 200 && statusCode <= 299) {
      return SUCCESS;
    }
    if (statusCode >= 400 && statusCode <= 499) {
      return CLIENT_ERROR;
    }
    if (statusCode >= 500 && statusCode <= 599) {
      return SERVER_ERROR;
    }
    return OTHER;
  }
}
