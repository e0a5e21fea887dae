package io.restfulobjects.client;

import io.restfulobjects.client.http.StatusClass;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal status of an API call together with its best-effort decoded body.
 * <p>
 * The status and the body are independent: a 2xx can come back with an empty body when the
 * payload was blank or not decodable, and a 4xx can carry a decoded body.
 *
 * @param statusCode numeric HTTP status
 * @param body decoded body, empty when absent or undecodable
 * @param <T> decoded body type
 */
public record ApiResult<T>(int statusCode, Optional<T> body) {

  public ApiResult {
    body = Objects.requireNonNullElse(body, Optional.empty());
  }

  public StatusClass statusClass() {
    return StatusClass.of(statusCode);
  }

  public boolean isSuccess() {
    return statusClass() == StatusClass.SUCCESS;
  }

  public boolean isOkOrCreated() {
    return statusCode == 200 || statusCode == 201;
  }

  /**
   * Delete responses are acceptable as 200, 202 or 204; the exact code is not fixed by the API.
   */
  public boolean isDeleteAccepted() {
    return statusCode == 200 || statusCode == 202 || statusCode == 204;
  }

  public T requireBody() {
    return body.orElseThrow(() -> new IllegalStateException("No decodable body for status " + statusCode));
  }
}
