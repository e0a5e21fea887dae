package io.restfulobjects.client.http;

/**
 * Status and undecoded body of a single HTTP exchange.
 *
 * @param statusCode numeric HTTP status
 * @param body response body as text, empty when the server sent none
 */
public record RawResponse(int statusCode, String body) {

  public RawResponse {
    body = body == null ? "" : body;
  }

  public StatusClass statusClass() {
    return StatusClass.of(statusCode);
  }

  public boolean hasBody() {
    return !body.isBlank();
  }

  /**
   * Short single-line rendering used in log lines and assertion messages.
   */
  public String summary() {
    String snippet = body.strip();
    if (snippet.length() > 200) {
      snippet = snippet.substring(0, 200) + "...";
    }
    return "status=" + statusCode + " body=" + snippet;
  }
}
