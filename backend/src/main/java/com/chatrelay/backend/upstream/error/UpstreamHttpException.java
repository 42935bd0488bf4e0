package com.chatrelay.backend.upstream.error;

/** Non-2xx answer of the upstream API, raised before any body event was consumed. */
public class UpstreamHttpException extends RuntimeException {

  private final int statusCode;
  private final String responseBody;

  public UpstreamHttpException(int statusCode, String responseBody) {
    super("Upstream responded with HTTP " + statusCode);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
