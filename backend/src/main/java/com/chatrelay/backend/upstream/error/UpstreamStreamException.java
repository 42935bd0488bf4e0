package com.chatrelay.backend.upstream.error;

/** Transport failure while connecting to or reading from the upstream API. */
public class UpstreamStreamException extends RuntimeException {

  public UpstreamStreamException(String message) {
    super(message);
  }

  public UpstreamStreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
