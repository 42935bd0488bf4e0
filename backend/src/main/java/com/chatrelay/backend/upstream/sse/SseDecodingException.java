package com.chatrelay.backend.upstream.sse;

public class SseDecodingException extends RuntimeException {

  public SseDecodingException(String message) {
    super(message);
  }
}
