package com.chatrelay.backend.relay.web;

import com.chatrelay.backend.relay.stream.RelayEventSink;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Writes relay events as {@code data: <json>} frames. */
public class SseEmitterEventSink implements RelayEventSink {

  private static final Logger log = LoggerFactory.getLogger(SseEmitterEventSink.class);

  private final SseEmitter emitter;
  private boolean closed;

  public SseEmitterEventSink(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public synchronized boolean send(JsonNode event) {
    if (closed) {
      return false;
    }
    try {
      emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
      return true;
    } catch (IOException | IllegalStateException ex) {
      log.debug(
          "Client stream closed while sending {}: {}",
          event.path("type").asText(),
          ex.getMessage());
      closed = true;
      return false;
    }
  }

  @Override
  public synchronized void complete() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      emitter.complete();
    } catch (IllegalStateException ex) {
      log.debug("Client stream already completed: {}", ex.getMessage());
    }
  }

  /** Marks the sink closed after the servlet container ended the response. */
  public synchronized void markClosed() {
    closed = true;
  }
}
