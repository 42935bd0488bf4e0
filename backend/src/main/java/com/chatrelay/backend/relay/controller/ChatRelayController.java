package com.chatrelay.backend.relay.controller;

import com.chatrelay.backend.common.web.TenantHeaders;
import com.chatrelay.backend.relay.api.ChatStreamRequest;
import com.chatrelay.backend.relay.service.ChatRateLimiter;
import com.chatrelay.backend.relay.service.StreamingRelayService;
import com.chatrelay.backend.relay.stream.RelaySession;
import com.chatrelay.backend.relay.web.SseEmitterEventSink;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/chat")
public class ChatRelayController {

  private final StreamingRelayService relayService;
  private final ChatRateLimiter rateLimiter;

  public ChatRelayController(StreamingRelayService relayService, ChatRateLimiter rateLimiter) {
    this.relayService = relayService;
    this.rateLimiter = rateLimiter;
  }

  @PostMapping(
      value = "/stream",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(summary = "Send a message and stream the assistant's reply as server-sent events")
  public SseEmitter stream(
      @RequestHeader(TenantHeaders.TENANT_ID) UUID tenantId,
      @RequestBody @Valid ChatStreamRequest request) {
    rateLimiter.acquire(tenantId);
    SseEmitter emitter = new SseEmitter(0L);
    SseEmitterEventSink sink = new SseEmitterEventSink(emitter);
    RelaySession session = relayService.open(tenantId, request, sink);

    emitter.onCompletion(
        () -> {
          sink.markClosed();
          session.cancel();
        });
    emitter.onTimeout(
        () -> {
          sink.markClosed();
          session.cancel();
        });
    emitter.onError(
        error -> {
          sink.markClosed();
          session.cancel();
        });

    relayService.start(session, relayService.resolveThinking(request));
    return emitter;
  }
}
