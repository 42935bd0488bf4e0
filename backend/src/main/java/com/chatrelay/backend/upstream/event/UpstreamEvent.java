package com.chatrelay.backend.upstream.event;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed view of one event of the upstream messages stream. Every variant keeps the original JSON
 * so events can be forwarded to the client without re-serialising a model.
 */
public sealed interface UpstreamEvent
    permits UpstreamEvent.MessageStart,
        UpstreamEvent.ContentBlockStart,
        UpstreamEvent.ContentBlockDelta,
        UpstreamEvent.ContentBlockStop,
        UpstreamEvent.MessageDelta,
        UpstreamEvent.MessageStop,
        UpstreamEvent.Ping,
        UpstreamEvent.StreamError,
        UpstreamEvent.Unknown {

  String type();

  JsonNode raw();

  record MessageStart(String messageId, String model, TokenUsage usage, JsonNode raw)
      implements UpstreamEvent {
    @Override
    public String type() {
      return "message_start";
    }
  }

  /**
   * @param blockType {@code text}, {@code thinking}, {@code redacted_thinking}, {@code tool_use}
   *     or {@code server_tool_use}
   */
  record ContentBlockStart(
      int index, String blockType, String toolUseId, String toolName, JsonNode block, JsonNode raw)
      implements UpstreamEvent {
    @Override
    public String type() {
      return "content_block_start";
    }
  }

  /**
   * @param deltaType {@code text_delta}, {@code thinking_delta}, {@code signature_delta} or
   *     {@code input_json_delta}
   * @param fragment the text, thinking, signature or partial JSON carried by the delta
   */
  record ContentBlockDelta(int index, String deltaType, String fragment, JsonNode raw)
      implements UpstreamEvent {
    @Override
    public String type() {
      return "content_block_delta";
    }
  }

  record ContentBlockStop(int index, JsonNode raw) implements UpstreamEvent {
    @Override
    public String type() {
      return "content_block_stop";
    }
  }

  record MessageDelta(String stopReason, TokenUsage usage, JsonNode raw) implements UpstreamEvent {
    @Override
    public String type() {
      return "message_delta";
    }
  }

  record MessageStop(JsonNode raw) implements UpstreamEvent {
    @Override
    public String type() {
      return "message_stop";
    }
  }

  record Ping(JsonNode raw) implements UpstreamEvent {
    @Override
    public String type() {
      return "ping";
    }
  }

  record StreamError(String errorType, String message, JsonNode raw) implements UpstreamEvent {
    @Override
    public String type() {
      return "error";
    }
  }

  record Unknown(String type, JsonNode raw) implements UpstreamEvent {}
}
