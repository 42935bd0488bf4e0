package com.chatrelay.backend.upstream.event;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.upstream.sse.SseFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Maps decoded SSE frames onto {@link UpstreamEvent}s. Malformed frames are skipped. */
@Component
public class UpstreamEventParser {

  private static final Logger log = LoggerFactory.getLogger(UpstreamEventParser.class);
  private static final String DONE_SENTINEL = "[DONE]";

  private final ObjectMapper objectMapper;

  public UpstreamEventParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Optional<UpstreamEvent> parse(SseFrame frame) {
    if (frame == null || !StringUtils.hasText(frame.data())) {
      return Optional.empty();
    }
    String data = frame.data().trim();
    if (DONE_SENTINEL.equals(data)) {
      return Optional.empty();
    }
    JsonNode node;
    try {
      node = objectMapper.readTree(data);
    } catch (JsonProcessingException ex) {
      log.warn(
          "Skipping malformed upstream frame '{}': {}", frame.event(), ex.getOriginalMessage());
      return Optional.empty();
    }
    if (node == null || !node.isObject()) {
      return Optional.empty();
    }
    String type = node.path("type").asText(null);
    if (!StringUtils.hasText(type)) {
      type = frame.event();
    }
    return Optional.of(toEvent(type != null ? type : "", node));
  }

  UpstreamEvent toEvent(String type, JsonNode node) {
    switch (type) {
      case "message_start" -> {
        JsonNode message = node.path("message");
        return new UpstreamEvent.MessageStart(
            message.path("id").asText(null),
            message.path("model").asText(null),
            usage(message.path("usage")),
            node);
      }
      case "content_block_start" -> {
        JsonNode block = node.path("content_block");
        return new UpstreamEvent.ContentBlockStart(
            node.path("index").asInt(0),
            block.path("type").asText(""),
            block.path("id").asText(null),
            block.path("name").asText(null),
            block,
            node);
      }
      case "content_block_delta" -> {
        JsonNode delta = node.path("delta");
        String deltaType = delta.path("type").asText("");
        return new UpstreamEvent.ContentBlockDelta(
            node.path("index").asInt(0), deltaType, fragment(deltaType, delta), node);
      }
      case "content_block_stop" -> {
        return new UpstreamEvent.ContentBlockStop(node.path("index").asInt(0), node);
      }
      case "message_delta" -> {
        return new UpstreamEvent.MessageDelta(
            node.path("delta").path("stop_reason").asText(null), usage(node.path("usage")), node);
      }
      case "message_stop" -> {
        return new UpstreamEvent.MessageStop(node);
      }
      case "ping" -> {
        return new UpstreamEvent.Ping(node);
      }
      case "error" -> {
        JsonNode error = node.path("error");
        return new UpstreamEvent.StreamError(
            error.path("type").asText("api_error"),
            error.path("message").asText("Upstream reported an error"),
            node);
      }
      default -> {
        return new UpstreamEvent.Unknown(type, node);
      }
    }
  }

  public static TokenUsage usage(JsonNode usage) {
    if (usage == null || usage.isMissingNode() || usage.isNull()) {
      return TokenUsage.EMPTY;
    }
    return new TokenUsage(
        usage.path("input_tokens").asLong(0),
        usage.path("output_tokens").asLong(0),
        usage.path("cache_creation_input_tokens").asLong(0),
        usage.path("cache_read_input_tokens").asLong(0));
  }

  private String fragment(String deltaType, JsonNode delta) {
    return switch (deltaType) {
      case "text_delta" -> delta.path("text").asText("");
      case "thinking_delta" -> delta.path("thinking").asText("");
      case "signature_delta" -> delta.path("signature").asText("");
      case "input_json_delta" -> delta.path("partial_json").asText("");
      default -> "";
    };
  }
}
