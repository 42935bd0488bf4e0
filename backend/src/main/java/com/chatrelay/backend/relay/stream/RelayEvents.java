package com.chatrelay.backend.relay.stream;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.relay.tool.ToolCall;
import com.chatrelay.backend.relay.tool.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.springframework.stereotype.Component;

/** Factory for the events the relay synthesises for the client. */
@Component
public class RelayEvents {

  private final ObjectMapper objectMapper;

  public RelayEvents(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ObjectNode toolStatus(String status, List<ToolCall> calls) {
    ObjectNode event = objectMapper.createObjectNode();
    event.put("type", "status");
    event.put("status", status);
    ArrayNode tools = event.putArray("tools");
    calls.forEach(call -> tools.add(call.name()));
    return event;
  }

  public ObjectNode searchSources(ToolResult result) {
    ObjectNode event = objectMapper.createObjectNode();
    event.put("type", "search_sources");
    event.put("tool_use_id", result.toolUseId());
    ArrayNode sources = event.putArray("sources");
    result.sources().forEach(sources::add);
    return event;
  }

  public ObjectNode documentCreated(ToolResult result) {
    ObjectNode event = objectMapper.createObjectNode();
    event.put("type", "document_created");
    event.put("tool_use_id", result.toolUseId());
    event.set("document", result.document());
    return event;
  }

  public ObjectNode thinkingSummary(int index, String summary) {
    ObjectNode event = objectMapper.createObjectNode();
    event.put("type", "thinking_summary");
    event.put("index", index);
    event.put("summary", summary);
    return event;
  }

  public ObjectNode compaction(int messagesCompacted, long tokensSaved) {
    ObjectNode event = objectMapper.createObjectNode();
    event.put("type", "system");
    event.put("subtype", "compaction");
    event.put("messagesCompacted", messagesCompacted);
    event.put("tokensSaved", tokensSaved);
    return event;
  }

  public ObjectNode error(String errorType, String message) {
    ObjectNode event = objectMapper.createObjectNode();
    event.put("type", "error");
    ObjectNode error = event.putObject("error");
    error.put("type", errorType);
    error.put("message", message);
    return event;
  }

  /** Terminal {@code message_delta} carrying the usage of the whole session. */
  public ObjectNode finalMessageDelta(JsonNode upstreamDelta, TokenUsage sessionUsage) {
    ObjectNode event =
        upstreamDelta != null && upstreamDelta.isObject()
            ? ((ObjectNode) upstreamDelta).deepCopy()
            : objectMapper.createObjectNode().put("type", "message_delta");
    ObjectNode usage = event.putObject("usage");
    usage.put("input_tokens", sessionUsage.inputTokens());
    usage.put("output_tokens", sessionUsage.outputTokens());
    usage.put("cache_creation_input_tokens", sessionUsage.cacheCreationTokens());
    usage.put("cache_read_input_tokens", sessionUsage.cacheReadTokens());
    return event;
  }

  public ObjectNode assistantMessage(List<ObjectNode> contentBlocks) {
    ObjectNode message = objectMapper.createObjectNode();
    message.put("role", "assistant");
    ArrayNode content = message.putArray("content");
    contentBlocks.forEach(content::add);
    return message;
  }

  public ObjectNode toolResultMessage(List<ToolResult> results) {
    ObjectNode message = objectMapper.createObjectNode();
    message.put("role", "user");
    ArrayNode content = message.putArray("content");
    for (ToolResult result : results) {
      ObjectNode block = content.addObject();
      block.put("type", "tool_result");
      block.put("tool_use_id", result.toolUseId());
      block.put("content", result.content());
      if (result.error()) {
        block.put("is_error", true);
      }
    }
    return message;
  }
}
