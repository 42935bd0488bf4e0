package com.chatrelay.backend.relay.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public record ToolResult(
    String toolUseId,
    String toolName,
    String content,
    boolean error,
    List<JsonNode> sources,
    JsonNode document) {

  public ToolResult {
    sources = sources != null ? List.copyOf(sources) : List.of();
  }

  public static ToolResult success(ToolCall call, ToolOutput output) {
    return new ToolResult(
        call.id(), call.name(), output.content(), false, output.sources(), output.document());
  }

  public static ToolResult failure(ToolCall call, String message) {
    return new ToolResult(call.id(), call.name(), message, true, List.of(), null);
  }
}
