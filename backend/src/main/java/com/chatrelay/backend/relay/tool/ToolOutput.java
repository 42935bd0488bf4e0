package com.chatrelay.backend.relay.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * What a tool hands back to the relay.
 *
 * @param content text passed to the model as the tool result
 * @param sources search results shown to the client, may be empty
 * @param document artifact produced by the tool, or {@code null}
 */
public record ToolOutput(String content, List<JsonNode> sources, JsonNode document) {

  public ToolOutput {
    content = content != null ? content : "";
    sources = sources != null ? List.copyOf(sources) : List.of();
  }

  public static ToolOutput text(String content) {
    return new ToolOutput(content, List.of(), null);
  }
}
