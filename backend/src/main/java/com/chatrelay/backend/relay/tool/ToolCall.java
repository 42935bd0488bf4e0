package com.chatrelay.backend.relay.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/** A tool invocation requested by the model, with its fully parsed arguments. */
public record ToolCall(String id, String name, JsonNode input) {

  public ToolCall {
    input = input != null ? input : JsonNodeFactory.instance.objectNode();
  }
}
