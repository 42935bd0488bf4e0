package com.chatrelay.backend.relay.tool;

import com.fasterxml.jackson.databind.JsonNode;

/** A locally executed tool the model may call. Implementations are picked up as Spring beans. */
public interface ChatTool {

  String name();

  String description();

  /** JSON schema of the tool arguments. */
  JsonNode inputSchema();

  /**
   * Runs the tool. Thrown exceptions are reported to the model as an error result.
   *
   * @throws Exception on any failure
   */
  ToolOutput execute(JsonNode input, ToolContext context) throws Exception;
}
