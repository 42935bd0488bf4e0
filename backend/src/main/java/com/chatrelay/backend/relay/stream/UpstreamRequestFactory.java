package com.chatrelay.backend.relay.stream;

import com.chatrelay.backend.relay.config.RelayProperties;
import com.chatrelay.backend.relay.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Builds the streaming request body for one round. */
@Component
public class UpstreamRequestFactory {

  private final RelayProperties properties;
  private final ToolRegistry toolRegistry;
  private final ObjectMapper objectMapper;

  public UpstreamRequestFactory(
      RelayProperties properties, ToolRegistry toolRegistry, ObjectMapper objectMapper) {
    this.properties = properties;
    this.toolRegistry = toolRegistry;
    this.objectMapper = objectMapper;
  }

  public ObjectNode build(RelayRequest request, ArrayNode messages, boolean includeTools) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", request.model());
    body.put("max_tokens", properties.getMaxTokens());
    if (StringUtils.hasText(request.systemPrompt())) {
      body.put("system", request.systemPrompt());
    }
    body.set("messages", messages.deepCopy());
    if (includeTools && toolRegistry.hasTools()) {
      body.set("tools", toolRegistry.definitions());
    }
    if (request.thinking()) {
      ObjectNode thinking = body.putObject("thinking");
      thinking.put("type", "enabled");
      thinking.put("budget_tokens", properties.getThinkingBudgetTokens());
    }
    body.put("stream", true);
    return body;
  }
}
