package com.chatrelay.backend.relay.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Tools offered to the model. Local tools run inside the relay; server tools are declared to the
 * upstream as-is and executed there.
 */
@Component
public class ToolRegistry {

  private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

  private final Map<String, ChatTool> localTools = new LinkedHashMap<>();
  private final List<JsonNode> serverTools;
  private final ObjectMapper objectMapper;

  @Autowired
  public ToolRegistry(
      ObjectProvider<ChatTool> tools,
      ServerToolProperties serverToolProperties,
      ObjectMapper objectMapper) {
    this(tools.orderedStream().toList(), serverToolProperties, objectMapper);
  }

  public ToolRegistry(
      List<ChatTool> tools, ServerToolProperties serverToolProperties, ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    for (ChatTool tool : tools) {
      if (!StringUtils.hasText(tool.name())) {
        throw new IllegalStateException("Tool " + tool.getClass().getName() + " has no name");
      }
      if (tool.inputSchema() == null || !tool.inputSchema().isObject()) {
        throw new IllegalStateException("Tool '" + tool.name() + "' has no input schema");
      }
      if (localTools.putIfAbsent(tool.name(), tool) != null) {
        throw new IllegalStateException("Duplicate tool name '" + tool.name() + "'");
      }
    }
    this.serverTools =
        serverToolProperties.getDefinitions().stream()
            .map(definition -> (JsonNode) objectMapper.valueToTree(definition))
            .toList();
    log.info(
        "Registered {} local and {} server tools: {}",
        localTools.size(),
        serverTools.size(),
        localTools.keySet());
  }

  public Optional<ChatTool> find(String name) {
    return Optional.ofNullable(localTools.get(name));
  }

  public boolean hasTools() {
    return !localTools.isEmpty() || !serverTools.isEmpty();
  }

  /** Tool list in the shape of the upstream request's {@code tools} field. */
  public ArrayNode definitions() {
    ArrayNode definitions = objectMapper.createArrayNode();
    for (ChatTool tool : localTools.values()) {
      ObjectNode definition = definitions.addObject();
      definition.put("name", tool.name());
      definition.put("description", tool.description() != null ? tool.description() : "");
      definition.set("input_schema", tool.inputSchema());
    }
    serverTools.forEach(tool -> definitions.add(tool.deepCopy()));
    return definitions;
  }
}
