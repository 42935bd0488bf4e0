package com.chatrelay.backend.relay.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void definitionsListLocalToolsThenServerTools() {
    ServerToolProperties serverTools = new ServerToolProperties();
    serverTools.setDefinitions(
        List.of(Map.of("type", "web_search_20250305", "name", "web_search", "max_uses", 5)));
    ToolRegistry registry = new ToolRegistry(List.of(tool("lookup")), serverTools, objectMapper);

    ArrayNode definitions = registry.definitions();

    assertThat(definitions).hasSize(2);
    assertThat(definitions.get(0).path("name").asText()).isEqualTo("lookup");
    assertThat(definitions.get(0).path("input_schema").path("type").asText()).isEqualTo("object");
    assertThat(definitions.get(1).path("type").asText()).isEqualTo("web_search_20250305");
    assertThat(definitions.get(1).path("max_uses").asInt()).isEqualTo(5);
    assertThat(registry.find("lookup")).isPresent();
    assertThat(registry.find("web_search")).isEmpty();
  }

  @Test
  void emptyRegistryOffersNoTools() {
    ToolRegistry registry = new ToolRegistry(List.of(), new ServerToolProperties(), objectMapper);

    assertThat(registry.hasTools()).isFalse();
    assertThat(registry.definitions()).isEmpty();
  }

  @Test
  void duplicateNamesAreRejected() {
    assertThatThrownBy(
            () ->
                new ToolRegistry(
                    List.of(tool("lookup"), tool("lookup")),
                    new ServerToolProperties(),
                    objectMapper))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate tool name 'lookup'");
  }

  private ChatTool tool(String name) {
    return new ChatTool() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public String description() {
        return "Looks things up";
      }

      @Override
      public JsonNode inputSchema() {
        return objectMapper.createObjectNode().put("type", "object");
      }

      @Override
      public ToolOutput execute(JsonNode input, ToolContext context) {
        return ToolOutput.text(name);
      }
    };
  }
}
