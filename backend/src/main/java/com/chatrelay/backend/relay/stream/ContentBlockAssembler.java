package com.chatrelay.backend.relay.stream;

import com.chatrelay.backend.relay.tool.ToolCall;
import com.chatrelay.backend.upstream.event.UpstreamEvent.ContentBlockDelta;
import com.chatrelay.backend.upstream.event.UpstreamEvent.ContentBlockStart;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Rebuilds the assistant content blocks of one round from their start/delta/stop events. Tool
 * arguments arrive as JSON fragments and are only parsed once the block has closed.
 */
public class ContentBlockAssembler {

  private static final Logger log = LoggerFactory.getLogger(ContentBlockAssembler.class);

  static final String TEXT = "text";
  static final String THINKING = "thinking";
  static final String TOOL_USE = "tool_use";
  static final String SERVER_TOOL_USE = "server_tool_use";

  private final ObjectMapper objectMapper;
  private final Map<Integer, OpenBlock> open = new TreeMap<>();
  private final Map<Integer, ObjectNode> completed = new TreeMap<>();
  private final List<ToolCall> toolCalls = new ArrayList<>();

  public ContentBlockAssembler(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public void onStart(ContentBlockStart start) {
    OpenBlock block = new OpenBlock(start.blockType(), start.block());
    block.toolUseId = start.toolUseId();
    block.toolName = start.toolName();
    if (start.block() != null) {
      block.text.append(start.block().path(TEXT).asText(""));
      block.thinking.append(start.block().path(THINKING).asText(""));
    }
    open.put(start.index(), block);
  }

  public void onDelta(ContentBlockDelta delta) {
    OpenBlock block = open.get(delta.index());
    if (block == null) {
      log.debug("Delta for unknown content block {}", delta.index());
      return;
    }
    String fragment = delta.fragment() != null ? delta.fragment() : "";
    switch (String.valueOf(delta.deltaType())) {
      case "text_delta" -> block.text.append(fragment);
      case "thinking_delta" -> block.thinking.append(fragment);
      case "signature_delta" -> block.signature.append(fragment);
      case "input_json_delta" -> block.partialJson.append(fragment);
      default -> log.debug("Ignoring delta type {}", delta.deltaType());
    }
  }

  /** Closes the block at {@code index}; returns the finished block, if the index was open. */
  public Optional<ObjectNode> onStop(int index) {
    OpenBlock block = open.remove(index);
    if (block == null) {
      return Optional.empty();
    }
    ObjectNode finished = finish(block);
    completed.put(index, finished);
    if (TOOL_USE.equals(block.type)) {
      toolCalls.add(new ToolCall(block.toolUseId, block.toolName, finished.get("input")));
    }
    return Optional.of(finished);
  }

  public boolean isType(int index, String type) {
    OpenBlock block = open.get(index);
    return block != null && type.equals(block.type);
  }

  public List<ObjectNode> completedBlocks() {
    return new ArrayList<>(completed.values());
  }

  public List<ToolCall> toolCalls() {
    return List.copyOf(toolCalls);
  }

  private ObjectNode finish(OpenBlock block) {
    ObjectNode node = objectMapper.createObjectNode();
    String type = block.type != null ? block.type : "unknown";
    switch (type) {
      case TEXT -> {
        node.put("type", TEXT);
        node.put(TEXT, block.text.toString());
      }
      case THINKING -> {
        node.put("type", THINKING);
        node.put(THINKING, block.thinking.toString());
        node.put("signature", block.signature.toString());
      }
      case TOOL_USE, SERVER_TOOL_USE -> {
        node.put("type", type);
        node.put("id", block.toolUseId);
        node.put("name", block.toolName);
        node.set("input", parseInput(block));
      }
      default -> {
        if (block.start != null && block.start.isObject()) {
          node.setAll((ObjectNode) block.start.deepCopy());
        } else {
          node.put("type", type);
        }
      }
    }
    return node;
  }

  private JsonNode parseInput(OpenBlock block) {
    String json = block.partialJson.toString();
    if (!StringUtils.hasText(json)) {
      JsonNode initial = block.start != null ? block.start.get("input") : null;
      return initial != null && initial.isObject()
          ? initial.deepCopy()
          : objectMapper.createObjectNode();
    }
    try {
      JsonNode parsed = objectMapper.readTree(json);
      return parsed != null && parsed.isObject() ? parsed : objectMapper.createObjectNode();
    } catch (JsonProcessingException ex) {
      log.warn(
          "Could not parse arguments of tool '{}' ({} chars): {}",
          block.toolName,
          json.length(),
          ex.getOriginalMessage());
      return objectMapper.createObjectNode();
    }
  }

  private static final class OpenBlock {
    private final String type;
    private final JsonNode start;
    private final StringBuilder text = new StringBuilder();
    private final StringBuilder thinking = new StringBuilder();
    private final StringBuilder signature = new StringBuilder();
    private final StringBuilder partialJson = new StringBuilder();
    private String toolUseId;
    private String toolName;

    private OpenBlock(String type, JsonNode start) {
      this.type = type;
      this.start = start;
    }
  }
}
