package com.chatrelay.backend.relay.assembly;

import com.chatrelay.backend.compaction.config.ContextProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Shrinks old turns of an assembled request. Messages older than {@code pruningAgeRounds} rounds
 * lose their inline images and keep only the head of long fenced code blocks.
 */
@Component
public class AgingPruner {

  static final String IMAGE_PLACEHOLDER = "[Image omitted from older context]";
  static final String CODE_TRUNCATION_MARKER = "\n... [code truncated] ...\n```";

  private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```");

  private final ContextProperties properties;

  public AgingPruner(ContextProperties properties) {
    this.properties = properties;
  }

  /** Prunes {@code messages} in place. */
  public void prune(ArrayNode messages) {
    int pruneEnd = messages.size() - properties.getPruningAgeRounds() * 2;
    for (int i = 0; i < pruneEnd; i++) {
      JsonNode content = messages.get(i).get("content");
      if (content == null) {
        continue;
      }
      if (content.isTextual()) {
        ((ObjectNode) messages.get(i)).put("content", pruneCodeBlocks(content.asText()));
        continue;
      }
      if (!content.isArray()) {
        continue;
      }
      ArrayNode blocks = (ArrayNode) content;
      for (int j = 0; j < blocks.size(); j++) {
        JsonNode block = blocks.get(j);
        if ("image".equals(block.path("type").asText())) {
          ObjectNode placeholder = blocks.objectNode();
          placeholder.put("type", "text");
          placeholder.put("text", IMAGE_PLACEHOLDER);
          blocks.set(j, placeholder);
        } else if ("text".equals(block.path("type").asText()) && block.isObject()) {
          ((ObjectNode) block).put("text", pruneCodeBlocks(block.path("text").asText("")));
        }
      }
    }
  }

  String pruneCodeBlocks(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    int limit = properties.getPruningCodeBlockLimit();
    Matcher matcher = CODE_BLOCK.matcher(text);
    StringBuilder result = new StringBuilder(text.length());
    while (matcher.find()) {
      String block = matcher.group();
      String replacement = block;
      if (block.length() > limit) {
        int keep = (int) Math.floor(block.length() * properties.getPruningKeepRatio());
        replacement = block.substring(0, keep) + CODE_TRUNCATION_MARKER;
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  static boolean isInlineImage(JsonNode block) {
    return block != null
        && "image".equals(block.path("type").asText())
        && "base64".equals(block.path("source").path("type").asText());
  }
}
