package com.chatrelay.backend.relay.assembly;

import com.chatrelay.backend.chat.domain.ChatMessage;
import com.chatrelay.backend.chat.domain.ChatRole;
import com.chatrelay.backend.chat.domain.MessageAttachment;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Converts stored history into the upstream {@code messages} array. Summary records are sent as
 * user context, consecutive messages of the same role are merged, and the array always starts
 * with a user message.
 */
@Component
public class MessageAssembler {

  static final String EMPTY_CONTENT = "(empty)";

  private final AttachmentContentResolver attachmentResolver;
  private final ObjectMapper objectMapper;

  public MessageAssembler(AttachmentContentResolver attachmentResolver, ObjectMapper objectMapper) {
    this.attachmentResolver = attachmentResolver;
    this.objectMapper = objectMapper;
  }

  public ArrayNode assemble(
      List<ChatMessage> history, Map<UUID, List<MessageAttachment>> attachmentsByMessage) {
    ArrayNode messages = objectMapper.createArrayNode();
    ObjectNode previous = null;
    for (ChatMessage message : history) {
      String role = message.isSummary() ? ChatRole.USER.wireName() : message.getRole().wireName();
      if (previous == null && !ChatRole.USER.wireName().equals(role)) {
        continue;
      }
      ArrayNode content = objectMapper.createArrayNode();
      List<MessageAttachment> attachments =
          message.getId() != null ? attachmentsByMessage.get(message.getId()) : null;
      if (attachments != null) {
        attachments.forEach(attachment -> content.add(attachmentResolver.resolve(attachment)));
      }
      String text = message.isSummary() ? wrapSummary(message.getContent()) : message.getContent();
      if (StringUtils.hasText(text)) {
        content.addObject().put("type", "text").put("text", text);
      }

      if (previous != null && role.equals(previous.path("role").asText())) {
        ((ArrayNode) previous.get("content")).addAll(content);
        continue;
      }
      ObjectNode entry = messages.addObject();
      entry.put("role", role);
      entry.set("content", content);
      previous = entry;
    }
    messages.forEach(
        message -> {
          ArrayNode content = (ArrayNode) message.get("content");
          if (content.isEmpty()) {
            content.addObject().put("type", "text").put("text", EMPTY_CONTENT);
          }
        });
    return messages;
  }

  static String wrapSummary(String summary) {
    return "<conversation_summary>\n"
        + (summary != null ? summary : "")
        + "\n</conversation_summary>";
  }
}
