package com.chatrelay.backend.relay.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.chatrelay.backend.chat.domain.AttachmentKind;
import com.chatrelay.backend.chat.domain.ChatMessage;
import com.chatrelay.backend.chat.domain.ChatRole;
import com.chatrelay.backend.chat.domain.Conversation;
import com.chatrelay.backend.chat.domain.MessageAttachment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.StreamSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class MessageAssemblerTest {

  private static final UUID TENANT = UUID.fromString("8d0f4c3e-1f7a-4d52-9a55-0f3a4cf1b001");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final Conversation conversation = new Conversation(TENANT, "claude-opus-4-6");

  @Mock private AttachmentContentResolver attachmentResolver;

  @Test
  void summaryIsSentAsUserContextAndMergedWithTheNextUserTurn() {
    List<ChatMessage> history =
        List.of(
            new ChatMessage(conversation, ChatRole.ASSISTANT, "stray reply", 1),
            ChatMessage.summaryOf(conversation, "We discussed caching.", 2, Instant.EPOCH),
            new ChatMessage(conversation, ChatRole.USER, "And eviction?", 3),
            new ChatMessage(conversation, ChatRole.ASSISTANT, "", 4),
            new ChatMessage(conversation, ChatRole.USER, "Thanks", 5));

    ArrayNode messages = assembler().assemble(history, Map.of());

    assertThat(messages).hasSize(3);
    assertThat(roles(messages)).containsExactly("user", "assistant", "user");
    JsonNode first = messages.get(0).path("content");
    assertThat(first).hasSize(2);
    assertThat(first.get(0).path("text").asText())
        .isEqualTo("<conversation_summary>\nWe discussed caching.\n</conversation_summary>");
    assertThat(first.get(1).path("text").asText()).isEqualTo("And eviction?");
    assertThat(messages.get(1).path("content").get(0).path("text").asText())
        .isEqualTo(MessageAssembler.EMPTY_CONTENT);
  }

  @Test
  void consecutiveUserMessagesAreMerged() {
    List<ChatMessage> history =
        List.of(
            new ChatMessage(conversation, ChatRole.USER, "first", 1),
            new ChatMessage(conversation, ChatRole.USER, "second", 2),
            new ChatMessage(conversation, ChatRole.ASSISTANT, "answer", 3),
            new ChatMessage(conversation, ChatRole.ASSISTANT, "more", 4));

    ArrayNode messages = assembler().assemble(history, Map.of());

    assertThat(roles(messages)).containsExactly("user", "assistant");
    assertThat(messages.get(0).path("content")).hasSize(2);
    assertThat(messages.get(1).path("content").get(1).path("text").asText()).isEqualTo("more");
  }

  @Test
  void attachmentsPrecedeTheMessageText() {
    ChatMessage message = new ChatMessage(conversation, ChatRole.USER, "What is this?", 1);
    UUID messageId = UUID.randomUUID();
    ReflectionTestUtils.setField(message, "id", messageId);
    MessageAttachment attachment =
        new MessageAttachment(
            TENANT, AttachmentKind.IMAGE, "cat.png", "image/png", "a/cat.png", 1200);
    ObjectNode imageBlock = objectMapper.createObjectNode().put("type", "image");
    when(attachmentResolver.resolve(attachment)).thenReturn(imageBlock);

    ArrayNode messages =
        assembler().assemble(List.of(message), Map.of(messageId, List.of(attachment)));

    JsonNode content = messages.get(0).path("content");
    assertThat(content).hasSize(2);
    assertThat(content.get(0).path("type").asText()).isEqualTo("image");
    assertThat(content.get(1).path("text").asText()).isEqualTo("What is this?");
  }

  @Test
  void historyWithoutUserMessagesIsEmpty() {
    List<ChatMessage> history =
        List.of(new ChatMessage(conversation, ChatRole.ASSISTANT, "hello", 1));

    assertThat(assembler().assemble(history, Map.of())).isEmpty();
  }

  private MessageAssembler assembler() {
    return new MessageAssembler(attachmentResolver, objectMapper);
  }

  private static List<String> roles(ArrayNode messages) {
    return StreamSupport.stream(messages.spliterator(), false)
        .map(message -> message.path("role").asText())
        .toList();
  }
}
