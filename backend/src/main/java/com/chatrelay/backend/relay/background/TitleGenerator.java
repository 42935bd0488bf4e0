package com.chatrelay.backend.relay.background;

import com.chatrelay.backend.chat.service.ConversationService;
import com.chatrelay.backend.relay.config.RelayProperties;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService.CompletionRequest;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Best-effort conversation titles, generated once the first exchange is stored. */
@Component
public class TitleGenerator {

  private static final Logger log = LoggerFactory.getLogger(TitleGenerator.class);

  private static final int MAX_EXCERPT_CHARS = 2_000;

  private final UpstreamCompletionService completionService;
  private final ConversationService conversationService;
  private final RelayProperties properties;
  private final ExecutorService executor;

  public TitleGenerator(
      UpstreamCompletionService completionService,
      ConversationService conversationService,
      RelayProperties properties,
      @Qualifier("relayBackgroundExecutor") ExecutorService executor) {
    this.completionService = completionService;
    this.conversationService = conversationService;
    this.properties = properties;
    this.executor = executor;
  }

  public CompletableFuture<Void> generateAsync(
      UUID conversationId, String userMessage, String assistantReply) {
    return CompletableFuture.runAsync(
            () -> generate(conversationId, userMessage, assistantReply), executor)
        .exceptionally(
            error -> {
              log.warn("Title generation for conversation {} failed", conversationId, error);
              return null;
            });
  }

  void generate(UUID conversationId, String userMessage, String assistantReply) {
    String prompt =
        "Write a short title (at most eight words) for a conversation that starts as below."
            + " Use the conversation's language. Reply with the title only.\n\nUser: "
            + excerpt(userMessage)
            + "\n\nAssistant: "
            + excerpt(assistantReply);
    Optional<String> title =
        completionService.complete(
            new CompletionRequest(
                "title",
                properties.getTitleModel(),
                null,
                prompt,
                properties.getTitleMaxTokens(),
                properties.getBackgroundTimeout()));
    title
        .map(TitleGenerator::clean)
        .filter(value -> !value.isEmpty())
        .ifPresent(
            value -> {
              conversationService.updateTitle(conversationId, value);
              log.debug("Conversation {} titled '{}'", conversationId, value);
            });
  }

  static String clean(String title) {
    String value = title.strip();
    int newline = value.indexOf('\n');
    if (newline >= 0) {
      value = value.substring(0, newline).strip();
    }
    if (value.length() >= 2
        && (value.startsWith("\"") && value.endsWith("\"")
            || value.startsWith("'") && value.endsWith("'"))) {
      value = value.substring(1, value.length() - 1).strip();
    }
    return value;
  }

  private static String excerpt(String value) {
    if (value == null) {
      return "";
    }
    return value.length() > MAX_EXCERPT_CHARS ? value.substring(0, MAX_EXCERPT_CHARS) : value;
  }
}
