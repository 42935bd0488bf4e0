package com.chatrelay.backend.relay.background;

import com.chatrelay.backend.relay.config.RelayProperties;
import com.chatrelay.backend.relay.stream.RelayEvents;
import com.chatrelay.backend.relay.stream.RelaySession;
import com.chatrelay.backend.relay.stream.ThinkingSummaryListener;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService.CompletionRequest;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Asks a small model for a one-sentence summary of each closed thinking block and sends it to the
 * client as {@code thinking_summary}. Runs beside the main stream and never delays it.
 */
@Component
public class ThinkingSummaryTask implements ThinkingSummaryListener {

  private static final Logger log = LoggerFactory.getLogger(ThinkingSummaryTask.class);

  private static final int MAX_INPUT_CHARS = 8_000;
  static final String INSTRUCTION =
      "Summarise the following reasoning in one short sentence, written in the language the"
          + " reasoning uses. Reply with the sentence only.\n\n";

  private final UpstreamCompletionService completionService;
  private final RelayEvents events;
  private final RelayProperties properties;
  private final ExecutorService executor;

  public ThinkingSummaryTask(
      UpstreamCompletionService completionService,
      RelayEvents events,
      RelayProperties properties,
      @Qualifier("relayBackgroundExecutor") ExecutorService executor) {
    this.completionService = completionService;
    this.events = events;
    this.properties = properties;
    this.executor = executor;
  }

  @Override
  public void onThinkingBlockClosed(RelaySession session, int blockIndex, String thinking) {
    if (thinking == null || thinking.strip().length() < properties.getThinkingSummaryMinLength()) {
      return;
    }
    String input =
        thinking.length() > MAX_INPUT_CHARS
            ? thinking.substring(thinking.length() - MAX_INPUT_CHARS)
            : thinking;
    CompletionRequest request =
        new CompletionRequest(
            "thinking-summary",
            properties.getThinkingSummaryModel(),
            null,
            INSTRUCTION + input,
            properties.getThinkingSummaryMaxTokens(),
            properties.getBackgroundTimeout());
    try {
      CompletableFuture<Void> task =
          CompletableFuture.runAsync(
              () ->
                  completionService
                      .complete(request)
                      .ifPresent(
                          summary -> session.emit(events.thinkingSummary(blockIndex, summary))),
              executor);
      session.addBackgroundTask(task);
    } catch (RejectedExecutionException ex) {
      log.warn(
          "Thinking summary for conversation {} skipped: executor saturated",
          session.conversationId());
    }
  }
}
