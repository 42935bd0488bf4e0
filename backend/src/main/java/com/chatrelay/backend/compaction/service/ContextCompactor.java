package com.chatrelay.backend.compaction.service;

import com.chatrelay.backend.chat.domain.ChatMessage;
import com.chatrelay.backend.chat.domain.ChatRole;
import com.chatrelay.backend.chat.service.ConversationService;
import com.chatrelay.backend.compaction.config.ContextProperties;
import com.chatrelay.backend.compaction.token.TokenEstimator;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService.CompletionRequest;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Keeps a conversation's live history under the context budget by folding its oldest messages
 * into one summary message. The most recent {@code keepRounds} rounds are never compacted.
 */
@Service
@Slf4j
public class ContextCompactor {

  private static final String TRUNCATION_MARKER = "...[truncated]";

  private final ConversationService conversationService;
  private final UpstreamCompletionService completionService;
  private final TokenEstimator tokenEstimator;
  private final ContextProperties properties;
  private final MeterRegistry meterRegistry;

  public ContextCompactor(
      ConversationService conversationService,
      UpstreamCompletionService completionService,
      TokenEstimator tokenEstimator,
      ContextProperties properties,
      MeterRegistry meterRegistry) {
    this.conversationService = Objects.requireNonNull(conversationService, "conversationService");
    this.completionService = Objects.requireNonNull(completionService, "completionService");
    this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
  }

  public CompactionResult checkAndCompact(UUID conversationId) {
    List<ChatMessage> live = conversationService.loadLiveHistory(conversationId);
    long tokens = tokenLoad(live);
    long trigger = properties.compactionTriggerTokens();
    log.debug(
        "Conversation {} holds {} tokens in {} live messages, trigger at {}",
        conversationId,
        tokens,
        live.size(),
        trigger);
    if (tokens < trigger) {
      return CompactionResult.skipped(tokens, null);
    }
    return compact(conversationId, live, tokens, properties.getCompactionInstruction());
  }

  /** Compacts regardless of the current token load. */
  public CompactionResult manualCompact(UUID conversationId, String extraInstruction) {
    List<ChatMessage> live = conversationService.loadLiveHistory(conversationId);
    String instruction = properties.getCompactionInstruction();
    if (StringUtils.hasText(extraInstruction)) {
      instruction = instruction + "\n\nAdditional instruction: " + extraInstruction.strip();
    }
    return compact(conversationId, live, tokenLoad(live), instruction);
  }

  /**
   * Recorded usage where present, the text estimate for messages without any (e.g. older rows).
   */
  public long tokenLoad(List<ChatMessage> messages) {
    long total = 0;
    for (ChatMessage message : messages) {
      long recorded = message.recordedTokens();
      total += recorded > 0 ? recorded : tokenEstimator.estimate(message.getContent());
    }
    return total;
  }

  private CompactionResult compact(
      UUID conversationId, List<ChatMessage> live, long tokensBefore, String instruction) {
    int keep = properties.getKeepRounds() * 2;
    if (live.size() <= keep) {
      return CompactionResult.skipped(tokensBefore, "Not enough messages to compact");
    }
    List<ChatMessage> toCompact = live.subList(0, live.size() - keep);
    ChatMessage last = toCompact.get(toCompact.size() - 1);

    String prompt = instruction + "\n\n---\n\n" + renderTranscript(toCompact);
    Optional<String> summary =
        completionService.complete(
            new CompletionRequest(
                "compaction",
                properties.getCompactionModel(),
                null,
                prompt,
                properties.getSummaryMaxTokens(),
                properties.getSummaryTimeout()));
    if (summary.isEmpty()) {
      meterRegistry.counter("context.compaction.runs", "result", "failed").increment();
      log.warn(
          "Compaction of conversation {} failed, continuing with full history", conversationId);
      return CompactionResult.skipped(tokensBefore, "Summary generation failed");
    }

    long compactedTokens = tokenLoad(toCompact);
    long summaryTokens = tokenEstimator.estimate(summary.get());
    long saved = Math.max(0, compactedTokens - summaryTokens);
    List<UUID> ids = toCompact.stream().map(ChatMessage::getId).toList();
    conversationService.applyCompaction(
        conversationId, ids, summary.get(), last.getSequenceNumber(), last.getCreatedAt());

    meterRegistry.counter("context.compaction.runs", "result", "compacted").increment();
    log.info(
        "Compacted {} messages of conversation {}, saved ~{} tokens",
        ids.size(),
        conversationId,
        saved);
    return CompactionResult.performed(ids.size(), tokensBefore, saved);
  }

  String renderTranscript(List<ChatMessage> messages) {
    int limit = properties.getTranscriptMessageLimit();
    StringBuilder transcript = new StringBuilder();
    for (ChatMessage message : messages) {
      String content = message.getContent() != null ? message.getContent() : "";
      if (content.length() > limit) {
        content = content.substring(0, limit) + TRUNCATION_MARKER;
      }
      String role =
          message.isSummary()
              ? "Summary"
              : message.getRole() == ChatRole.USER ? "User" : "Assistant";
      transcript.append('[').append(role).append("]: ").append(content).append("\n\n");
    }
    return transcript.toString();
  }
}
