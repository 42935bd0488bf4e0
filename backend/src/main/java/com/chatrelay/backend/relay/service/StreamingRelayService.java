package com.chatrelay.backend.relay.service;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.billing.model.UsageCost;
import com.chatrelay.backend.billing.service.BillingCalculator;
import com.chatrelay.backend.chat.domain.ChatMessage;
import com.chatrelay.backend.chat.domain.Conversation;
import com.chatrelay.backend.chat.service.ConversationService;
import com.chatrelay.backend.compaction.service.CompactionResult;
import com.chatrelay.backend.compaction.service.ContextCompactor;
import com.chatrelay.backend.pool.model.CredentialLease;
import com.chatrelay.backend.pool.service.CredentialPool;
import com.chatrelay.backend.quota.model.QuotaDecision;
import com.chatrelay.backend.quota.service.QuotaDeniedException;
import com.chatrelay.backend.quota.service.QuotaEngine;
import com.chatrelay.backend.relay.api.ChatStreamRequest;
import com.chatrelay.backend.relay.assembly.AgingPruner;
import com.chatrelay.backend.relay.assembly.AttachmentPayloadLimiter;
import com.chatrelay.backend.relay.assembly.MessageAssembler;
import com.chatrelay.backend.relay.assembly.SystemPromptProvider;
import com.chatrelay.backend.relay.background.TitleGenerator;
import com.chatrelay.backend.relay.config.RelayProperties;
import com.chatrelay.backend.relay.stream.RelayEventSink;
import com.chatrelay.backend.relay.stream.RelayEvents;
import com.chatrelay.backend.relay.stream.RelayRequest;
import com.chatrelay.backend.relay.stream.RelaySession;
import com.chatrelay.backend.relay.stream.RoundLoop;
import com.chatrelay.backend.relay.stream.RoundOutcome;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point of a chat turn. {@link #open} performs admission synchronously so denials can still
 * be answered with an HTTP status; {@link #start} then runs assembly, the round loop and the
 * session bookkeeping on the relay executor.
 */
@Service
@Slf4j
public class StreamingRelayService {

  private final QuotaEngine quotaEngine;
  private final CredentialPool credentialPool;
  private final ConversationService conversationService;
  private final ContextCompactor contextCompactor;
  private final MessageAssembler messageAssembler;
  private final AgingPruner agingPruner;
  private final AttachmentPayloadLimiter payloadLimiter;
  private final SystemPromptProvider systemPromptProvider;
  private final RoundLoop roundLoop;
  private final RelayEvents events;
  private final BillingCalculator billingCalculator;
  private final TitleGenerator titleGenerator;
  private final RelayProperties properties;
  private final ExecutorService sessionExecutor;
  private final MeterRegistry meterRegistry;

  public StreamingRelayService(
      QuotaEngine quotaEngine,
      CredentialPool credentialPool,
      ConversationService conversationService,
      ContextCompactor contextCompactor,
      MessageAssembler messageAssembler,
      AgingPruner agingPruner,
      AttachmentPayloadLimiter payloadLimiter,
      SystemPromptProvider systemPromptProvider,
      RoundLoop roundLoop,
      RelayEvents events,
      BillingCalculator billingCalculator,
      TitleGenerator titleGenerator,
      RelayProperties properties,
      @Qualifier("relaySessionExecutor") ExecutorService sessionExecutor,
      MeterRegistry meterRegistry) {
    this.quotaEngine = quotaEngine;
    this.credentialPool = credentialPool;
    this.conversationService = conversationService;
    this.contextCompactor = contextCompactor;
    this.messageAssembler = messageAssembler;
    this.agingPruner = agingPruner;
    this.payloadLimiter = payloadLimiter;
    this.systemPromptProvider = systemPromptProvider;
    this.roundLoop = roundLoop;
    this.events = events;
    this.billingCalculator = billingCalculator;
    this.titleGenerator = titleGenerator;
    this.properties = properties;
    this.sessionExecutor = sessionExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Admits the request: conversation ownership, quota, then a credential. The user message is
   * stored only once all three succeeded.
   *
   * @throws QuotaDeniedException when the tenant is out of budget
   * @throws PoolExhaustedException when no credential is available
   */
  public RelaySession open(UUID tenantId, ChatStreamRequest request, RelayEventSink sink) {
    Conversation conversation =
        conversationService.requireConversation(tenantId, request.conversationId());

    QuotaDecision decision = quotaEngine.checkQuota(tenantId);
    if (!decision.allowed()) {
      meterRegistry.counter("relay.sessions", "outcome", "denied").increment();
      throw new QuotaDeniedException(decision);
    }

    Optional<CredentialLease> lease = credentialPool.acquire(conversation.getId().toString());
    if (lease.isEmpty()) {
      meterRegistry.counter("relay.sessions", "outcome", "pool_exhausted").increment();
      throw new PoolExhaustedException();
    }

    ChatMessage userMessage;
    try {
      userMessage =
          conversationService.appendUserMessage(
              conversation, request.message(), request.attachmentIds());
    } catch (RuntimeException ex) {
      credentialPool.release(lease.get().credentialId());
      throw ex;
    }

    String model = resolveModel(request, conversation);
    log.debug(
        "Admitted tenant {} on conversation {} with credential {} and model {}",
        tenantId,
        conversation.getId(),
        lease.get().credentialId(),
        model);
    return new RelaySession(
        tenantId, conversation.getId(), userMessage.getId(), model, lease.get(), sink);
  }

  /** Runs the session on the relay executor. */
  public void start(RelaySession session, boolean thinking) {
    try {
      sessionExecutor.execute(() -> run(session, thinking));
    } catch (RejectedExecutionException ex) {
      log.warn("Relay executor rejected session for conversation {}", session.conversationId());
      session.emit(events.error("overloaded", "The service is busy, try again shortly."));
      complete(session, RoundOutcome.ERROR);
    }
  }

  public boolean resolveThinking(ChatStreamRequest request) {
    return request.thinking() != null ? request.thinking() : properties.isThinkingEnabled();
  }

  void run(RelaySession session, boolean thinking) {
    RoundOutcome outcome = RoundOutcome.ERROR;
    try {
      RelayRequest request = prepare(session, thinking);
      outcome = roundLoop.run(session, request);
    } catch (RuntimeException ex) {
      log.error("Relay session for conversation {} failed", session.conversationId(), ex);
      session.emit(events.error("internal_error", "The request could not be completed."));
    } finally {
      complete(session, outcome);
    }
  }

  RelayRequest prepare(RelaySession session, boolean thinking) {
    compactIfNeeded(session);
    List<ChatMessage> history = conversationService.loadLiveHistory(session.conversationId());
    List<UUID> ids = history.stream().map(ChatMessage::getId).toList();
    ArrayNode messages =
        messageAssembler.assemble(history, conversationService.attachmentsByMessage(ids));
    agingPruner.prune(messages);
    payloadLimiter.limit(messages);
    return new RelayRequest(
        session.model(), systemPromptProvider.systemPrompt(), thinking, messages);
  }

  private void compactIfNeeded(RelaySession session) {
    try {
      CompactionResult result = contextCompactor.checkAndCompact(session.conversationId());
      if (result.compacted()) {
        session.emit(events.compaction(result.messagesCompacted(), result.tokensSaved()));
      }
    } catch (RuntimeException ex) {
      log.warn(
          "Compaction check for conversation {} failed, sending full history",
          session.conversationId(),
          ex);
    }
  }

  /** Session bookkeeping; runs for every outcome, cancellation included. */
  void complete(RelaySession session, RoundOutcome outcome) {
    CredentialLease lease = session.lease();
    TokenUsage usage = session.usage();
    boolean persisted = false;
    try {
      awaitBackgroundTasks(session);
      persisted = persistTurn(session);
    } finally {
      try {
        recordCredentialOutcome(session);
      } finally {
        credentialPool.release(lease.credentialId());
      }
    }
    charge(session, usage);
    if (persisted && outcome == RoundOutcome.END_TURN) {
      maybeGenerateTitle(session);
    }
    session.sink().complete();
    meterRegistry
        .counter("relay.sessions", "outcome", outcome.name().toLowerCase())
        .increment();
    if (outcome == RoundOutcome.ABORTED) {
      log.debug("Session for conversation {} aborted by the client", session.conversationId());
    } else {
      log.info(
          "Session for conversation {} ended with {} after {} rounds, usage {}",
          session.conversationId(),
          outcome,
          session.round(),
          usage);
    }
  }

  private void awaitBackgroundTasks(RelaySession session) {
    List<CompletableFuture<?>> tasks = session.backgroundTasks();
    if (tasks.isEmpty()) {
      return;
    }
    try {
      CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]))
          .get(properties.getBackgroundAwait().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      log.debug(
          "Background tasks of conversation {} still running after {}",
          session.conversationId(),
          properties.getBackgroundAwait());
    } catch (ExecutionException ex) {
      log.warn(
          "Background task of conversation {} failed", session.conversationId(), ex.getCause());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private boolean persistTurn(RelaySession session) {
    String text = session.text();
    String thinking = session.thinking();
    if (!StringUtils.hasText(text)
        && !StringUtils.hasText(thinking)
        && !session.usage().hasUsage()) {
      return false;
    }
    try {
      conversationService.completeTurn(
          session.conversationId(), session.userMessageId(), text, thinking, session.usage());
      return true;
    } catch (RuntimeException ex) {
      log.warn("Failed to store assistant turn of conversation {}", session.conversationId(), ex);
      return false;
    }
  }

  private void recordCredentialOutcome(RelaySession session) {
    long credentialId = session.lease().credentialId();
    if (session.credentialError() != null) {
      credentialPool.recordError(credentialId, session.credentialError());
    } else if (session.upstreamSucceeded()) {
      credentialPool.recordSuccess(credentialId, session.usage());
    }
  }

  private void charge(RelaySession session, TokenUsage usage) {
    if (!usage.hasUsage()) {
      return;
    }
    try {
      UsageCost cost =
          billingCalculator.calculate(session.model(), usage, session.lease().groupMultiplier());
      long units = quotaEngine.recordUsage(session.tenantId(), cost.totalCost());
      credentialPool.recordCost(session.lease().credentialId(), units);
      log.debug(
          "Charged tenant {} {} units ({} USD) for conversation {}",
          session.tenantId(),
          units,
          cost.totalCost(),
          session.conversationId());
    } catch (RuntimeException ex) {
      log.error(
          "Failed to charge tenant {} for conversation {} (usage {})",
          session.tenantId(),
          session.conversationId(),
          usage,
          ex);
    }
  }

  private void maybeGenerateTitle(RelaySession session) {
    try {
      if (conversationService.countMessages(session.conversationId()) == 2) {
        List<ChatMessage> history =
            conversationService.loadLiveHistory(session.conversationId());
        String firstUserMessage = history.isEmpty() ? "" : history.get(0).getContent();
        titleGenerator.generateAsync(session.conversationId(), firstUserMessage, session.text());
      }
    } catch (RuntimeException ex) {
      log.warn("Could not schedule title for conversation {}", session.conversationId(), ex);
    }
  }

  private String resolveModel(ChatStreamRequest request, Conversation conversation) {
    if (StringUtils.hasText(request.model())) {
      return request.model().strip();
    }
    if (StringUtils.hasText(conversation.getModel())) {
      return conversation.getModel();
    }
    return properties.getDefaultModel();
  }
}
