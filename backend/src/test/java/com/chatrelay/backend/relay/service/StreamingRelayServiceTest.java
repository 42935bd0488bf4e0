package com.chatrelay.backend.relay.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.billing.model.UsageCost;
import com.chatrelay.backend.billing.service.BillingCalculator;
import com.chatrelay.backend.chat.domain.ChatMessage;
import com.chatrelay.backend.chat.domain.ChatRole;
import com.chatrelay.backend.chat.domain.Conversation;
import com.chatrelay.backend.chat.service.ConversationService;
import com.chatrelay.backend.compaction.service.CompactionResult;
import com.chatrelay.backend.compaction.service.ContextCompactor;
import com.chatrelay.backend.pool.model.CredentialLease;
import com.chatrelay.backend.pool.service.CredentialPool;
import com.chatrelay.backend.quota.model.QuotaDecision;
import com.chatrelay.backend.quota.model.QuotaDenialReason;
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
import com.chatrelay.backend.relay.stream.RelaySessionFixtures;
import com.chatrelay.backend.relay.stream.RoundLoop;
import com.chatrelay.backend.relay.stream.RoundOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class StreamingRelayServiceTest {

  private static final UUID TENANT = UUID.fromString("8d0f4c3e-1f7a-4d52-9a55-0f3a4cf1b001");
  private static final UUID CONVERSATION = UUID.fromString("5b6f2f4e-7a55-4d0c-9a0e-2f7f4a3f6c11");
  private static final String MODEL = "claude-opus-4-6";
  private static final CredentialLease LEASE =
      new CredentialLease(1L, "primary", "https://upstream.test", "sk-test", BigDecimal.ONE);

  @Mock private QuotaEngine quotaEngine;
  @Mock private CredentialPool credentialPool;
  @Mock private ConversationService conversationService;
  @Mock private ContextCompactor contextCompactor;
  @Mock private MessageAssembler messageAssembler;
  @Mock private AgingPruner agingPruner;
  @Mock private AttachmentPayloadLimiter payloadLimiter;
  @Mock private SystemPromptProvider systemPromptProvider;
  @Mock private RoundLoop roundLoop;
  @Mock private BillingCalculator billingCalculator;
  @Mock private TitleGenerator titleGenerator;
  @Mock private ExecutorService sessionExecutor;
  @Captor private ArgumentCaptor<RelayRequest> requestCaptor;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private SimpleMeterRegistry meterRegistry;
  private CollectingSink sink;
  private StreamingRelayService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    sink = new CollectingSink();
    service =
        new StreamingRelayService(
            quotaEngine,
            credentialPool,
            conversationService,
            contextCompactor,
            messageAssembler,
            agingPruner,
            payloadLimiter,
            systemPromptProvider,
            roundLoop,
            new RelayEvents(objectMapper),
            billingCalculator,
            titleGenerator,
            new RelayProperties(),
            sessionExecutor,
            meterRegistry);
  }

  @Test
  void quotaDenialStopsBeforeCredentialOrStorage() {
    when(conversationService.requireConversation(TENANT, CONVERSATION))
        .thenReturn(conversation());
    when(quotaEngine.checkQuota(TENANT))
        .thenReturn(
            QuotaDecision.deny(
                QuotaDenialReason.WEEKLY_EXCEEDED, "Weekly budget used up", null, null));

    assertThatThrownBy(() -> service.open(TENANT, request(), sink))
        .isInstanceOf(QuotaDeniedException.class)
        .extracting(error -> ((QuotaDeniedException) error).getDenialReason())
        .isEqualTo(QuotaDenialReason.WEEKLY_EXCEEDED);

    verifyNoInteractions(credentialPool);
    verify(conversationService, never()).appendUserMessage(any(), anyString(), any());
    assertThat(meterRegistry.counter("relay.sessions", "outcome", "denied").count())
        .isEqualTo(1.0);
  }

  @Test
  void exhaustedPoolIsReportedWithoutStoringTheMessage() {
    when(conversationService.requireConversation(TENANT, CONVERSATION))
        .thenReturn(conversation());
    when(quotaEngine.checkQuota(TENANT)).thenReturn(QuotaDecision.allow(null));
    when(credentialPool.acquire(CONVERSATION.toString())).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.open(TENANT, request(), sink))
        .isInstanceOf(PoolExhaustedException.class);

    verify(conversationService, never()).appendUserMessage(any(), anyString(), any());
  }

  @Test
  void admittedRequestStoresUserMessageAndBindsTheLease() {
    Conversation conversation = conversation();
    when(conversationService.requireConversation(TENANT, CONVERSATION)).thenReturn(conversation);
    when(quotaEngine.checkQuota(TENANT)).thenReturn(QuotaDecision.allow(null));
    when(credentialPool.acquire(CONVERSATION.toString())).thenReturn(Optional.of(LEASE));
    ChatMessage userMessage = new ChatMessage(conversation, ChatRole.USER, "Hello", 1);
    UUID userMessageId = UUID.randomUUID();
    ReflectionTestUtils.setField(userMessage, "id", userMessageId);
    when(conversationService.appendUserMessage(conversation, "Hello", List.of()))
        .thenReturn(userMessage);

    RelaySession session = service.open(TENANT, request(), sink);

    assertThat(session.lease()).isEqualTo(LEASE);
    assertThat(session.userMessageId()).isEqualTo(userMessageId);
    assertThat(session.model()).isEqualTo(MODEL);
    assertThat(session.conversationId()).isEqualTo(CONVERSATION);
  }

  @Test
  void leaseIsReleasedWhenStoringTheMessageFails() {
    Conversation conversation = conversation();
    when(conversationService.requireConversation(TENANT, CONVERSATION)).thenReturn(conversation);
    when(quotaEngine.checkQuota(TENANT)).thenReturn(QuotaDecision.allow(null));
    when(credentialPool.acquire(CONVERSATION.toString())).thenReturn(Optional.of(LEASE));
    when(conversationService.appendUserMessage(conversation, "Hello", List.of()))
        .thenThrow(new IllegalStateException("db down"));

    assertThatThrownBy(() -> service.open(TENANT, request(), sink))
        .isInstanceOf(IllegalStateException.class);

    verify(credentialPool).release(1L);
  }

  @Test
  void finishedTurnIsStoredThenCredentialReleasedThenTenantCharged() {
    TokenUsage usage = new TokenUsage(100, 20, 0, 0);
    RelaySession session =
        RelaySessionFixtures.answered(newSession(), "Hi there", "", usage);
    BigDecimal cost = new BigDecimal("0.0050");
    when(billingCalculator.calculate(MODEL, usage, BigDecimal.ONE))
        .thenReturn(
            new UsageCost(
                cost, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ONE, cost));
    when(quotaEngine.recordUsage(TENANT, cost)).thenReturn(50L);
    when(conversationService.countMessages(CONVERSATION)).thenReturn(2L);
    when(conversationService.loadLiveHistory(CONVERSATION))
        .thenReturn(List.of(new ChatMessage(conversation(), ChatRole.USER, "Hello", 1)));

    service.complete(session, RoundOutcome.END_TURN);

    InOrder order = inOrder(conversationService, credentialPool, quotaEngine);
    order
        .verify(conversationService)
        .completeTurn(CONVERSATION, session.userMessageId(), "Hi there", "", usage);
    order.verify(credentialPool).recordSuccess(1L, usage);
    order.verify(credentialPool).release(1L);
    order.verify(quotaEngine).recordUsage(TENANT, cost);
    verify(credentialPool).recordCost(1L, 50L);
    verify(titleGenerator).generateAsync(CONVERSATION, "Hello", "Hi there");
    assertThat(sink.completed).isTrue();
    assertThat(meterRegistry.counter("relay.sessions", "outcome", "end_turn").count())
        .isEqualTo(1.0);
  }

  @Test
  void truncatedTurnIsStoredButNotTitled() {
    TokenUsage usage = new TokenUsage(10, 64_000, 0, 0);
    RelaySession session = RelaySessionFixtures.answered(newSession(), "Long", "", usage);
    when(billingCalculator.calculate(eq(MODEL), eq(usage), any())).thenReturn(UsageCost.zero());

    service.complete(session, RoundOutcome.TRUNCATED);

    verify(conversationService).completeTurn(any(), any(), eq("Long"), any(), eq(usage));
    verify(conversationService, never()).countMessages(any());
    verifyNoInteractions(titleGenerator);
  }

  @Test
  void emptyAbortedTurnIsNeitherStoredNorCharged() {
    RelaySession session = newSession();
    session.cancel();

    service.complete(session, RoundOutcome.ABORTED);

    verify(conversationService, never()).completeTurn(any(), any(), any(), any(), any());
    verify(credentialPool, never()).recordSuccess(anyLong(), any());
    verify(credentialPool).release(1L);
    verifyNoInteractions(quotaEngine, billingCalculator, titleGenerator);
    assertThat(sink.completed).isTrue();
  }

  @Test
  void blamedCredentialIsRecordedAsError() {
    RelaySession session = RelaySessionFixtures.failed(newSession(), "Upstream error 529");

    service.complete(session, RoundOutcome.ERROR);

    verify(credentialPool).recordError(1L, "Upstream error 529");
    verify(credentialPool, never()).recordSuccess(anyLong(), any());
    verify(credentialPool).release(1L);
  }

  @Test
  void unexpectedFailureIsReportedAndStillCompletesTheSession() {
    stubHistory();
    when(contextCompactor.checkAndCompact(CONVERSATION))
        .thenReturn(CompactionResult.skipped(1_000, "below threshold"));
    when(roundLoop.run(any(), any())).thenThrow(new IllegalStateException("bug"));
    RelaySession session = newSession();

    service.run(session, false);

    assertThat(sink.errorTypes()).containsExactly("internal_error");
    verify(credentialPool).release(1L);
    assertThat(sink.completed).isTrue();
    assertThat(meterRegistry.counter("relay.sessions", "outcome", "error").count())
        .isEqualTo(1.0);
  }

  @Test
  void compactionIsAnnouncedBeforeTheHistoryIsAssembled() {
    stubHistory();
    when(contextCompactor.checkAndCompact(CONVERSATION))
        .thenReturn(CompactionResult.performed(6, 170_000, 120_000));
    when(roundLoop.run(any(), requestCaptor.capture())).thenReturn(RoundOutcome.ABORTED);

    service.run(newSession(), true);

    JsonNode event = sink.events.get(0);
    assertThat(event.path("subtype").asText()).isEqualTo("compaction");
    assertThat(event.path("messagesCompacted").asInt()).isEqualTo(6);
    assertThat(event.path("tokensSaved").asLong()).isEqualTo(120_000);
    RelayRequest request = requestCaptor.getValue();
    assertThat(request.systemPrompt()).isEqualTo("You are helpful.");
    assertThat(request.thinking()).isTrue();
    verify(agingPruner).prune(request.messages());
    verify(payloadLimiter).limit(request.messages());
  }

  @Test
  void failedCompactionFallsBackToFullHistory() {
    stubHistory();
    when(contextCompactor.checkAndCompact(CONVERSATION))
        .thenThrow(new IllegalStateException("summary model down"));
    when(roundLoop.run(any(), any())).thenReturn(RoundOutcome.END_TURN);

    service.run(newSession(), false);

    assertThat(sink.events).isEmpty();
    verify(roundLoop).run(any(), any());
  }

  @Test
  void rejectedSessionIsAnsweredWithOverloadedError() {
    doThrow(new RejectedExecutionException("full")).when(sessionExecutor).execute(any());

    service.start(newSession(), false);

    assertThat(sink.errorTypes()).containsExactly("overloaded");
    verify(credentialPool).release(1L);
    assertThat(sink.completed).isTrue();
  }

  private void stubHistory() {
    when(conversationService.loadLiveHistory(CONVERSATION)).thenReturn(List.of());
    when(conversationService.attachmentsByMessage(any())).thenReturn(Map.of());
    when(messageAssembler.assemble(any(), any())).thenReturn(objectMapper.createArrayNode());
    when(systemPromptProvider.systemPrompt()).thenReturn("You are helpful.");
  }

  private RelaySession newSession() {
    return new RelaySession(TENANT, CONVERSATION, UUID.randomUUID(), MODEL, LEASE, sink);
  }

  private static ChatStreamRequest request() {
    return new ChatStreamRequest(CONVERSATION, "Hello", null, null, null);
  }

  private static Conversation conversation() {
    Conversation conversation = new Conversation(TENANT, MODEL);
    ReflectionTestUtils.setField(conversation, "id", CONVERSATION);
    return conversation;
  }

  private static final class CollectingSink implements RelayEventSink {

    private final List<JsonNode> events = new ArrayList<>();
    private boolean completed;

    @Override
    public synchronized boolean send(JsonNode event) {
      events.add(event);
      return true;
    }

    @Override
    public synchronized void complete() {
      completed = true;
    }

    List<String> errorTypes() {
      return events.stream()
          .filter(event -> "error".equals(event.path("type").asText()))
          .map(event -> event.path("error").path("type").asText())
          .toList();
    }
  }
}
