package com.chatrelay.backend.relay.background;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.chatrelay.backend.pool.model.CredentialLease;
import com.chatrelay.backend.relay.config.RelayProperties;
import com.chatrelay.backend.relay.stream.RelayEventSink;
import com.chatrelay.backend.relay.stream.RelayEvents;
import com.chatrelay.backend.relay.stream.RelaySession;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService.CompletionRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ThinkingSummaryTaskTest {

  @Mock private UpstreamCompletionService completionService;
  @Captor private ArgumentCaptor<CompletionRequest> requestCaptor;

  private final List<JsonNode> sent = new CopyOnWriteArrayList<>();
  private ExecutorService executor;
  private ThinkingSummaryTask task;
  private RelaySession session;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadExecutor();
    task =
        new ThinkingSummaryTask(
            completionService,
            new RelayEvents(new ObjectMapper()),
            new RelayProperties(),
            executor);
    RelayEventSink sink =
        new RelayEventSink() {
          @Override
          public boolean send(JsonNode event) {
            sent.add(event);
            return true;
          }

          @Override
          public void complete() {}
        };
    session =
        new RelaySession(
            UUID.randomUUID(),
            UUID.randomUUID(),
            UUID.randomUUID(),
            "claude-opus-4-6",
            new CredentialLease(1L, "primary", "https://upstream.test", "sk-test", null),
            sink);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void longThinkingIsSummarisedInTheBackground() throws Exception {
    when(completionService.complete(requestCaptor.capture()))
        .thenReturn(Optional.of("Weighing two caching options."));
    String thinking = "Let me compare LRU and LFU eviction. ".repeat(10);

    task.onThinkingBlockClosed(session, 2, thinking);

    List<CompletableFuture<?>> tasks = session.backgroundTasks();
    assertThat(tasks).hasSize(1);
    tasks.get(0).get(5, TimeUnit.SECONDS);
    assertThat(sent).hasSize(1);
    assertThat(sent.get(0).path("type").asText()).isEqualTo("thinking_summary");
    assertThat(sent.get(0).path("index").asInt()).isEqualTo(2);
    assertThat(sent.get(0).path("summary").asText()).isEqualTo("Weighing two caching options.");
    assertThat(requestCaptor.getValue().prompt())
        .startsWith(ThinkingSummaryTask.INSTRUCTION)
        .endsWith(thinking);
  }

  @Test
  void shortThinkingIsNotSummarised() {
    task.onThinkingBlockClosed(session, 0, "Easy.");

    assertThat(session.backgroundTasks()).isEmpty();
    verifyNoInteractions(completionService);
  }

  @Test
  void noSummaryIsSentWhenTheCallFails() throws Exception {
    when(completionService.complete(any()))
        .thenReturn(Optional.empty());

    task.onThinkingBlockClosed(session, 0, "x".repeat(500));

    session.backgroundTasks().get(0).get(5, TimeUnit.SECONDS);
    assertThat(sent).isEmpty();
  }
}
