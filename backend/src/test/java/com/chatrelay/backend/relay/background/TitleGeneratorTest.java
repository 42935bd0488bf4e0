package com.chatrelay.backend.relay.background;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.chatrelay.backend.chat.service.ConversationService;
import com.chatrelay.backend.relay.config.RelayProperties;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService;
import com.chatrelay.backend.upstream.service.UpstreamCompletionService.CompletionRequest;
import java.util.Optional;
import java.util.UUID;
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
class TitleGeneratorTest {

  private static final UUID CONVERSATION = UUID.fromString("5b6f2f4e-7a55-4d0c-9a0e-2f7f4a3f6c11");

  @Mock private UpstreamCompletionService completionService;
  @Mock private ConversationService conversationService;
  @Captor private ArgumentCaptor<CompletionRequest> requestCaptor;

  private ExecutorService executor;
  private TitleGenerator generator;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadExecutor();
    generator =
        new TitleGenerator(completionService, conversationService, new RelayProperties(), executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void generatedTitleIsCleanedAndStored() throws Exception {
    when(completionService.complete(requestCaptor.capture()))
        .thenReturn(Optional.of("\"Caching strategies\"\nExtra line"));

    generator
        .generateAsync(CONVERSATION, "How do I cache?", "Use Caffeine.")
        .get(5, TimeUnit.SECONDS);

    verify(conversationService).updateTitle(CONVERSATION, "Caching strategies");
    CompletionRequest request = requestCaptor.getValue();
    assertThat(request.purpose()).isEqualTo("title");
    assertThat(request.model()).isEqualTo("claude-haiku-4-5-20251001");
    assertThat(request.prompt())
        .contains("User: How do I cache?")
        .contains("Assistant: Use Caffeine.");
  }

  @Test
  void missingReplyLeavesTitleUntouched() throws Exception {
    when(completionService.complete(any())).thenReturn(Optional.empty());

    generator.generateAsync(CONVERSATION, "Hi", "Hello").get(5, TimeUnit.SECONDS);

    verify(conversationService, never()).updateTitle(any(), anyString());
  }

  @Test
  void failuresAreContainedInTheFuture() throws Exception {
    when(completionService.complete(any())).thenThrow(new IllegalStateException("boom"));

    generator.generateAsync(CONVERSATION, "Hi", "Hello").get(5, TimeUnit.SECONDS);

    verify(conversationService, never()).updateTitle(any(), anyString());
  }

  @Test
  void cleanStripsQuotesAndExtraLines() {
    assertThat(TitleGenerator.clean("  'Trip planning'  ")).isEqualTo("Trip planning");
    assertThat(TitleGenerator.clean("Budget review\nwith notes")).isEqualTo("Budget review");
    assertThat(TitleGenerator.clean("\"")).isEqualTo("\"");
    assertThat(TitleGenerator.clean("\"\"")).isEmpty();
  }
}
