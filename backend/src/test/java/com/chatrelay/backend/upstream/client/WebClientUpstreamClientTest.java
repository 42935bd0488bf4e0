package com.chatrelay.backend.upstream.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatrelay.backend.pool.model.CredentialLease;
import com.chatrelay.backend.upstream.config.UpstreamProperties;
import com.chatrelay.backend.upstream.error.UpstreamStreamException;
import com.chatrelay.backend.upstream.event.UpstreamEvent;
import com.chatrelay.backend.upstream.event.UpstreamEventParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class WebClientUpstreamClientTest {

  private static final CredentialLease LEASE =
      new CredentialLease(1L, "primary", "https://upstream.test", "sk-test", null);

  private final WebClientUpstreamClient client =
      new WebClientUpstreamClient(
          WebClient.create(),
          new UpstreamEventParser(new ObjectMapper()),
          new UpstreamProperties());

  @Test
  void decodesEventsAcrossBufferBoundaries() {
    Flux<DataBuffer> body =
        Flux.just(
            buffer("event: message_start\ndata: {\"type\":\"message_start\",\"message\":{}}\n"),
            buffer("\nevent: content_block_delta\ndata: {\"type\":\"content_block_delta\","),
            buffer("\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hel\"}}\n\n"),
            buffer(": comment\n\nevent: message_stop\ndata: {\"type\":\"message_stop\"}"));

    StepVerifier.create(client.decode(body))
        .assertNext(event -> assertThat(event).isInstanceOf(UpstreamEvent.MessageStart.class))
        .assertNext(
            event ->
                assertThat(((UpstreamEvent.ContentBlockDelta) event).fragment()).isEqualTo("Hel"))
        .assertNext(event -> assertThat(event).isInstanceOf(UpstreamEvent.MessageStop.class))
        .verifyComplete();
  }

  @Test
  void skipsMalformedFrames() {
    Flux<DataBuffer> body =
        Flux.just(buffer("data: {broken\n\ndata: {\"type\":\"ping\"}\n\n"));

    StepVerifier.create(client.decode(body))
        .assertNext(event -> assertThat(event).isInstanceOf(UpstreamEvent.Ping.class))
        .verifyComplete();
  }

  @Test
  void abortingCancelsARequestStillWaitingForHeaders() throws Exception {
    AtomicBoolean cancelled = new AtomicBoolean();
    WebClient silent =
        WebClient.builder()
            .exchangeFunction(
                request -> Mono.<ClientResponse>never().doOnCancel(() -> cancelled.set(true)))
            .build();
    WebClientUpstreamClient hanging =
        new WebClientUpstreamClient(
            silent, new UpstreamEventParser(new ObjectMapper()), new UpstreamProperties());
    AbortSignal signal = new AbortSignal();
    ExecutorService caller = Executors.newSingleThreadExecutor();
    try {
      Future<UpstreamStream> opened =
          caller.submit(
              () -> hanging.openStream(LEASE, new ObjectMapper().createObjectNode(), signal));
      Thread.sleep(200);
      assertThat(opened).isNotDone();

      signal.abort();

      assertThatThrownBy(() -> opened.get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(UpstreamStreamException.class)
          .hasMessageContaining("aborted");
      assertThat(cancelled).isTrue();
    } finally {
      caller.shutdownNow();
    }
  }

  @Test
  void alreadyAbortedSignalFailsWithoutWaiting() {
    WebClient silent = WebClient.builder().exchangeFunction(request -> Mono.never()).build();
    WebClientUpstreamClient hanging =
        new WebClientUpstreamClient(
            silent, new UpstreamEventParser(new ObjectMapper()), new UpstreamProperties());
    AbortSignal signal = new AbortSignal();
    signal.abort();

    assertThatThrownBy(
            () -> hanging.openStream(LEASE, new ObjectMapper().createObjectNode(), signal))
        .isInstanceOf(UpstreamStreamException.class);
  }

  private static DataBuffer buffer(String value) {
    return DefaultDataBufferFactory.sharedInstance.wrap(value.getBytes(StandardCharsets.UTF_8));
  }
}
