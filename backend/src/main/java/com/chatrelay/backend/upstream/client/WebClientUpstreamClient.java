package com.chatrelay.backend.upstream.client;

import com.chatrelay.backend.pool.model.CredentialLease;
import com.chatrelay.backend.upstream.config.UpstreamProperties;
import com.chatrelay.backend.upstream.error.UpstreamHttpException;
import com.chatrelay.backend.upstream.error.UpstreamStreamException;
import com.chatrelay.backend.upstream.event.UpstreamEvent;
import com.chatrelay.backend.upstream.event.UpstreamEventParser;
import com.chatrelay.backend.upstream.sse.SseFrameDecoder;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class WebClientUpstreamClient implements UpstreamClient {

  private static final String API_KEY_HEADER = "x-api-key";
  private static final String VERSION_HEADER = "anthropic-version";

  private final WebClient webClient;
  private final UpstreamEventParser eventParser;
  private final UpstreamProperties properties;

  public WebClientUpstreamClient(
      WebClient webClient, UpstreamEventParser eventParser, UpstreamProperties properties) {
    this.webClient = webClient;
    this.eventParser = eventParser;
    this.properties = properties;
  }

  @Override
  public UpstreamStream openStream(
      CredentialLease lease, JsonNode body, AbortSignal abortSignal) {
    CompletableFuture<ResponseEntity<Flux<DataBuffer>>> pending =
        webClient
            .post()
            .uri(messagesUri(lease))
            .headers(headers -> applyCredential(headers, lease))
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, this::toHttpException)
            .toEntityFlux(DataBuffer.class)
            .timeout(properties.getResponseTimeout())
            .onErrorMap(
                TimeoutException.class,
                ex -> new UpstreamStreamException("Timed out waiting for upstream response", ex))
            .toFuture();
    Runnable cancel = () -> pending.cancel(true);
    abortSignal.register(cancel);
    ResponseEntity<Flux<DataBuffer>> response;
    try {
      response = pending.get();
    } catch (CancellationException ex) {
      throw new UpstreamStreamException("Upstream request aborted", ex);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new UpstreamStreamException("Upstream request failed", ex.getCause());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      pending.cancel(true);
      throw new UpstreamStreamException("Interrupted waiting for upstream response", ex);
    } finally {
      abortSignal.unregister(cancel);
    }
    Flux<DataBuffer> bodyFlux =
        response != null && response.getBody() != null ? response.getBody() : Flux.empty();
    return new QueueingUpstreamStream(decode(bodyFlux));
  }

  @Override
  public JsonNode complete(CredentialLease lease, JsonNode body, Duration timeout) {
    return webClient
        .post()
        .uri(messagesUri(lease))
        .headers(headers -> applyCredential(headers, lease))
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .bodyValue(body)
        .retrieve()
        .onStatus(HttpStatusCode::isError, this::toHttpException)
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .onErrorMap(
            TimeoutException.class,
            ex -> new UpstreamStreamException("Upstream completion timed out after " + timeout, ex))
        .block();
  }

  Flux<UpstreamEvent> decode(Flux<DataBuffer> body) {
    return Flux.defer(
        () -> {
          SseFrameDecoder decoder = new SseFrameDecoder();
          return body.timeout(properties.getIdleTimeout())
              .onErrorMap(
                  TimeoutException.class,
                  ex -> new UpstreamStreamException("Upstream stream went idle", ex))
              .concatMapIterable(buffer -> decoder.feed(readAndRelease(buffer)))
              .concatWith(Flux.defer(() -> Flux.fromIterable(decoder.finish())))
              .concatMapIterable(frame -> eventParser.parse(frame).map(List::of).orElse(List.of()));
        });
  }

  private Mono<UpstreamHttpException> toHttpException(ClientResponse response) {
    int status = response.statusCode().value();
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(responseBody -> new UpstreamHttpException(status, responseBody));
  }

  private void applyCredential(HttpHeaders headers, CredentialLease lease) {
    headers.set(API_KEY_HEADER, lease.apiKey());
    headers.setBearerAuth(lease.apiKey());
    headers.set(VERSION_HEADER, properties.getProtocolVersion());
  }

  private String messagesUri(CredentialLease lease) {
    String base = lease.baseUrl();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + properties.getMessagesPath();
  }

  private static byte[] readAndRelease(DataBuffer buffer) {
    try {
      byte[] bytes = new byte[buffer.readableByteCount()];
      buffer.read(bytes);
      return bytes;
    } finally {
      DataBufferUtils.release(buffer);
    }
  }
}
