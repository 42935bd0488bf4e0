package com.chatrelay.backend.relay.stream;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.pool.model.CredentialLease;
import com.chatrelay.backend.upstream.client.AbortSignal;
import com.chatrelay.backend.upstream.client.UpstreamStream;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one relay session. The round loop owns the accumulators; cancellation and
 * event emission may come from other threads.
 */
public class RelaySession {

  private final UUID tenantId;
  private final UUID conversationId;
  private final UUID userMessageId;
  private final String model;
  private final CredentialLease lease;
  private final RelayEventSink sink;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AbortSignal abortSignal = new AbortSignal();
  private final List<CompletableFuture<?>> backgroundTasks = new ArrayList<>();

  private final StringBuilder text = new StringBuilder();
  private final StringBuilder thinking = new StringBuilder();
  private TokenUsage usage = TokenUsage.EMPTY;
  private int round;
  private int indexOffset;
  private boolean upstreamSucceeded;
  private String credentialError;

  public RelaySession(
      UUID tenantId,
      UUID conversationId,
      UUID userMessageId,
      String model,
      CredentialLease lease,
      RelayEventSink sink) {
    this.tenantId = tenantId;
    this.conversationId = conversationId;
    this.userMessageId = userMessageId;
    this.model = model;
    this.lease = lease;
    this.sink = sink;
  }

  /**
   * Flags the session and aborts the in-flight upstream call, if any, including one still waiting
   * for response headers or sleeping between retries. Idempotent.
   */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      abortSignal.abort();
    }
  }

  /** Signal handed to upstream calls made on behalf of this session. */
  public AbortSignal abortSignal() {
    return abortSignal;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Sends an event to the client; a failed send cancels the session. */
  public boolean emit(JsonNode event) {
    if (isCancelled()) {
      return false;
    }
    if (!sink.send(event)) {
      cancel();
      return false;
    }
    return true;
  }

  /** @return the handle to pass to {@link #detachStream(Runnable)} */
  Runnable attachStream(UpstreamStream stream) {
    Runnable abort = stream::abort;
    abortSignal.register(abort);
    return abort;
  }

  void detachStream(Runnable attached) {
    abortSignal.unregister(attached);
  }

  public void addBackgroundTask(CompletableFuture<?> task) {
    synchronized (backgroundTasks) {
      backgroundTasks.add(task);
    }
  }

  public List<CompletableFuture<?>> backgroundTasks() {
    synchronized (backgroundTasks) {
      return List.copyOf(backgroundTasks);
    }
  }

  public UUID tenantId() {
    return tenantId;
  }

  public UUID conversationId() {
    return conversationId;
  }

  public UUID userMessageId() {
    return userMessageId;
  }

  public String model() {
    return model;
  }

  public CredentialLease lease() {
    return lease;
  }

  public RelayEventSink sink() {
    return sink;
  }

  void appendText(String fragment) {
    text.append(fragment);
  }

  void appendThinking(String fragment) {
    thinking.append(fragment);
  }

  public String text() {
    return text.toString();
  }

  public String thinking() {
    return thinking.toString();
  }

  void addUsage(TokenUsage roundUsage) {
    usage = usage.plus(roundUsage);
  }

  public TokenUsage usage() {
    return usage;
  }

  public int round() {
    return round;
  }

  int nextRound() {
    return ++round;
  }

  int indexOffset() {
    return indexOffset;
  }

  void advanceIndexOffset(int blocks) {
    indexOffset += blocks;
  }

  void markUpstreamSucceeded() {
    upstreamSucceeded = true;
  }

  public boolean upstreamSucceeded() {
    return upstreamSucceeded;
  }

  void blameCredential(String error) {
    credentialError = error;
  }

  /** @return the failure to record against the credential, or {@code null} */
  public String credentialError() {
    return credentialError;
  }
}
