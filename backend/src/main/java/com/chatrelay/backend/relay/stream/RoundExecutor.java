package com.chatrelay.backend.relay.stream;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.upstream.client.UpstreamClient;
import com.chatrelay.backend.upstream.client.UpstreamStream;
import com.chatrelay.backend.upstream.error.UpstreamErrorClassifier;
import com.chatrelay.backend.upstream.error.UpstreamStreamException;
import com.chatrelay.backend.upstream.event.UpstreamEvent;
import com.chatrelay.backend.upstream.event.UpstreamEvent.ContentBlockDelta;
import com.chatrelay.backend.upstream.event.UpstreamEvent.ContentBlockStart;
import com.chatrelay.backend.upstream.event.UpstreamEvent.ContentBlockStop;
import com.chatrelay.backend.upstream.event.UpstreamEvent.MessageDelta;
import com.chatrelay.backend.upstream.event.UpstreamEvent.MessageStart;
import com.chatrelay.backend.upstream.event.UpstreamEvent.MessageStop;
import com.chatrelay.backend.upstream.event.UpstreamEvent.StreamError;
import com.chatrelay.backend.upstream.retry.UpstreamRetryTemplateFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one upstream round: opens the stream (with retries), forwards text and thinking as it
 * arrives, and reports how the round ended. Only opening the stream is retried, so output already
 * forwarded to the client is never repeated.
 */
@Component
public class RoundExecutor {

  private static final Logger log = LoggerFactory.getLogger(RoundExecutor.class);

  static final String MISSING_STOP_REASON =
      "The upstream response ended unexpectedly; the reply may be incomplete.";
  static final String MAX_TOKENS_REACHED =
      "The reply reached the output token limit and was cut off.";

  private static final Set<String> CREDENTIAL_STREAM_ERRORS =
      Set.of("overloaded_error", "api_error", "rate_limit_error");

  private final UpstreamClient upstreamClient;
  private final UpstreamRetryTemplateFactory retryTemplateFactory;
  private final UpstreamErrorClassifier errorClassifier;
  private final ThinkingSummaryListener thinkingSummaryListener;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  public RoundExecutor(
      UpstreamClient upstreamClient,
      UpstreamRetryTemplateFactory retryTemplateFactory,
      UpstreamErrorClassifier errorClassifier,
      ThinkingSummaryListener thinkingSummaryListener,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.upstreamClient = upstreamClient;
    this.retryTemplateFactory = retryTemplateFactory;
    this.errorClassifier = errorClassifier;
    this.thinkingSummaryListener = thinkingSummaryListener;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Executes the session's current round. Round usage is added to the session before returning.
   */
  public RoundResult execute(RelaySession session, ObjectNode body) {
    RoundResult result = doExecute(session, body);
    session.addUsage(result.usage());
    meterRegistry
        .counter("relay.rounds", "outcome", result.outcome().name().toLowerCase())
        .increment();
    log.debug(
        "Round {} of conversation {} ended with {} (stop reason {}, usage {})",
        session.round(),
        session.conversationId(),
        result.outcome(),
        result.stopReason(),
        result.usage());
    return result;
  }

  private RoundResult doExecute(RelaySession session, ObjectNode body) {
    if (session.isCancelled()) {
      return RoundResult.aborted();
    }
    UpstreamStream stream;
    try {
      stream =
          retryTemplateFactory
              .create(session.abortSignal())
              .execute(
                  context -> {
                    if (session.isCancelled()) {
                      throw new RelayCancelledException();
                    }
                    return upstreamClient.openStream(
                        session.lease(), body, session.abortSignal());
                  });
    } catch (RelayCancelledException ex) {
      return RoundResult.aborted();
    } catch (RuntimeException ex) {
      if (session.isCancelled()) {
        return RoundResult.aborted();
      }
      String message = errorClassifier.describe(ex);
      log.warn(
          "Upstream request for conversation {} failed on credential {}: {}",
          session.conversationId(),
          session.lease().credentialId(),
          message);
      return RoundResult.failed(message, errorClassifier.blamesCredential(ex));
    }

    Runnable attached = session.attachStream(stream);
    try {
      return consume(session, stream);
    } finally {
      session.detachStream(attached);
      stream.close();
    }
  }

  private RoundResult consume(RelaySession session, UpstreamStream stream) {
    boolean firstRound = session.round() <= 1;
    int offset = session.indexOffset();
    ContentBlockAssembler blocks = new ContentBlockAssembler(objectMapper);
    List<ObjectNode> terminalEvents = new ArrayList<>();
    TokenUsage startUsage = TokenUsage.EMPTY;
    TokenUsage deltaUsage = TokenUsage.EMPTY;
    String stopReason = null;
    String streamError = null;
    boolean blamed = false;
    boolean responded = false;
    int highestIndex = -1;

    try {
      while (!session.isCancelled()) {
        Optional<UpstreamEvent> next = stream.next();
        if (next.isEmpty() || session.isCancelled()) {
          break;
        }
        UpstreamEvent event = next.get();
        if (event instanceof MessageStart start) {
          responded = true;
          startUsage = start.usage();
          if (firstRound) {
            session.emit(start.raw());
          }
        } else if (event instanceof ContentBlockStart start) {
          highestIndex = Math.max(highestIndex, start.index());
          blocks.onStart(start);
          session.emit(reindex(start.raw(), offset + start.index()));
        } else if (event instanceof ContentBlockDelta delta) {
          boolean toolArguments = blocks.isType(delta.index(), ContentBlockAssembler.TOOL_USE);
          blocks.onDelta(delta);
          if (!toolArguments) {
            forwardDelta(session, delta, offset);
          }
        } else if (event instanceof ContentBlockStop stop) {
          boolean thinkingBlock = blocks.isType(stop.index(), ContentBlockAssembler.THINKING);
          Optional<ObjectNode> finished = blocks.onStop(stop.index());
          session.emit(reindex(stop.raw(), offset + stop.index()));
          if (thinkingBlock && finished.isPresent()) {
            thinkingSummaryListener.onThinkingBlockClosed(
                session,
                offset + stop.index(),
                finished.get().path(ContentBlockAssembler.THINKING).asText(""));
          }
        } else if (event instanceof MessageDelta delta) {
          if (delta.stopReason() != null) {
            stopReason = delta.stopReason();
          }
          deltaUsage = maxPerField(deltaUsage, delta.usage());
          terminalEvents.add(copy(delta.raw()));
        } else if (event instanceof MessageStop stop) {
          terminalEvents.add(copy(stop.raw()));
        } else if (event instanceof StreamError error) {
          streamError = "Upstream error (" + error.errorType() + "): " + error.message();
          blamed = CREDENTIAL_STREAM_ERRORS.contains(error.errorType());
          break;
        } else {
          log.debug("Skipping upstream event {}", event.type());
        }
      }
    } catch (UpstreamStreamException ex) {
      if (!session.isCancelled()) {
        streamError = errorClassifier.describe(ex);
        blamed = true;
      }
    }

    session.advanceIndexOffset(highestIndex + 1);
    if (responded && streamError == null) {
      session.markUpstreamSucceeded();
    }
    TokenUsage usage = maxPerField(startUsage, deltaUsage);

    RoundOutcome outcome;
    String message = null;
    if (session.isCancelled()) {
      outcome = RoundOutcome.ABORTED;
    } else if (streamError != null) {
      outcome = RoundOutcome.ERROR;
      message = streamError;
      log.warn("Upstream stream for conversation {} failed: {}", session.conversationId(), message);
    } else if (stopReason == null) {
      outcome = RoundOutcome.TRUNCATED;
      message = MISSING_STOP_REASON;
    } else if ("max_tokens".equals(stopReason)) {
      outcome = RoundOutcome.TRUNCATED;
      message = MAX_TOKENS_REACHED;
    } else if ("tool_use".equals(stopReason)) {
      outcome = RoundOutcome.TOOL_USE;
    } else {
      outcome = RoundOutcome.END_TURN;
    }
    return new RoundResult(
        outcome,
        stopReason,
        usage,
        blocks.completedBlocks(),
        blocks.toolCalls(),
        terminalEvents,
        message,
        blamed,
        responded);
  }

  private void forwardDelta(RelaySession session, ContentBlockDelta delta, int offset) {
    boolean sent = session.emit(reindex(delta.raw(), offset + delta.index()));
    if (!sent || delta.fragment() == null) {
      return;
    }
    if ("text_delta".equals(delta.deltaType())) {
      session.appendText(delta.fragment());
    } else if ("thinking_delta".equals(delta.deltaType())) {
      session.appendThinking(delta.fragment());
    }
  }

  private JsonNode reindex(JsonNode raw, int index) {
    ObjectNode node = copy(raw);
    node.put("index", index);
    return node;
  }

  private ObjectNode copy(JsonNode raw) {
    return raw != null && raw.isObject()
        ? ((ObjectNode) raw).deepCopy()
        : objectMapper.createObjectNode();
  }

  /** Streams report usage cumulatively, so the later of two reports wins field by field. */
  static TokenUsage maxPerField(TokenUsage first, TokenUsage second) {
    if (second == null) {
      return first;
    }
    return new TokenUsage(
        Math.max(first.inputTokens(), second.inputTokens()),
        Math.max(first.outputTokens(), second.outputTokens()),
        Math.max(first.cacheCreationTokens(), second.cacheCreationTokens()),
        Math.max(first.cacheReadTokens(), second.cacheReadTokens()));
  }
}
