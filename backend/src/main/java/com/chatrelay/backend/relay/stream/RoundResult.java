package com.chatrelay.backend.relay.stream;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.relay.tool.ToolCall;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * @param contentBlocks completed assistant content blocks, in upstream order
 * @param toolCalls locally executable tool calls among {@code contentBlocks}
 * @param terminalEvents {@code message_delta}/{@code message_stop} payloads held back until the
 *     session knows this was the last round
 * @param credentialBlamed whether the failure counts against the credential
 */
public record RoundResult(
    RoundOutcome outcome,
    String stopReason,
    TokenUsage usage,
    List<ObjectNode> contentBlocks,
    List<ToolCall> toolCalls,
    List<ObjectNode> terminalEvents,
    String errorMessage,
    boolean credentialBlamed,
    boolean upstreamResponded) {

  public RoundResult {
    usage = usage != null ? usage : TokenUsage.EMPTY;
    contentBlocks = contentBlocks != null ? List.copyOf(contentBlocks) : List.of();
    toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    terminalEvents = terminalEvents != null ? List.copyOf(terminalEvents) : List.of();
  }

  public static RoundResult failed(String errorMessage, boolean credentialBlamed) {
    return new RoundResult(
        RoundOutcome.ERROR,
        null,
        TokenUsage.EMPTY,
        null,
        null,
        null,
        errorMessage,
        credentialBlamed,
        false);
  }

  public static RoundResult aborted() {
    return new RoundResult(
        RoundOutcome.ABORTED, null, TokenUsage.EMPTY, null, null, null, null, false, false);
  }
}
