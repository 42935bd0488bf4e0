package com.chatrelay.backend.relay.stream;

import com.chatrelay.backend.relay.config.RelayProperties;
import com.chatrelay.backend.relay.tool.ConcurrentToolDispatcher;
import com.chatrelay.backend.relay.tool.ToolCall;
import com.chatrelay.backend.relay.tool.ToolContext;
import com.chatrelay.backend.relay.tool.ToolResult;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives a session through its rounds: {@code ROUND(n)} either asks for tools, which are run
 * before {@code ROUND(n+1)}, or ends the session as end-of-turn, truncated, error or aborted.
 */
@Component
public class RoundLoop {

  private static final Logger log = LoggerFactory.getLogger(RoundLoop.class);

  private final RoundExecutor roundExecutor;
  private final UpstreamRequestFactory requestFactory;
  private final ConcurrentToolDispatcher toolDispatcher;
  private final RelayEvents events;
  private final RelayProperties properties;

  public RoundLoop(
      RoundExecutor roundExecutor,
      UpstreamRequestFactory requestFactory,
      ConcurrentToolDispatcher toolDispatcher,
      RelayEvents events,
      RelayProperties properties) {
    this.roundExecutor = roundExecutor;
    this.requestFactory = requestFactory;
    this.toolDispatcher = toolDispatcher;
    this.events = events;
    this.properties = properties;
  }

  /** @return how the session ended */
  public RoundOutcome run(RelaySession session, RelayRequest request) {
    ArrayNode messages = request.messages().deepCopy();
    int maxRounds = properties.getMaxRounds();
    while (true) {
      if (session.isCancelled()) {
        return RoundOutcome.ABORTED;
      }
      int round = session.nextRound();
      boolean finalRound = round >= maxRounds;
      boolean includeTools = !(finalRound && properties.isWithholdToolsOnFinalRound());
      ObjectNode body = requestFactory.build(request, messages, includeTools);

      RoundResult result = roundExecutor.execute(session, body);
      switch (result.outcome()) {
        case TOOL_USE -> {
          if (result.toolCalls().isEmpty()) {
            finishTurn(session, result);
            return RoundOutcome.END_TURN;
          }
          if (finalRound) {
            log.warn(
                "Conversation {} still requested tools after {} rounds",
                session.conversationId(),
                round);
            session.emit(
                events.error(
                    "tool_round_limit",
                    "Stopped after " + maxRounds + " tool rounds without a final answer."));
            return RoundOutcome.TRUNCATED;
          }
          messages.add(events.assistantMessage(result.contentBlocks()));
          List<ToolResult> results = runTools(session, result.toolCalls());
          if (session.isCancelled()) {
            return RoundOutcome.ABORTED;
          }
          messages.add(events.toolResultMessage(results));
        }
        case END_TURN -> {
          if (!result.toolCalls().isEmpty()) {
            log.debug(
                "Round {} ended normally with {} tool calls; running them without another round",
                round,
                result.toolCalls().size());
            runTools(session, result.toolCalls());
          }
          finishTurn(session, result);
          return RoundOutcome.END_TURN;
        }
        case TRUNCATED -> {
          session.emit(events.error("incomplete_response", result.errorMessage()));
          return RoundOutcome.TRUNCATED;
        }
        case ERROR -> {
          if (result.credentialBlamed()) {
            session.blameCredential(result.errorMessage());
          }
          session.emit(events.error("upstream_error", result.errorMessage()));
          return RoundOutcome.ERROR;
        }
        default -> {
          return RoundOutcome.ABORTED;
        }
      }
    }
  }

  private List<ToolResult> runTools(RelaySession session, List<ToolCall> calls) {
    session.emit(events.toolStatus("tool_use", calls));
    List<ToolResult> results =
        toolDispatcher.dispatch(
            calls, new ToolContext(session.tenantId(), session.conversationId()));
    for (ToolResult result : results) {
      if (!result.sources().isEmpty()) {
        session.emit(events.searchSources(result));
      }
      if (result.document() != null && !result.document().isNull()) {
        session.emit(events.documentCreated(result));
      }
    }
    session.emit(events.toolStatus("tool_done", calls));
    return results;
  }

  private void finishTurn(RelaySession session, RoundResult result) {
    for (ObjectNode terminal : result.terminalEvents()) {
      if ("message_delta".equals(terminal.path("type").asText())) {
        session.emit(events.finalMessageDelta(terminal, session.usage()));
      } else {
        session.emit(terminal);
      }
    }
  }
}
