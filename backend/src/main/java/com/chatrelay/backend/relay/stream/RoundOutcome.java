package com.chatrelay.backend.relay.stream;

/** How a single upstream round ended. */
public enum RoundOutcome {
  /** The model asked for tools; the loop continues with their results. */
  TOOL_USE,
  END_TURN,
  /** Output-token ceiling hit or the stream ended without a stop reason. */
  TRUNCATED,
  ERROR,
  /** The client went away. Not an error. */
  ABORTED
}
