package com.chatrelay.backend.relay.stream;

/** Raised inside a retry callback when the session was cancelled before the attempt started. */
class RelayCancelledException extends RuntimeException {

  RelayCancelledException() {
    super("Relay session cancelled", null, false, false);
  }
}
