package com.chatrelay.backend.relay.stream;

import com.fasterxml.jackson.databind.JsonNode;

/** Client-facing side of a relay session. Implementations must tolerate concurrent senders. */
public interface RelayEventSink {

  /** @return {@code false} once the client can no longer be reached */
  boolean send(JsonNode event);

  void complete();
}
