package com.chatrelay.backend.relay.stream;

/** Notified when a thinking block of the running round has closed. */
public interface ThinkingSummaryListener {

  void onThinkingBlockClosed(RelaySession session, int blockIndex, String thinking);
}
