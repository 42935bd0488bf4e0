package com.chatrelay.backend.compaction.service;

public record CompactionResult(
    boolean compacted, int messagesCompacted, long tokensBefore, long tokensSaved, String detail) {

  public static CompactionResult skipped(long tokensBefore, String detail) {
    return new CompactionResult(false, 0, tokensBefore, 0, detail);
  }

  public static CompactionResult performed(
      int messagesCompacted, long tokensBefore, long tokensSaved) {
    return new CompactionResult(true, messagesCompacted, tokensBefore, tokensSaved, null);
  }
}
