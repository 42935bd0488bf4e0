package com.chatrelay.backend.compaction.token;

/** Estimates how many tokens a piece of text occupies in the upstream model's context. */
public interface TokenEstimator {

  long estimate(String text);

  /**
   * Character heuristic: CJK unified ideographs count 1.5 tokens, every other character 0.3,
   * rounded up.
   */
  static long heuristic(String text) {
    if (text == null || text.isEmpty()) {
      return 0L;
    }
    double tokens = 0;
    for (int i = 0; i < text.length(); i++) {
      tokens += isCjk(text.charAt(i)) ? 1.5 : 0.3;
    }
    return (long) Math.ceil(tokens);
  }

  static boolean isCjk(char ch) {
    return ch >= '\u4e00' && ch <= '\u9fff';
  }
}
