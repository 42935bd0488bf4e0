package com.chatrelay.backend.compaction.token;

import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * CJK ideographs are weighted 1.5 tokens each; the remaining text is counted with a BPE encoding.
 * Falls back to {@link TokenEstimator#heuristic(String)} in lightweight mode or when the
 * encoding fails.
 */
public class DefaultTokenEstimator implements TokenEstimator {

  private static final Logger log = LoggerFactory.getLogger(DefaultTokenEstimator.class);
  private static final double CJK_WEIGHT = 1.5;

  private final Encoding encoding;
  private final boolean lightweight;

  public DefaultTokenEstimator(EncodingRegistry registry, String tokenizer, boolean lightweight) {
    this.lightweight = lightweight;
    this.encoding = lightweight ? null : resolveEncoding(registry, tokenizer);
  }

  @Override
  public long estimate(String text) {
    if (!StringUtils.hasLength(text)) {
      return 0L;
    }
    if (lightweight) {
      return TokenEstimator.heuristic(text);
    }
    int cjk = 0;
    StringBuilder rest = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (TokenEstimator.isCjk(ch)) {
        cjk++;
        rest.append(' ');
      } else {
        rest.append(ch);
      }
    }
    long cjkTokens = (long) Math.ceil(cjk * CJK_WEIGHT);
    if (rest.toString().isBlank()) {
      return cjkTokens;
    }
    try {
      return cjkTokens + encoding.countTokensOrdinary(rest.toString());
    } catch (RuntimeException ordinaryFailure) {
      log.debug("Falling back to heuristic token count: {}", ordinaryFailure.getMessage());
      return TokenEstimator.heuristic(text);
    }
  }

  private static Encoding resolveEncoding(EncodingRegistry registry, String tokenizer) {
    String name = StringUtils.hasText(tokenizer) ? tokenizer.trim() : "cl100k_base";
    return EncodingType.fromName(name)
        .map(registry::getEncoding)
        .or(() -> registry.getEncoding(name))
        .orElseThrow(
            () -> new IllegalArgumentException("Unknown tokenizer '" + name + "'"));
  }
}
