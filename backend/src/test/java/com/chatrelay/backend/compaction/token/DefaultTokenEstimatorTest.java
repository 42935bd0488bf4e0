package com.chatrelay.backend.compaction.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;
import org.junit.jupiter.api.Test;

class DefaultTokenEstimatorTest {

  private final EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();

  @Test
  void countsLatinTextWithEncoding() {
    DefaultTokenEstimator estimator = new DefaultTokenEstimator(registry, "cl100k_base", false);

    assertThat(estimator.estimate("hello world")).isEqualTo(2);
  }

  @Test
  void weightsCjkIdeographs() {
    DefaultTokenEstimator estimator = new DefaultTokenEstimator(registry, null, false);

    assertThat(estimator.estimate("你好")).isEqualTo(3);
    assertThat(estimator.estimate("你好 hello")).isGreaterThan(3);
  }

  @Test
  void emptyTextHasNoTokens() {
    DefaultTokenEstimator estimator = new DefaultTokenEstimator(registry, "cl100k_base", false);

    assertThat(estimator.estimate("")).isZero();
    assertThat(estimator.estimate(null)).isZero();
  }

  @Test
  void lightweightModeUsesCharacterHeuristic() {
    DefaultTokenEstimator estimator = new DefaultTokenEstimator(registry, "unused", true);

    assertThat(estimator.estimate("abc")).isEqualTo(1);
    assertThat(estimator.estimate("你a")).isEqualTo(2);
  }

  @Test
  void heuristicRoundsUp() {
    assertThat(TokenEstimator.heuristic("a")).isEqualTo(1);
    assertThat(TokenEstimator.heuristic("中文中文")).isEqualTo(6);
  }

  @Test
  void unknownTokenizerIsRejected() {
    assertThatThrownBy(() -> new DefaultTokenEstimator(registry, "no_such_encoding", false))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("no_such_encoding");
  }
}
