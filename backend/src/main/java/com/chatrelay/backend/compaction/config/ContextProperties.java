package com.chatrelay.backend.compaction.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.context")
public class ContextProperties {

  @Min(1)
  private int contextWindow = 200_000;

  @Min(0)
  private int maxOutputTokens = 64_000;

  @Min(0)
  private int systemPromptTokens = 20_000;

  @DecimalMin("0.05")
  @DecimalMax("1.0")
  private double compactionThreshold = 0.85;

  /** Most recent user/assistant rounds never folded into a summary. */
  @Min(1)
  private int keepRounds = 5;

  /** Rounds after which media and long code blocks are pruned from the request. */
  @Min(1)
  private int pruningAgeRounds = 20;

  @Min(100)
  private int pruningCodeBlockLimit = 2_000;

  @DecimalMin("0.05")
  @DecimalMax("1.0")
  private double pruningKeepRatio = 0.4;

  @Min(200)
  private int transcriptMessageLimit = 8_000;

  @NotBlank private String compactionModel = "claude-haiku-4-5-20251001";

  @Min(256)
  private int summaryMaxTokens = 4_096;

  @NotNull private Duration summaryTimeout = Duration.ofSeconds(90);

  @NotBlank
  private String compactionInstruction =
      "Compress the following conversation history into a concise summary. Keep key facts,"
          + " decisions, open questions and any context needed to continue the conversation."
          + " Reply in the language the conversation is held in.";

  /** Counts non-CJK text with the heuristic only, skipping the tokenizer. */
  private boolean lightweightEstimation;

  @NotBlank private String tokenizer = "cl100k_base";

  /** Token load at which compaction starts. */
  public long compactionTriggerTokens() {
    long budget = (long) contextWindow - systemPromptTokens - maxOutputTokens;
    return (long) Math.floor(Math.max(0, budget) * compactionThreshold);
  }

  public int getContextWindow() {
    return contextWindow;
  }

  public void setContextWindow(int contextWindow) {
    this.contextWindow = contextWindow;
  }

  public int getMaxOutputTokens() {
    return maxOutputTokens;
  }

  public void setMaxOutputTokens(int maxOutputTokens) {
    this.maxOutputTokens = maxOutputTokens;
  }

  public int getSystemPromptTokens() {
    return systemPromptTokens;
  }

  public void setSystemPromptTokens(int systemPromptTokens) {
    this.systemPromptTokens = systemPromptTokens;
  }

  public double getCompactionThreshold() {
    return compactionThreshold;
  }

  public void setCompactionThreshold(double compactionThreshold) {
    this.compactionThreshold = compactionThreshold;
  }

  public int getKeepRounds() {
    return keepRounds;
  }

  public void setKeepRounds(int keepRounds) {
    this.keepRounds = keepRounds;
  }

  public int getPruningAgeRounds() {
    return pruningAgeRounds;
  }

  public void setPruningAgeRounds(int pruningAgeRounds) {
    this.pruningAgeRounds = pruningAgeRounds;
  }

  public int getPruningCodeBlockLimit() {
    return pruningCodeBlockLimit;
  }

  public void setPruningCodeBlockLimit(int pruningCodeBlockLimit) {
    this.pruningCodeBlockLimit = pruningCodeBlockLimit;
  }

  public double getPruningKeepRatio() {
    return pruningKeepRatio;
  }

  public void setPruningKeepRatio(double pruningKeepRatio) {
    this.pruningKeepRatio = pruningKeepRatio;
  }

  public int getTranscriptMessageLimit() {
    return transcriptMessageLimit;
  }

  public void setTranscriptMessageLimit(int transcriptMessageLimit) {
    this.transcriptMessageLimit = transcriptMessageLimit;
  }

  public String getCompactionModel() {
    return compactionModel;
  }

  public void setCompactionModel(String compactionModel) {
    this.compactionModel = compactionModel;
  }

  public int getSummaryMaxTokens() {
    return summaryMaxTokens;
  }

  public void setSummaryMaxTokens(int summaryMaxTokens) {
    this.summaryMaxTokens = summaryMaxTokens;
  }

  public Duration getSummaryTimeout() {
    return summaryTimeout;
  }

  public void setSummaryTimeout(Duration summaryTimeout) {
    this.summaryTimeout = summaryTimeout;
  }

  public String getCompactionInstruction() {
    return compactionInstruction;
  }

  public void setCompactionInstruction(String compactionInstruction) {
    this.compactionInstruction = compactionInstruction;
  }

  public boolean isLightweightEstimation() {
    return lightweightEstimation;
  }

  public void setLightweightEstimation(boolean lightweightEstimation) {
    this.lightweightEstimation = lightweightEstimation;
  }

  public String getTokenizer() {
    return tokenizer;
  }

  public void setTokenizer(String tokenizer) {
    this.tokenizer = tokenizer;
  }
}
