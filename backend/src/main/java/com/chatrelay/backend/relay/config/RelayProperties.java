package com.chatrelay.backend.relay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.relay")
public class RelayProperties {

  @NotBlank private String defaultModel = "claude-opus-4-6";

  @Min(1)
  private int maxTokens = 64_000;

  private boolean thinkingEnabled = true;

  @Min(1024)
  private int thinkingBudgetTokens = 50_000;

  @Min(1)
  private int maxRounds = 10;

  /** Sends the last allowed round without tool definitions so the model has to answer in text. */
  private boolean withholdToolsOnFinalRound = true;

  @NotNull private Duration toolTimeout = Duration.ofSeconds(30);

  /** Upper bound for the base64 payload of all inline images of one request. */
  @Min(1024)
  private long attachmentCeilingBytes = 8L * 1024 * 1024;

  /** Directory that relative attachment storage paths are resolved against. */
  @NotBlank private String attachmentStorageRoot = "./data/uploads";

  @NotBlank private String systemPromptLocation = "classpath:prompts/system-prompt.txt";

  @NotBlank private String titleModel = "claude-haiku-4-5-20251001";

  @Min(16)
  private int titleMaxTokens = 64;

  @NotBlank private String thinkingSummaryModel = "claude-haiku-4-5-20251001";

  @Min(16)
  private int thinkingSummaryMaxTokens = 256;

  /** Thinking text shorter than this is not worth a summary call. */
  @Min(0)
  private int thinkingSummaryMinLength = 200;

  @NotNull private Duration backgroundTimeout = Duration.ofSeconds(20);

  /** Bounded wait for background tasks before a session is closed. */
  @NotNull private Duration backgroundAwait = Duration.ofSeconds(10);

  @Min(1)
  private int sessionConcurrency = 64;

  @Min(1)
  private int toolConcurrency = 16;

  @Min(1)
  private int backgroundConcurrency = 8;

  @Valid @NotNull private RateLimit rateLimit = new RateLimit();

  public String getDefaultModel() {
    return defaultModel;
  }

  public void setDefaultModel(String defaultModel) {
    this.defaultModel = defaultModel;
  }

  public int getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(int maxTokens) {
    this.maxTokens = maxTokens;
  }

  public boolean isThinkingEnabled() {
    return thinkingEnabled;
  }

  public void setThinkingEnabled(boolean thinkingEnabled) {
    this.thinkingEnabled = thinkingEnabled;
  }

  public int getThinkingBudgetTokens() {
    return thinkingBudgetTokens;
  }

  public void setThinkingBudgetTokens(int thinkingBudgetTokens) {
    this.thinkingBudgetTokens = thinkingBudgetTokens;
  }

  public int getMaxRounds() {
    return maxRounds;
  }

  public void setMaxRounds(int maxRounds) {
    this.maxRounds = maxRounds;
  }

  public boolean isWithholdToolsOnFinalRound() {
    return withholdToolsOnFinalRound;
  }

  public void setWithholdToolsOnFinalRound(boolean withholdToolsOnFinalRound) {
    this.withholdToolsOnFinalRound = withholdToolsOnFinalRound;
  }

  public Duration getToolTimeout() {
    return toolTimeout;
  }

  public void setToolTimeout(Duration toolTimeout) {
    this.toolTimeout = toolTimeout;
  }

  public long getAttachmentCeilingBytes() {
    return attachmentCeilingBytes;
  }

  public void setAttachmentCeilingBytes(long attachmentCeilingBytes) {
    this.attachmentCeilingBytes = attachmentCeilingBytes;
  }

  public String getAttachmentStorageRoot() {
    return attachmentStorageRoot;
  }

  public void setAttachmentStorageRoot(String attachmentStorageRoot) {
    this.attachmentStorageRoot = attachmentStorageRoot;
  }

  public String getSystemPromptLocation() {
    return systemPromptLocation;
  }

  public void setSystemPromptLocation(String systemPromptLocation) {
    this.systemPromptLocation = systemPromptLocation;
  }

  public String getTitleModel() {
    return titleModel;
  }

  public void setTitleModel(String titleModel) {
    this.titleModel = titleModel;
  }

  public int getTitleMaxTokens() {
    return titleMaxTokens;
  }

  public void setTitleMaxTokens(int titleMaxTokens) {
    this.titleMaxTokens = titleMaxTokens;
  }

  public String getThinkingSummaryModel() {
    return thinkingSummaryModel;
  }

  public void setThinkingSummaryModel(String thinkingSummaryModel) {
    this.thinkingSummaryModel = thinkingSummaryModel;
  }

  public int getThinkingSummaryMaxTokens() {
    return thinkingSummaryMaxTokens;
  }

  public void setThinkingSummaryMaxTokens(int thinkingSummaryMaxTokens) {
    this.thinkingSummaryMaxTokens = thinkingSummaryMaxTokens;
  }

  public int getThinkingSummaryMinLength() {
    return thinkingSummaryMinLength;
  }

  public void setThinkingSummaryMinLength(int thinkingSummaryMinLength) {
    this.thinkingSummaryMinLength = thinkingSummaryMinLength;
  }

  public Duration getBackgroundTimeout() {
    return backgroundTimeout;
  }

  public void setBackgroundTimeout(Duration backgroundTimeout) {
    this.backgroundTimeout = backgroundTimeout;
  }

  public Duration getBackgroundAwait() {
    return backgroundAwait;
  }

  public void setBackgroundAwait(Duration backgroundAwait) {
    this.backgroundAwait = backgroundAwait;
  }

  public int getSessionConcurrency() {
    return sessionConcurrency;
  }

  public void setSessionConcurrency(int sessionConcurrency) {
    this.sessionConcurrency = sessionConcurrency;
  }

  public int getToolConcurrency() {
    return toolConcurrency;
  }

  public void setToolConcurrency(int toolConcurrency) {
    this.toolConcurrency = toolConcurrency;
  }

  public int getBackgroundConcurrency() {
    return backgroundConcurrency;
  }

  public void setBackgroundConcurrency(int backgroundConcurrency) {
    this.backgroundConcurrency = backgroundConcurrency;
  }

  public RateLimit getRateLimit() {
    return rateLimit;
  }

  public void setRateLimit(RateLimit rateLimit) {
    this.rateLimit = rateLimit;
  }

  /** Per-tenant cap on chat requests within a fixed window. */
  public static class RateLimit {

    private boolean enabled = true;

    @Min(1)
    private int maxRequests = 20;

    @NotNull private Duration window = Duration.ofMinutes(1);

    @Min(1)
    private long maximumTenants = 100_000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getMaxRequests() {
      return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
      this.maxRequests = maxRequests;
    }

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }

    public long getMaximumTenants() {
      return maximumTenants;
    }

    public void setMaximumTenants(long maximumTenants) {
      this.maximumTenants = maximumTenants;
    }
  }
}
