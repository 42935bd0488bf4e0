package com.chatrelay.backend.upstream.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.upstream")
public class UpstreamProperties {

  @NotBlank private String protocolVersion = "2023-06-01";

  @NotBlank private String messagesPath = "/v1/messages";

  /** Time allowed until response headers arrive. */
  @NotNull private Duration responseTimeout = Duration.ofSeconds(90);

  /** Longest silence tolerated between two body chunks of a stream. */
  @NotNull private Duration idleTimeout = Duration.ofMinutes(5);

  @Min(1024)
  private int maxInMemorySize = 16 * 1024 * 1024;

  @Valid private Retry retry = new Retry();

  public String getProtocolVersion() {
    return protocolVersion;
  }

  public void setProtocolVersion(String protocolVersion) {
    this.protocolVersion = protocolVersion;
  }

  public String getMessagesPath() {
    return messagesPath;
  }

  public void setMessagesPath(String messagesPath) {
    this.messagesPath = messagesPath;
  }

  public Duration getResponseTimeout() {
    return responseTimeout;
  }

  public void setResponseTimeout(Duration responseTimeout) {
    this.responseTimeout = responseTimeout;
  }

  public Duration getIdleTimeout() {
    return idleTimeout;
  }

  public void setIdleTimeout(Duration idleTimeout) {
    this.idleTimeout = idleTimeout;
  }

  public int getMaxInMemorySize() {
    return maxInMemorySize;
  }

  public void setMaxInMemorySize(int maxInMemorySize) {
    this.maxInMemorySize = maxInMemorySize;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public static class Retry {

    @Min(1)
    private int maxAttempts = 3;

    @NotNull private Duration initialBackoff = Duration.ofSeconds(1);

    /** Added to the delay after every failed attempt. */
    @NotNull private Duration backoffStep = Duration.ofSeconds(2);

    @NotNull private Duration maxBackoff = Duration.ofSeconds(8);

    private Set<Integer> retryableStatuses =
        new LinkedHashSet<>(List.of(429, 500, 502, 503, 522, 524));

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public Duration getBackoffStep() {
      return backoffStep;
    }

    public void setBackoffStep(Duration backoffStep) {
      this.backoffStep = backoffStep;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    public Set<Integer> getRetryableStatuses() {
      return retryableStatuses;
    }

    public void setRetryableStatuses(Set<Integer> retryableStatuses) {
      this.retryableStatuses = retryableStatuses;
    }
  }
}
