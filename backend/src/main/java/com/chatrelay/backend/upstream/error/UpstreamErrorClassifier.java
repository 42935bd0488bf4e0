package com.chatrelay.backend.upstream.error;

import com.chatrelay.backend.upstream.config.UpstreamProperties;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClientRequestException;

/**
 * Decides whether an upstream failure is retried and whether it counts against the credential.
 * Request-shape errors (4xx other than 429) are neither.
 */
@Component
public class UpstreamErrorClassifier {

  private static final int MAX_DETAIL_LENGTH = 500;

  private final UpstreamProperties properties;

  public UpstreamErrorClassifier(UpstreamProperties properties) {
    this.properties = properties;
  }

  public boolean isRetryable(Throwable error) {
    UpstreamHttpException http = findHttpException(error);
    if (http == null) {
      return false;
    }
    Set<Integer> statuses = properties.getRetry().getRetryableStatuses();
    return statuses != null && statuses.contains(http.getStatusCode());
  }

  public boolean blamesCredential(Throwable error) {
    UpstreamHttpException http = findHttpException(error);
    if (http != null) {
      int status = http.getStatusCode();
      return status == 429 || status >= 500;
    }
    return isTransportFailure(error);
  }

  public String describe(Throwable error) {
    UpstreamHttpException http = findHttpException(error);
    if (http != null) {
      String body = sanitize(http.getResponseBody());
      return StringUtils.hasText(body)
          ? "Upstream error " + http.getStatusCode() + ": " + body
          : "Upstream error " + http.getStatusCode();
    }
    String message = error.getMessage();
    if (!StringUtils.hasText(message)) {
      message = error.getClass().getSimpleName();
    }
    return "Upstream request failed: " + sanitize(message);
  }

  private boolean isTransportFailure(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof UpstreamStreamException
          || current instanceof WebClientRequestException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private UpstreamHttpException findHttpException(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof UpstreamHttpException http) {
        return http;
      }
      current = current.getCause();
    }
    return null;
  }

  static String sanitize(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    String normalized = value.replaceAll("\\s+", " ").trim();
    if (normalized.length() <= MAX_DETAIL_LENGTH) {
      return normalized;
    }
    return normalized.substring(0, MAX_DETAIL_LENGTH) + "...";
  }
}
