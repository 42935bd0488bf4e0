package com.chatrelay.backend.upstream.service;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.billing.service.BillingCalculator;
import com.chatrelay.backend.pool.model.CredentialLease;
import com.chatrelay.backend.pool.service.CredentialPool;
import com.chatrelay.backend.upstream.client.UpstreamClient;
import com.chatrelay.backend.upstream.error.UpstreamErrorClassifier;
import com.chatrelay.backend.upstream.event.UpstreamEventParser;
import com.chatrelay.backend.upstream.retry.UpstreamRetryTemplateFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Short non-streaming upstream calls made on the side of a chat session (summaries, titles).
 * Each call acquires and releases its own credential and never throws.
 */
@Service
public class UpstreamCompletionService {

  private static final Logger log = LoggerFactory.getLogger(UpstreamCompletionService.class);

  private final CredentialPool credentialPool;
  private final UpstreamClient upstreamClient;
  private final UpstreamRetryTemplateFactory retryTemplateFactory;
  private final UpstreamErrorClassifier errorClassifier;
  private final BillingCalculator billingCalculator;
  private final ObjectMapper objectMapper;

  public UpstreamCompletionService(
      CredentialPool credentialPool,
      UpstreamClient upstreamClient,
      UpstreamRetryTemplateFactory retryTemplateFactory,
      UpstreamErrorClassifier errorClassifier,
      BillingCalculator billingCalculator,
      ObjectMapper objectMapper) {
    this.credentialPool = credentialPool;
    this.upstreamClient = upstreamClient;
    this.retryTemplateFactory = retryTemplateFactory;
    this.errorClassifier = errorClassifier;
    this.billingCalculator = billingCalculator;
    this.objectMapper = objectMapper;
  }

  public record CompletionRequest(
      String purpose,
      String model,
      String system,
      String prompt,
      int maxTokens,
      Duration timeout) {}

  /** @return the text of the reply, or empty when no credential was free or the call failed */
  public Optional<String> complete(CompletionRequest request) {
    Optional<CredentialLease> acquired = credentialPool.acquire(null);
    if (acquired.isEmpty()) {
      log.warn("No upstream credential available for {} request", request.purpose());
      return Optional.empty();
    }
    CredentialLease lease = acquired.get();
    try {
      ObjectNode body = buildBody(request);
      JsonNode response =
          retryTemplateFactory
              .create(() -> false)
              .execute(context -> upstreamClient.complete(lease, body, request.timeout()));
      TokenUsage usage =
          UpstreamEventParser.usage(response != null ? response.path("usage") : null);
      credentialPool.recordSuccess(lease.credentialId(), usage);
      credentialPool.recordCost(
          lease.credentialId(),
          BillingCalculator.dollarToUnits(
              billingCalculator
                  .calculate(request.model(), usage, lease.groupMultiplier())
                  .totalCost()));
      String text = extractText(response);
      if (!StringUtils.hasText(text)) {
        log.warn("Upstream returned no text for {} request", request.purpose());
        return Optional.empty();
      }
      return Optional.of(text.strip());
    } catch (RuntimeException ex) {
      if (errorClassifier.blamesCredential(ex)) {
        credentialPool.recordError(lease.credentialId(), errorClassifier.describe(ex));
      }
      log.warn("Upstream {} request failed: {}", request.purpose(), errorClassifier.describe(ex));
      return Optional.empty();
    } finally {
      credentialPool.release(lease.credentialId());
    }
  }

  private ObjectNode buildBody(CompletionRequest request) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", request.model());
    body.put("max_tokens", request.maxTokens());
    if (StringUtils.hasText(request.system())) {
      body.put("system", request.system());
    }
    ObjectNode message = body.putArray("messages").addObject();
    message.put("role", "user");
    message.put("content", request.prompt());
    return body;
  }

  static String extractText(JsonNode response) {
    if (response == null) {
      return null;
    }
    StringBuilder text = new StringBuilder();
    for (JsonNode block : response.path("content")) {
      if ("text".equals(block.path("type").asText())) {
        text.append(block.path("text").asText(""));
      }
    }
    return text.toString();
  }
}
