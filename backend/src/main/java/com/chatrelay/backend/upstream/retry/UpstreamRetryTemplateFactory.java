package com.chatrelay.backend.upstream.retry;

import com.chatrelay.backend.upstream.client.AbortSignal;
import com.chatrelay.backend.upstream.config.UpstreamProperties;
import com.chatrelay.backend.upstream.error.UpstreamErrorClassifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Builds the retry template wrapped around every upstream request. Only statuses from the
 * retryable set are retried, and a cancelled caller stops further attempts.
 */
@Component
public class UpstreamRetryTemplateFactory {

  private static final Logger log = LoggerFactory.getLogger(UpstreamRetryTemplateFactory.class);

  private final UpstreamProperties properties;
  private final UpstreamErrorClassifier classifier;
  private final Sleeper sleeper;
  private final Counter retryCounter;

  @Autowired
  public UpstreamRetryTemplateFactory(
      UpstreamProperties properties,
      UpstreamErrorClassifier classifier,
      MeterRegistry meterRegistry) {
    this(properties, classifier, meterRegistry, null);
  }

  /** @param sleeper fixed back-off sleeper, or {@code null} to sleep on the caller's signal */

  public UpstreamRetryTemplateFactory(
      UpstreamProperties properties,
      UpstreamErrorClassifier classifier,
      MeterRegistry meterRegistry,
      Sleeper sleeper) {
    this.properties = properties;
    this.classifier = classifier;
    this.sleeper = sleeper;
    this.retryCounter = meterRegistry.counter("relay.upstream.retries");
  }

  public RetryTemplate create(BooleanSupplier cancelled) {
    return build(cancelled, sleeper != null ? sleeper : new ThreadWaitSleeper());
  }

  /** Attempts stop once {@code abortSignal} fires, and a back-off in progress wakes early. */
  public RetryTemplate create(AbortSignal abortSignal) {
    return build(abortSignal::isAborted, sleeper != null ? sleeper : abortSignal::await);
  }

  private RetryTemplate build(BooleanSupplier cancelled, Sleeper backOffSleeper) {
    UpstreamProperties.Retry retry = properties.getRetry();
    int maxAttempts = Math.max(1, retry.getMaxAttempts());
    return RetryTemplate.builder()
        .maxAttempts(maxAttempts)
        .customBackoff(
            new LinearBackOffPolicy(
                retry.getInitialBackoff(),
                retry.getBackoffStep(),
                retry.getMaxBackoff(),
                backOffSleeper))
        .retryOn(error -> classifier.isRetryable(error) && !cancelled.getAsBoolean())
        .withListener(
            new RetryListener() {
              @Override
              public <T, E extends Throwable> void onError(
                  RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                if (context.getRetryCount() < maxAttempts && classifier.isRetryable(throwable)) {
                  retryCounter.increment();
                  log.warn(
                      "Upstream attempt {}/{} failed: {}",
                      context.getRetryCount(),
                      maxAttempts,
                      classifier.describe(throwable));
                }
              }
            })
        .build();
  }
}
