package com.chatrelay.backend.upstream.client;

import com.chatrelay.backend.pool.model.CredentialLease;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

/** Messages API of the upstream provider, addressed through a leased credential. */
public interface UpstreamClient {

  /**
   * Sends a streaming request and returns once response headers have arrived. Aborting {@code
   * abortSignal} before then cancels the request and fails the call.
   *
   * @throws com.chatrelay.backend.upstream.error.UpstreamHttpException on a non-2xx status
   * @throws com.chatrelay.backend.upstream.error.UpstreamStreamException on transport failure or
   *     abort
   */
  UpstreamStream openStream(CredentialLease lease, JsonNode body, AbortSignal abortSignal);

  /** Sends a non-streaming request and returns the response object. */
  JsonNode complete(CredentialLease lease, JsonNode body, Duration timeout);
}
