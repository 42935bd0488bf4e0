package com.chatrelay.backend.upstream.client;

import com.chatrelay.backend.upstream.event.UpstreamEvent;
import java.util.Optional;

/** Blocking, pull-style view of an upstream event stream. */
public interface UpstreamStream extends AutoCloseable {

  /**
   * Waits for the next event.
   *
   * @return the event, or empty once the stream has ended or was aborted
   * @throws com.chatrelay.backend.upstream.error.UpstreamStreamException if the transport failed
   */
  Optional<UpstreamEvent> next();

  /** Cancels the underlying request; a blocked {@link #next()} returns empty. */
  void abort();

  @Override
  default void close() {
    abort();
  }
}
