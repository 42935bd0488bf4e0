package com.chatrelay.backend.upstream.client;

import com.chatrelay.backend.upstream.error.UpstreamStreamException;
import com.chatrelay.backend.upstream.event.UpstreamEvent;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/** Bridges a reactive event flux to the pull-style {@link UpstreamStream}. */
public final class QueueingUpstreamStream implements UpstreamStream {

  private static final Signal END = new Signal(null, null);

  private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean aborted = new AtomicBoolean();
  private final Disposable subscription;

  public QueueingUpstreamStream(Flux<UpstreamEvent> events) {
    this.subscription =
        events.subscribe(
            event -> queue.offer(new Signal(event, null)),
            error -> queue.offer(new Signal(null, error)),
            () -> queue.offer(END));
  }

  @Override
  public Optional<UpstreamEvent> next() {
    if (aborted.get()) {
      return Optional.empty();
    }
    Signal signal;
    try {
      signal = queue.take();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      abort();
      return Optional.empty();
    }
    if (signal == END) {
      queue.offer(END);
      return Optional.empty();
    }
    if (signal.error() != null) {
      queue.offer(END);
      if (aborted.get()) {
        return Optional.empty();
      }
      throw signal.error() instanceof UpstreamStreamException streamException
          ? streamException
          : new UpstreamStreamException("Upstream stream failed", signal.error());
    }
    return Optional.of(signal.event());
  }

  @Override
  public void abort() {
    if (aborted.compareAndSet(false, true)) {
      subscription.dispose();
      queue.offer(END);
    }
  }

  private record Signal(UpstreamEvent event, Throwable error) {}
}
