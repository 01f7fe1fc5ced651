package com.micboard.realtime.streams;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.logging.Level;
import lombok.extern.java.Log;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

/**
 * Adapts a publisher into a {@link DeviceStream}, requesting one element per
 * {@link #nextMessage()} call.
 *
 * @param <T> The payload type
 */
@Log
public class PulledDeviceStream<T> extends BaseSubscriber<T> implements DeviceStream<T> {

  private final Queue<T> buffered = new ArrayDeque<>();

  private MonoSink<T> pending;

  private Throwable error;

  private boolean completed;

  private PulledDeviceStream() {}

  /**
   * Subscribe to a source. Nothing is requested until the first {@link #nextMessage()}.
   *
   * @param source The payload source
   * @param <T> The payload type
   * @return The stream
   */
  public static <T> PulledDeviceStream<T> of(Publisher<T> source) {
    PulledDeviceStream<T> stream = new PulledDeviceStream<>();
    source.subscribe(stream);
    return stream;
  }

  @Override
  public Mono<T> nextMessage() {
    return Mono.create(sink -> {
      if (awaitNext(sink)) {
        sink.onCancel(() -> clearPending(sink));
        request(1);
      }
    });
  }

  @Override
  public Mono<Void> close() {
    return Mono.fromRunnable(this::dispose);
  }

  private synchronized boolean awaitNext(MonoSink<T> sink) {
    if (!buffered.isEmpty()) {
      sink.success(buffered.poll());
      return false;
    }
    if (error != null) {
      sink.error(error);
      return false;
    }
    if (completed) {
      sink.success();
      return false;
    }
    if (pending != null) {
      sink.error(new IllegalStateException("A message request is already pending"));
      return false;
    }
    pending = sink;
    return true;
  }

  private synchronized void clearPending(MonoSink<T> sink) {
    if (pending == sink) {
      pending = null;
    }
  }

  private synchronized MonoSink<T> takePending() {
    MonoSink<T> sink = pending;
    pending = null;
    return sink;
  }

  @Override
  protected void hookOnSubscribe(Subscription subscription) {
    // Demand is driven by nextMessage
  }

  @Override
  protected void hookOnNext(T value) {
    MonoSink<T> sink;
    synchronized (this) {
      sink = takePending();
      if (sink == null) {
        buffered.add(value);
        return;
      }
    }
    sink.success(value);
  }

  @Override
  protected void hookOnComplete() {
    MonoSink<T> sink;
    synchronized (this) {
      completed = true;
      sink = takePending();
    }
    if (sink != null) {
      sink.success();
    }
  }

  @Override
  protected void hookOnError(Throwable throwable) {
    log.log(Level.FINE, "Device stream failed", throwable);
    MonoSink<T> sink;
    synchronized (this) {
      error = throwable;
      sink = takePending();
    }
    if (sink != null) {
      sink.error(throwable);
    }
  }

  @Override
  protected void hookOnCancel() {
    hookOnComplete();
  }
}
