package com.micboard.realtime.streams;

import reactor.core.publisher.Mono;

/**
 * An open upstream connection to a device, read one message at a time.
 *
 * @param <T> The payload type
 */
public interface DeviceStream<T> {

  /**
   * Pull the next message.
   *
   * @return The next message, empty once the stream has ended, or an error if it failed
   */
  Mono<T> nextMessage();

  Mono<Void> close();
}
