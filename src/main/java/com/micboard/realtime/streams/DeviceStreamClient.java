package com.micboard.realtime.streams;

import com.micboard.realtime.model.DeviceEndpoint;
import reactor.core.publisher.Mono;

@FunctionalInterface
public interface DeviceStreamClient<T> {

  /**
   * Open a stream to a device.
   *
   * @param endpoint Where the device streams from
   * @return The open stream, or an error if the connection could not be made
   */
  Mono<DeviceStream<T>> connect(DeviceEndpoint endpoint);
}
