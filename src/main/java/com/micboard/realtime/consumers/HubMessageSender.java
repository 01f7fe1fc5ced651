package com.micboard.realtime.consumers;

import com.micboard.realtime.routing.BroadcastHub;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;

/** Publishes each value to a fixed set of hub topics. */
@Log
@RequiredArgsConstructor
public class HubMessageSender<T> implements Consumer<T> {

  private final BroadcastHub<T> broadcastHub;
  private final List<String> topics;

  @Override
  public void accept(T t) {
    sendMessage(t);
  }

  void sendMessage(T value) {
    for (String topic : topics) {
      int delivered = broadcastHub.publish(topic, value);
      log.log(
          Level.FINE, "\u001B[32mSENDING  ↑ {0}\u001B[0m on {1} to {2} subscriber(s)",
          new Object[] {value, topic, delivered});
    }
  }
}
