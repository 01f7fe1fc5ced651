package com.micboard.realtime.routing;

import lombok.Value;

/** Handle returned by {@link BroadcastHub#subscribe}, used to unsubscribe later. */
@Value
public class TopicSubscription {
  private int id;
  private String topic;
}
