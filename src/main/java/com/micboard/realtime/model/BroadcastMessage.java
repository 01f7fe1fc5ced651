package com.micboard.realtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import javax.annotation.Nonnull;
import lombok.Builder;
import lombok.Value;

/** Envelope delivered to viewer sessions. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BroadcastMessage {
  @Nonnull BroadcastMessageType type;

  String deviceId;

  JsonNode data;

  String message;

  public static BroadcastMessage deviceUpdate(String deviceId, JsonNode data) {
    return BroadcastMessage.builder()
        .type(BroadcastMessageType.DEVICE_UPDATE)
        .deviceId(deviceId)
        .data(data)
        .build();
  }

  public static BroadcastMessage status(String deviceId, String message) {
    return BroadcastMessage.builder()
        .type(BroadcastMessageType.STATUS)
        .deviceId(deviceId)
        .message(message)
        .build();
  }

  public static BroadcastMessage pong() {
    return BroadcastMessage.builder().type(BroadcastMessageType.PONG).build();
  }
}
