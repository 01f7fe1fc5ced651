package com.micboard.realtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

public enum BroadcastMessageType {
  @JsonProperty("device_update")
  @JsonPropertyDescription("Telemetry delta received from a device stream")
  DEVICE_UPDATE,
  @JsonProperty("status")
  @JsonPropertyDescription("Human readable connection status")
  STATUS,
  @JsonProperty("pong")
  @JsonPropertyDescription("Reply to a viewer ping")
  PONG,
}
