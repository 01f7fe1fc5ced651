package com.micboard.realtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

public enum ConnectionStatus {
  @JsonProperty("connecting")
  @JsonPropertyDescription("Opening the device stream")
  CONNECTING,
  @JsonProperty("connected")
  @JsonPropertyDescription("Device stream open and delivering")
  CONNECTED,
  @JsonProperty("disconnected")
  @JsonPropertyDescription("Device stream closed, eligible for reconnect")
  DISCONNECTED,
  @JsonProperty("error")
  @JsonPropertyDescription("Device stream failed, eligible for reconnect")
  ERROR,
  @JsonProperty("stopped")
  @JsonPropertyDescription("Monitoring deliberately stopped")
  STOPPED,
}
