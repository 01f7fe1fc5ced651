package com.micboard.realtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

public enum ConnectionType {
  @JsonProperty("sse")
  @JsonPropertyDescription("Server-Sent Events")
  SSE,
  @JsonProperty("websocket")
  @JsonPropertyDescription("WebSocket")
  WEBSOCKET,
}
