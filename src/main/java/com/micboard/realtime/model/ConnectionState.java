package com.micboard.realtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import javax.annotation.Nonnull;
import lombok.Builder;
import lombok.Value;

/**
 * Persisted status of one device's streaming connection.
 *
 * <p>Instances are immutable. Use {@link com.micboard.realtime.connection.ConnectionStateMachine}
 * to derive the next state rather than building one by hand.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectionState {
  public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;

  @Nonnull String deviceId;

  @Nonnull ConnectionType connectionType;

  @Builder.Default ConnectionStatus status = ConnectionStatus.DISCONNECTED;

  Instant connectedAt;
  Instant lastMessageAt;
  Instant disconnectedAt;

  @Builder.Default String errorMessage = "";

  int errorCount;
  Instant lastErrorAt;

  int reconnectAttempts;

  @Builder.Default int maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;

  /**
   * Create the initial record for a newly monitored device.
   *
   * @param deviceId The device identifier
   * @param connectionType How the device streams
   * @param maxReconnectAttempts Retry ceiling
   * @return A disconnected connection state
   */
  public static ConnectionState create(
      String deviceId, ConnectionType connectionType, int maxReconnectAttempts) {
    return ConnectionState.builder()
        .deviceId(deviceId)
        .connectionType(connectionType)
        .maxReconnectAttempts(maxReconnectAttempts)
        .build();
  }
}
