package com.micboard.realtime.connection;

import com.micboard.realtime.model.ConnectionState;
import com.micboard.realtime.model.ConnectionStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Transitions of a device stream connection.
 *
 * <p>Every operation returns a new {@link ConnectionState}; the argument is never modified.
 * The only input besides the state itself is the clock used to stamp the transition.
 */
@RequiredArgsConstructor
public class ConnectionStateMachine {

  @Getter
  private final Clock clock;

  public ConnectionStateMachine() {
    this(Clock.systemUTC());
  }

  /**
   * Record that a connection attempt is under way.
   *
   * @param state The current state
   * @return The connecting state
   */
  public ConnectionState markConnecting(ConnectionState state) {
    return state.toBuilder().status(ConnectionStatus.CONNECTING).build();
  }

  /**
   * Record a healthy session. All failure bookkeeping is cleared.
   *
   * @param state The current state
   * @return The connected state
   */
  public ConnectionState markConnected(ConnectionState state) {
    Instant now = clock.instant();
    return state.toBuilder()
        .status(ConnectionStatus.CONNECTED)
        .connectedAt(now)
        .lastMessageAt(now)
        .disconnectedAt(null)
        .errorCount(0)
        .errorMessage("")
        .reconnectAttempts(0)
        .build();
  }

  public ConnectionState markDisconnected(ConnectionState state) {
    return markDisconnected(state, null);
  }

  /**
   * Record the end of a session. A non-empty message counts as an error.
   *
   * @param state The current state
   * @param errorMessage Reason for the disconnect, may be null
   * @return The disconnected state
   */
  public ConnectionState markDisconnected(ConnectionState state, String errorMessage) {
    Instant now = clock.instant();
    ConnectionState.ConnectionStateBuilder builder = state.toBuilder()
        .status(ConnectionStatus.DISCONNECTED)
        .disconnectedAt(now);
    if (errorMessage != null && !errorMessage.isEmpty()) {
      builder.errorMessage(errorMessage)
          .errorCount(state.getErrorCount() + 1)
          .lastErrorAt(now);
    }
    return builder.build();
  }

  /**
   * Record a failed connection.
   *
   * @param state The current state
   * @param errorMessage What went wrong
   * @return The error state
   */
  public ConnectionState markError(ConnectionState state, String errorMessage) {
    return state.toBuilder()
        .status(ConnectionStatus.ERROR)
        .errorMessage(errorMessage == null ? "" : errorMessage)
        .errorCount(state.getErrorCount() + 1)
        .lastErrorAt(clock.instant())
        .build();
  }

  public ConnectionState markStopped(ConnectionState state) {
    return state.toBuilder()
        .status(ConnectionStatus.STOPPED)
        .disconnectedAt(clock.instant())
        .build();
  }

  /**
   * Record receipt of a message. A message proves the stream is alive, so any state other
   * than connected is promoted to a fresh connected state. This applies to stopped
   * connections too.
   *
   * @param state The current state
   * @return The state with an updated message timestamp
   */
  public ConnectionState receivedMessage(ConnectionState state) {
    if (state.getStatus() != ConnectionStatus.CONNECTED) {
      return markConnected(state);
    }
    return state.toBuilder().lastMessageAt(clock.instant()).build();
  }

  public boolean shouldReconnect(ConnectionState state) {
    return (state.getStatus() == ConnectionStatus.DISCONNECTED
        || state.getStatus() == ConnectionStatus.ERROR)
        && state.getReconnectAttempts() < state.getMaxReconnectAttempts();
  }

  public ConnectionState incrementReconnectAttempt(ConnectionState state) {
    return state.toBuilder().reconnectAttempts(state.getReconnectAttempts() + 1).build();
  }

  public ConnectionState resetReconnectAttempts(ConnectionState state) {
    return state.toBuilder().reconnectAttempts(0).build();
  }

  public boolean isActive(ConnectionState state) {
    return state.getStatus() == ConnectionStatus.CONNECTED;
  }

  public Optional<Duration> timeSinceLastMessage(ConnectionState state) {
    return Optional.ofNullable(state.getLastMessageAt())
        .map(lastMessageAt -> Duration.between(lastMessageAt, clock.instant()));
  }

  /**
   * How long the current session has been open.
   *
   * @param state The current state
   * @return The session duration, empty unless connected
   */
  public Optional<Duration> connectionDuration(ConnectionState state) {
    if (!isActive(state) || state.getConnectedAt() == null) {
      return Optional.empty();
    }
    return Optional.of(Duration.between(state.getConnectedAt(), clock.instant()));
  }
}
