package com.micboard.realtime.connection;

import com.micboard.realtime.model.ConnectionState;
import com.micboard.realtime.model.ConnectionStatus;
import com.micboard.realtime.model.ConnectionStatusSummary;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;

/** Read-only health queries across all device connections. */
@RequiredArgsConstructor
public class ConnectionHealthService {

  private final ConnectionStateRepository repository;
  private final Clock clock;
  private final Duration heartbeatTimeout;

  /**
   * A connection is healthy when it is connected and its last message is more recent than the
   * heartbeat timeout.
   *
   * @param state The connection state
   * @return true if healthy
   */
  public boolean isHealthy(ConnectionState state) {
    if (state.getStatus() != ConnectionStatus.CONNECTED || state.getLastMessageAt() == null) {
      return false;
    }
    Duration silence = Duration.between(state.getLastMessageAt(), clock.instant());
    return silence.compareTo(heartbeatTimeout) < 0;
  }

  /**
   * Connected devices that have been silent for at least the heartbeat timeout. Stopped,
   * failed and never connected devices are not reported.
   *
   * @return The silent connections
   */
  public List<ConnectionState> getUnhealthyConnections() {
    return repository.findAll().stream()
        .filter(state -> state.getStatus() == ConnectionStatus.CONNECTED)
        .filter(state -> !isHealthy(state))
        .collect(Collectors.toList());
  }

  public List<ConnectionState> getActiveConnections() {
    return repository.findAll().stream()
        .filter(state -> state.getStatus() == ConnectionStatus.CONNECTED)
        .collect(Collectors.toList());
  }

  /**
   * Uptime of the current or most recent session.
   *
   * @param state The connection state
   * @return The uptime, empty if the device never connected
   */
  public Optional<Duration> getUptime(ConnectionState state) {
    if (state.getConnectedAt() == null) {
      return Optional.empty();
    }
    if (state.getStatus() == ConnectionStatus.CONNECTED) {
      return Optional.of(Duration.between(state.getConnectedAt(), clock.instant()));
    }
    if (state.getDisconnectedAt() != null
        && !state.getDisconnectedAt().isBefore(state.getConnectedAt())) {
      return Optional.of(Duration.between(state.getConnectedAt(), state.getDisconnectedAt()));
    }
    return Optional.empty();
  }

  /**
   * Count connections by status.
   *
   * @return The summary
   */
  public ConnectionStatusSummary summarize() {
    List<ConnectionState> states = repository.findAll();
    Map<ConnectionStatus, Long> counts = states.stream()
        .collect(Collectors.groupingBy(ConnectionState::getStatus, Collectors.counting()));
    Function<ConnectionStatus, Integer> count =
        status -> counts.getOrDefault(status, 0L).intValue();

    int total = states.size();
    int connected = count.apply(ConnectionStatus.CONNECTED);
    return ConnectionStatusSummary.builder()
        .total(total)
        .connected(connected)
        .connecting(count.apply(ConnectionStatus.CONNECTING))
        .disconnected(count.apply(ConnectionStatus.DISCONNECTED))
        .error(count.apply(ConnectionStatus.ERROR))
        .stopped(count.apply(ConnectionStatus.STOPPED))
        .healthyPercentage(total == 0 ? 0.0 : connected * 100.0 / total)
        .averageErrorCount(states.stream()
            .mapToInt(ConnectionState::getErrorCount)
            .average()
            .orElse(0.0))
        .build();
  }
}
