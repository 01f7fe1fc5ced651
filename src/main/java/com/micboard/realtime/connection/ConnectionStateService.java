package com.micboard.realtime.connection;

import com.micboard.realtime.exceptions.NoSuchConnectionException;
import com.micboard.realtime.model.ConnectionState;
import com.micboard.realtime.model.ConnectionType;
import java.text.MessageFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;

/**
 * Applies state machine transitions to stored connection states.
 *
 * <p>Each load, transition and save sequence runs under a per-device lock, so concurrent
 * updates to the same device are serialized while different devices proceed independently.
 */
@Log
@RequiredArgsConstructor
public class ConnectionStateService {

  private final ConnectionStateRepository repository;

  @Getter
  private final ConnectionStateMachine stateMachine;

  private final Map<String, Object> locks = new ConcurrentHashMap<>();

  /**
   * Get or create the connection state of a device.
   *
   * @param deviceId The device
   * @param connectionType How the device streams
   * @param maxReconnectAttempts Retry ceiling for the device
   * @return The registered state
   */
  public ConnectionState register(
      String deviceId, ConnectionType connectionType, int maxReconnectAttempts) {
    synchronized (lockFor(deviceId)) {
      ConnectionState state = repository.load(deviceId)
          .map(existing -> existing.toBuilder()
              .connectionType(connectionType)
              .maxReconnectAttempts(maxReconnectAttempts)
              .build())
          .orElseGet(() -> {
            log.log(Level.INFO, MessageFormat.format(
                "Registering {0} connection for device {1}", connectionType, deviceId));
            return ConnectionState.create(deviceId, connectionType, maxReconnectAttempts);
          });
      return repository.save(state);
    }
  }

  public ConnectionState load(String deviceId) throws NoSuchConnectionException {
    return repository.load(deviceId)
        .orElseThrow(() -> new NoSuchConnectionException(deviceId));
  }

  public List<ConnectionState> findAll() {
    return repository.findAll();
  }

  /**
   * Load, transition and save a device's state as one step.
   *
   * @param deviceId The device
   * @param transition The transition to apply
   * @return The saved state
   * @throws NoSuchConnectionException If the device is not registered
   */
  public ConnectionState apply(String deviceId, UnaryOperator<ConnectionState> transition)
      throws NoSuchConnectionException {
    synchronized (lockFor(deviceId)) {
      ConnectionState current = load(deviceId);
      ConnectionState next = transition.apply(current);
      if (current.getStatus() != next.getStatus()) {
        log.log(Level.FINE, MessageFormat.format("Device {0} connection {1} -> {2}",
            deviceId, current.getStatus(), next.getStatus()));
      }
      return repository.save(next);
    }
  }

  public ConnectionState markConnecting(String deviceId) throws NoSuchConnectionException {
    return apply(deviceId, stateMachine::markConnecting);
  }

  public ConnectionState markConnected(String deviceId) throws NoSuchConnectionException {
    return apply(deviceId, stateMachine::markConnected);
  }

  public ConnectionState markDisconnected(String deviceId, String errorMessage)
      throws NoSuchConnectionException {
    return apply(deviceId, state -> stateMachine.markDisconnected(state, errorMessage));
  }

  public ConnectionState markError(String deviceId, String errorMessage)
      throws NoSuchConnectionException {
    return apply(deviceId, state -> stateMachine.markError(state, errorMessage));
  }

  public ConnectionState markStopped(String deviceId) throws NoSuchConnectionException {
    return apply(deviceId, stateMachine::markStopped);
  }

  public ConnectionState receivedMessage(String deviceId) throws NoSuchConnectionException {
    return apply(deviceId, stateMachine::receivedMessage);
  }

  public ConnectionState incrementReconnectAttempt(String deviceId)
      throws NoSuchConnectionException {
    return apply(deviceId, stateMachine::incrementReconnectAttempt);
  }

  public ConnectionState resetReconnectAttempts(String deviceId)
      throws NoSuchConnectionException {
    return apply(deviceId, stateMachine::resetReconnectAttempts);
  }

  public boolean shouldReconnect(String deviceId) throws NoSuchConnectionException {
    return stateMachine.shouldReconnect(load(deviceId));
  }

  /**
   * Forget a device. Only call this once the device itself has been removed.
   *
   * @param deviceId The device
   * @return true if a state was deleted
   */
  public boolean remove(String deviceId) {
    synchronized (lockFor(deviceId)) {
      boolean removed = repository.delete(deviceId);
      locks.remove(deviceId);
      return removed;
    }
  }

  private Object lockFor(String deviceId) {
    return locks.computeIfAbsent(deviceId, id -> new Object());
  }
}
