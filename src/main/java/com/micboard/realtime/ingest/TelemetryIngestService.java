package com.micboard.realtime.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.micboard.realtime.connection.ConnectionStateService;
import com.micboard.realtime.exceptions.NoSuchConnectionException;
import com.micboard.realtime.model.BroadcastMessage;
import com.micboard.realtime.model.ConnectionState;
import com.micboard.realtime.model.DeviceEndpoint;
import com.micboard.realtime.retry.ReconnectPolicy;
import com.micboard.realtime.routing.BroadcastHub;
import com.micboard.realtime.streams.DeviceStreamClient;
import java.text.MessageFormat;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import javax.annotation.Nonnull;
import lombok.Builder;
import lombok.extern.java.Log;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/** Keeps one {@link TelemetryIngestLoop} per monitored device. */
@Log
@Builder
public class TelemetryIngestService {

  @Nonnull
  private final DeviceStreamClient<JsonNode> streamClient;

  @Nonnull
  private final ConnectionStateService connectionStateService;

  @Nonnull
  private final BroadcastHub<BroadcastMessage> broadcastHub;

  @Builder.Default private final AlertNotifier alertNotifier = new LoggingAlertNotifier();

  @Builder.Default private final ReconnectPolicy reconnectPolicy =
      ReconnectPolicy.builder().build();

  @Builder.Default private final int maxReconnectAttempts =
      ConnectionState.DEFAULT_MAX_RECONNECT_ATTEMPTS;

  @Builder.Default private final Duration messageTimeout = Duration.ZERO;

  @Builder.Default private final Scheduler scheduler = Schedulers.parallel();

  private final Map<String, TelemetryIngestLoop> loops = new ConcurrentHashMap<>();

  /**
   * Register a device and start streaming from it. Monitoring an already monitored device
   * with a new endpoint replaces its loop.
   *
   * @param endpoint The device endpoint
   * @return The running loop
   */
  public TelemetryIngestLoop monitor(DeviceEndpoint endpoint) {
    String deviceId = endpoint.getDeviceId();
    connectionStateService.register(
        deviceId, endpoint.getConnectionType(), maxReconnectAttempts);

    TelemetryIngestLoop loop = loops.compute(deviceId, (key, existing) -> {
      if (existing != null && existing.getEndpoint().equals(endpoint)) {
        return existing;
      }
      if (existing != null) {
        log.info(MessageFormat.format(
            "Device {0} endpoint changed to {1}", deviceId, endpoint.getUri()));
        existing.cancel();
      }
      return createLoop(endpoint);
    });
    loop.start();
    return loop;
  }

  /**
   * Stop streaming from a device. The device stays registered.
   *
   * @param deviceId The device
   * @throws NoSuchConnectionException If the device is not registered
   */
  public void stop(String deviceId) throws NoSuchConnectionException {
    TelemetryIngestLoop loop = loops.get(deviceId);
    if (loop == null) {
      connectionStateService.markStopped(deviceId);
      return;
    }
    loop.stop();
  }

  /**
   * Restart a stopped or exhausted device with a fresh reconnect budget.
   *
   * @param deviceId The device
   * @throws NoSuchConnectionException If the device is not monitored
   */
  public void resume(String deviceId) throws NoSuchConnectionException {
    TelemetryIngestLoop loop = getLoop(deviceId)
        .orElseThrow(() -> new NoSuchConnectionException(deviceId));
    connectionStateService.resetReconnectAttempts(deviceId);
    log.info(MessageFormat.format("Resuming ingest for device {0}", deviceId));
    loop.start();
  }

  /**
   * Stop streaming from a device and forget its connection state.
   *
   * @param deviceId The device
   * @return true if the device was known
   */
  public boolean remove(String deviceId) {
    TelemetryIngestLoop loop = loops.remove(deviceId);
    if (loop != null) {
      loop.cancel();
    }
    boolean removed = connectionStateService.remove(deviceId);
    if (removed) {
      log.info(MessageFormat.format("Removed device {0}", deviceId));
    }
    return loop != null || removed;
  }

  /** Stop every loop. */
  public void stopAll() {
    loops.values().forEach(loop -> {
      try {
        loop.stop();
      } catch (NoSuchConnectionException ex) {
        log.log(Level.WARNING, "Stopping a loop for an unregistered device", ex);
      }
    });
  }

  public Optional<TelemetryIngestLoop> getLoop(String deviceId) {
    return Optional.ofNullable(loops.get(deviceId));
  }

  public Set<String> getDeviceIds() {
    return new TreeSet<>(loops.keySet());
  }

  protected TelemetryIngestLoop createLoop(DeviceEndpoint endpoint) {
    return TelemetryIngestLoop.builder()
        .endpoint(endpoint)
        .streamClient(streamClient)
        .connectionStateService(connectionStateService)
        .broadcastHub(broadcastHub)
        .alertNotifier(alertNotifier)
        .reconnectPolicy(reconnectPolicy)
        .messageTimeout(messageTimeout)
        .scheduler(scheduler)
        .build();
  }
}
