package com.micboard.realtime.connection;

import com.micboard.realtime.model.ConnectionStatusSummary;
import java.text.MessageFormat;
import java.time.Duration;
import java.util.logging.Level;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

/** Periodically logs a connection health summary. A zero interval disables reporting. */
@Log
@RequiredArgsConstructor
public class ConnectionHealthReporter {

  private final ConnectionHealthService healthService;
  private final Duration interval;
  private final Scheduler scheduler;

  private Disposable subscription;

  /** Start reporting. Has no effect if already started or disabled. */
  public synchronized void start() {
    if (subscription != null || interval.isZero() || interval.isNegative()) {
      return;
    }
    subscription = Flux.interval(interval, scheduler)
        .subscribe(tick -> report(),
            error -> log.log(Level.WARNING, "Connection health reporting failed", error));
  }

  public synchronized void stop() {
    if (subscription != null) {
      subscription.dispose();
      subscription = null;
    }
  }

  public synchronized boolean isRunning() {
    return subscription != null && !subscription.isDisposed();
  }

  void report() {
    try {
      logHealth();
    } catch (RuntimeException ex) {
      log.log(Level.WARNING, "Unable to report connection health", ex);
    }
  }

  private void logHealth() {
    ConnectionStatusSummary summary = healthService.summarize();
    log.log(Level.INFO, MessageFormat.format(
        "Connections: {0} total, {1} connected, {2} connecting, {3} disconnected, "
            + "{4} error, {5} stopped ({6,number,#.#}% healthy)",
        summary.getTotal(), summary.getConnected(), summary.getConnecting(),
        summary.getDisconnected(), summary.getError(), summary.getStopped(),
        summary.getHealthyPercentage()));
    healthService.getUnhealthyConnections().forEach(state ->
        log.log(Level.WARNING, MessageFormat.format(
            "Device {0} connection is unhealthy: {1} {2}",
            state.getDeviceId(), state.getStatus(), state.getErrorMessage())));
  }
}
