package com.micboard.realtime.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.micboard.realtime.connection.ConnectionStateMachine;
import com.micboard.realtime.connection.ConnectionStateService;
import com.micboard.realtime.consumers.HubMessageSender;
import com.micboard.realtime.exceptions.NoDataException;
import com.micboard.realtime.exceptions.NoSuchConnectionException;
import com.micboard.realtime.model.BroadcastMessage;
import com.micboard.realtime.model.ConnectionState;
import com.micboard.realtime.model.ConnectionStatus;
import com.micboard.realtime.model.DeviceEndpoint;
import com.micboard.realtime.retry.ReconnectPolicy;
import com.micboard.realtime.routing.BroadcastHub;
import com.micboard.realtime.routing.Topics;
import com.micboard.realtime.streams.DeviceStream;
import com.micboard.realtime.streams.DeviceStreamClient;
import java.text.MessageFormat;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.java.Log;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the upstream connection of one device.
 *
 * <p>Each cycle marks the device connecting, opens the stream, marks it connected and
 * publishes every payload to the device topic and the all-devices topic. When the stream ends
 * or fails the state is updated and, while the reconnect ceiling allows, the loop waits for
 * the backoff delay and starts another cycle. Once the ceiling is reached the device is left
 * in its failure state and an alert is raised.
 */
@Log
public class TelemetryIngestLoop {

  @Getter
  private final DeviceEndpoint endpoint;

  private final DeviceStreamClient<JsonNode> streamClient;

  private final ConnectionStateService connectionStateService;

  private final ConnectionStateMachine stateMachine;

  private final AlertNotifier alertNotifier;

  private final ReconnectPolicy reconnectPolicy;

  private final Duration messageTimeout;

  private final Scheduler scheduler;

  private final HubMessageSender<BroadcastMessage> sender;

  private final AtomicBoolean stopRequested = new AtomicBoolean(false);

  private final AtomicReference<Disposable> subscription = new AtomicReference<>();

  /**
   * Build an ingest loop for a device.
   *
   * @param endpoint The device to stream from.
   * @param streamClient Opens the upstream stream.
   * @param connectionStateService Holds the device connection state.
   * @param broadcastHub Receives device updates and status messages.
   * @param alertNotifier Told when reconnection gives up.
   * @param reconnectPolicy Backoff between attempts.
   * @param messageTimeout Longest silence before the stream is treated as stale, zero to
   *     disable.
   * @param scheduler Runs backoff delays and timeouts.
   */
  @Builder
  public TelemetryIngestLoop(
      DeviceEndpoint endpoint,
      DeviceStreamClient<JsonNode> streamClient,
      ConnectionStateService connectionStateService,
      BroadcastHub<BroadcastMessage> broadcastHub,
      AlertNotifier alertNotifier,
      ReconnectPolicy reconnectPolicy,
      Duration messageTimeout,
      Scheduler scheduler) {
    this.endpoint = endpoint;
    this.streamClient = streamClient;
    this.connectionStateService = connectionStateService;
    this.stateMachine = connectionStateService.getStateMachine();
    this.alertNotifier = Optional.ofNullable(alertNotifier).orElseGet(LoggingAlertNotifier::new);
    this.reconnectPolicy = Optional.ofNullable(reconnectPolicy)
        .orElseGet(() -> ReconnectPolicy.builder().build());
    this.messageTimeout = Optional.ofNullable(messageTimeout).orElse(Duration.ZERO);
    this.scheduler = Optional.ofNullable(scheduler).orElseGet(Schedulers::parallel);
    this.sender = new HubMessageSender<>(broadcastHub,
        Arrays.asList(Topics.deviceTopic(endpoint.getDeviceId()), Topics.ALL_DEVICES));
  }

  public String getDeviceId() {
    return endpoint.getDeviceId();
  }

  /** Start monitoring. Has no effect while already running. */
  public synchronized void start() {
    if (isRunning()) {
      return;
    }
    stopRequested.set(false);
    log.info(MessageFormat.format("Starting ingest for device {0} from {1}",
        getDeviceId(), endpoint.getUri()));
    subscription.set(run().subscribe(
        ignored -> { },
        error -> log.log(Level.SEVERE,
            MessageFormat.format("Ingest for device {0} failed", getDeviceId()), error),
        () -> log.info(MessageFormat.format("Ingest for device {0} finished", getDeviceId()))));
  }

  /**
   * Stop monitoring and mark the connection stopped. Stopping twice is harmless.
   *
   * @throws NoSuchConnectionException If the device is no longer registered
   */
  public void stop() throws NoSuchConnectionException {
    cancel();
    AtomicBoolean changed = new AtomicBoolean(false);
    connectionStateService.apply(getDeviceId(), state -> {
      if (state.getStatus() == ConnectionStatus.STOPPED) {
        return state;
      }
      changed.set(true);
      return stateMachine.markStopped(state);
    });
    if (changed.get()) {
      log.info(MessageFormat.format("Stopped ingest for device {0}", getDeviceId()));
      publishStatus("stopped");
    }
  }

  /** Tear down the pipeline without touching the connection state. */
  public synchronized void cancel() {
    stopRequested.set(true);
    Disposable disposable = subscription.getAndSet(null);
    if (disposable != null) {
      disposable.dispose();
    }
  }

  public boolean isRunning() {
    Disposable disposable = subscription.get();
    return disposable != null && !disposable.isDisposed();
  }

  /**
   * The full monitoring pipeline. Completes once reconnection gives up or a stop is requested.
   *
   * @return The pipeline
   */
  Mono<Void> run() {
    return Mono.defer(() -> connectAndReceive().then(Mono.defer(this::awaitReconnect)))
        .repeat()
        .takeWhile(Boolean::booleanValue)
        .then();
  }

  protected Mono<Void> connectAndReceive() {
    return transition(stateMachine::markConnecting)
        .then(Mono.usingWhen(streamClient.connect(endpoint), this::receive, DeviceStream::close))
        .then(Mono.defer(this::onStreamEnded))
        .onErrorResume(this::onStreamFailed);
  }

  protected Mono<Void> receive(DeviceStream<JsonNode> stream) {
    return transition(stateMachine::markConnected)
        .doOnNext(state -> {
          log.info(MessageFormat.format("Device {0} connected", getDeviceId()));
          publishStatus("connected");
        })
        .thenMany(messages(stream))
        .concatMap(payload -> transition(stateMachine::receivedMessage)
            .doOnNext(state -> sender.accept(
                BroadcastMessage.deviceUpdate(getDeviceId(), payload))))
        .then();
  }

  protected Flux<JsonNode> messages(DeviceStream<JsonNode> stream) {
    Flux<JsonNode> messages = Mono.defer(stream::nextMessage)
        .map(Optional::of)
        .defaultIfEmpty(Optional.empty())
        .repeat()
        .takeWhile(Optional::isPresent)
        .map(Optional::get);
    if (messageTimeout.isZero() || messageTimeout.isNegative()) {
      return messages;
    }
    return messages
        .timeout(messageTimeout, scheduler)
        .onErrorMap(TimeoutException.class, error -> new NoDataException(
            "No data received within " + messageTimeout, error));
  }

  protected Mono<Void> onStreamEnded() {
    return transition(stateMachine::markDisconnected)
        .doOnNext(state -> {
          log.info(MessageFormat.format("Device {0} stream ended", getDeviceId()));
          publishStatus("disconnected");
        })
        .then();
  }

  protected Mono<Void> onStreamFailed(Throwable error) {
    String reason = Optional.ofNullable(error.getMessage())
        .filter(message -> !message.isEmpty())
        .orElse(error.getClass().getSimpleName());
    UnaryOperator<ConnectionState> failure = error instanceof NoDataException
        ? state -> stateMachine.markDisconnected(state, reason)
        : state -> stateMachine.markError(state, reason);
    return transition(failure)
        .doOnNext(state -> {
          log.log(Level.WARNING, MessageFormat.format(
              "Device {0} connection failed: {1}", getDeviceId(), reason));
          publishStatus("disconnected: " + reason);
        })
        .then();
  }

  protected Mono<Boolean> awaitReconnect() {
    return Mono.fromCallable(() -> connectionStateService.load(getDeviceId()))
        .flatMap(state -> {
          if (stopRequested.get() || state.getStatus() == ConnectionStatus.STOPPED) {
            return Mono.just(false);
          }
          if (stateMachine.shouldReconnect(state)) {
            Duration delay = reconnectPolicy.getDelay(state.getReconnectAttempts());
            log.info(MessageFormat.format("Device {0} will reconnect in {1} (attempt {2} of {3})",
                getDeviceId(), delay, state.getReconnectAttempts() + 1,
                state.getMaxReconnectAttempts()));
            return Mono.delay(delay, scheduler)
                .then(transition(stateMachine::incrementReconnectAttempt))
                .map(next -> true)
                .defaultIfEmpty(false);
          }
          return giveUp(state).thenReturn(false);
        });
  }

  protected Mono<Void> giveUp(ConnectionState state) {
    String reason = MessageFormat.format(
        "Reconnection abandoned after {0} attempts, last error: {1}",
        state.getReconnectAttempts(), state.getErrorMessage());
    log.log(Level.WARNING, MessageFormat.format("Device {0}: {1}", getDeviceId(), reason));
    publishStatus(reason);
    return alertNotifier.notify(getDeviceId(), reason)
        .onErrorResume(error -> {
          log.log(Level.WARNING, "Unable to raise alert for device " + getDeviceId(), error);
          return Mono.empty();
        });
  }

  /**
   * Apply a transition unless a stop has been requested, in which case the state is left as
   * it is and the result is empty.
   */
  private Mono<ConnectionState> transition(UnaryOperator<ConnectionState> operation) {
    return Mono.fromCallable(() -> {
      AtomicBoolean applied = new AtomicBoolean(false);
      ConnectionState state = connectionStateService.apply(getDeviceId(), current -> {
        if (stopRequested.get()) {
          return current;
        }
        applied.set(true);
        return operation.apply(current);
      });
      return applied.get() ? state : null;
    });
  }

  private void publishStatus(String message) {
    sender.accept(BroadcastMessage.status(getDeviceId(), message));
  }
}
