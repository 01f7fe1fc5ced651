package com.micboard.realtime.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.micboard.realtime.connection.ConnectionStateMachine;
import com.micboard.realtime.connection.ConnectionStateService;
import com.micboard.realtime.connection.InMemoryConnectionStateRepository;
import com.micboard.realtime.exceptions.NoSuchConnectionException;
import com.micboard.realtime.model.BroadcastMessage;
import com.micboard.realtime.model.BroadcastMessageType;
import com.micboard.realtime.model.ConnectionState;
import com.micboard.realtime.model.ConnectionStatus;
import com.micboard.realtime.model.ConnectionType;
import com.micboard.realtime.model.DeviceEndpoint;
import com.micboard.realtime.retry.ReconnectPolicy;
import com.micboard.realtime.routing.BroadcastHub;
import com.micboard.realtime.routing.Topics;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.publisher.TestPublisher;

@ExtendWith(MockitoExtension.class)
public class TelemetryIngestLoopTest {

  private static final String DEVICE_ID = "rx-1";

  @Mock private AlertNotifier alertNotifier;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private ConnectionStateService stateService;

  private BroadcastHub<BroadcastMessage> hub;

  private List<BroadcastMessage> deviceMessages;

  private List<BroadcastMessage> allMessages;

  /** Setup the tests. */
  @BeforeEach
  public void init() {
    lenient().when(alertNotifier.notify(anyString(), anyString())).thenReturn(Mono.empty());
    stateService = new ConnectionStateService(
        new InMemoryConnectionStateRepository(), new ConnectionStateMachine());
    hub = new BroadcastHub<>();
    deviceMessages = new CopyOnWriteArrayList<>();
    allMessages = new CopyOnWriteArrayList<>();
    hub.subscribe(Topics.deviceTopic(DEVICE_ID), deviceMessages::add);
    hub.subscribe(Topics.ALL_DEVICES, allMessages::add);
  }

  private static DeviceEndpoint endpoint(String deviceId) {
    return DeviceEndpoint.builder()
        .deviceId(deviceId)
        .uri(URI.create("ws://receiver.local/api/v1/" + deviceId))
        .connectionType(ConnectionType.WEBSOCKET)
        .build();
  }

  private TelemetryIngestLoop loop(
      String deviceId, ScriptedDeviceStreamClient client, int maxAttempts, Duration timeout) {
    stateService.register(deviceId, ConnectionType.WEBSOCKET, maxAttempts);
    return TelemetryIngestLoop.builder()
        .endpoint(endpoint(deviceId))
        .streamClient(client)
        .connectionStateService(stateService)
        .broadcastHub(hub)
        .alertNotifier(alertNotifier)
        .reconnectPolicy(ReconnectPolicy.builder()
            .baseDelay(Duration.ofMillis(10))
            .maxDelay(Duration.ofMillis(100))
            .build())
        .messageTimeout(timeout)
        .scheduler(Schedulers.parallel())
        .build();
  }

  private JsonNode reading(int battery) {
    return objectMapper.createObjectNode().put("battery", battery);
  }

  private List<BroadcastMessage> ofType(
      List<BroadcastMessage> messages, BroadcastMessageType type) {
    return messages.stream()
        .filter(message -> message.getType() == type)
        .collect(Collectors.toList());
  }

  @Test
  public void testPayloadsArePublishedInOrder() throws Exception {
    ScriptedDeviceStreamClient client = new ScriptedDeviceStreamClient()
        .thenServe(Flux.concat(Flux.just(reading(90), reading(89), reading(88)), Flux.never()));

    StepVerifier.withVirtualTime(() -> loop(DEVICE_ID, client, 3, Duration.ZERO).run())
        .thenAwait(Duration.ofSeconds(1))
        .thenCancel()
        .verify();

    assertThat(ofType(deviceMessages, BroadcastMessageType.DEVICE_UPDATE))
        .extracting(message -> message.getData().get("battery").asInt())
        .containsExactly(90, 89, 88);
    assertThat(ofType(allMessages, BroadcastMessageType.DEVICE_UPDATE))
        .extracting(BroadcastMessage::getDeviceId)
        .containsExactly(DEVICE_ID, DEVICE_ID, DEVICE_ID);
    assertThat(deviceMessages.get(0).getType()).isEqualTo(BroadcastMessageType.STATUS);
    assertThat(deviceMessages.get(0).getMessage()).isEqualTo("connected");

    ConnectionState state = stateService.load(DEVICE_ID);
    assertThat(state.getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
    assertThat(state.getLastMessageAt()).isNotNull();
  }

  @Test
  public void testReconnectsAfterStreamEnds() throws Exception {
    ScriptedDeviceStreamClient client = new ScriptedDeviceStreamClient()
        .thenServe(Flux.just(reading(90)))
        .thenServe(Flux.concat(Flux.just(reading(70)), Flux.never()));

    StepVerifier.withVirtualTime(() -> loop(DEVICE_ID, client, 3, Duration.ZERO).run())
        .thenAwait(Duration.ofSeconds(1))
        .thenCancel()
        .verify();

    assertThat(client.getConnects()).isEqualTo(2);
    assertThat(ofType(deviceMessages, BroadcastMessageType.DEVICE_UPDATE)).hasSize(2);
    assertThat(deviceMessages).extracting(BroadcastMessage::getMessage)
        .contains("disconnected");

    ConnectionState state = stateService.load(DEVICE_ID);
    assertThat(state.getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
    assertThat(state.getErrorCount()).isZero();
    assertThat(state.getReconnectAttempts()).isZero();
    verify(alertNotifier, never()).notify(anyString(), anyString());
  }

  @Test
  public void testGivesUpOnceAfterMaxAttempts() throws Exception {
    ScriptedDeviceStreamClient client = new ScriptedDeviceStreamClient();

    StepVerifier.withVirtualTime(() -> loop(DEVICE_ID, client, 2, Duration.ZERO).run())
        .thenAwait(Duration.ofMinutes(1))
        .verifyComplete();

    assertThat(client.getConnects()).isEqualTo(3);
    verify(alertNotifier, times(1)).notify(eq(DEVICE_ID), anyString());

    ConnectionState state = stateService.load(DEVICE_ID);
    assertThat(state.getStatus()).isEqualTo(ConnectionStatus.ERROR);
    assertThat(state.getReconnectAttempts()).isEqualTo(2);
    assertThat(state.getErrorCount()).isEqualTo(3);
    assertThat(state.getErrorMessage()).contains("Connection refused");
    assertThat(stateService.getStateMachine().shouldReconnect(state)).isFalse();
    assertThat(deviceMessages).extracting(BroadcastMessage::getMessage)
        .anyMatch(message -> message != null && message.startsWith("Reconnection abandoned"));
  }

  @Test
  public void testSilentStreamIsDisconnected() throws Exception {
    ScriptedDeviceStreamClient client = new ScriptedDeviceStreamClient()
        .thenServe(Flux.never());

    StepVerifier.withVirtualTime(
        () -> loop(DEVICE_ID, client, 0, Duration.ofSeconds(30)).run())
        .thenAwait(Duration.ofSeconds(31))
        .verifyComplete();

    ConnectionState state = stateService.load(DEVICE_ID);
    assertThat(state.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
    assertThat(state.getErrorMessage()).startsWith("No data received within");
    assertThat(state.getErrorCount()).isEqualTo(1);
    verify(alertNotifier).notify(eq(DEVICE_ID), startsWith("Reconnection abandoned"));
  }

  @Test
  public void testStopIsIdempotentAndIsolated() throws Exception {
    TestPublisher<JsonNode> first = TestPublisher.create();
    TestPublisher<JsonNode> second = TestPublisher.create();
    TelemetryIngestLoop firstLoop = loop(DEVICE_ID, new ScriptedDeviceStreamClient()
        .thenServe(first), 3, Duration.ZERO);
    TelemetryIngestLoop secondLoop = loop("rx-2", new ScriptedDeviceStreamClient()
        .thenServe(second), 3, Duration.ZERO);

    firstLoop.start();
    secondLoop.start();
    try {
      assertThat(stateService.load(DEVICE_ID).getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
      assertThat(stateService.load("rx-2").getStatus()).isEqualTo(ConnectionStatus.CONNECTED);

      firstLoop.stop();
      ConnectionState stopped = stateService.load(DEVICE_ID);
      firstLoop.stop();

      assertThat(firstLoop.isRunning()).isFalse();
      assertThat(stateService.load(DEVICE_ID)).isEqualTo(stopped);
      assertThat(stopped.getStatus()).isEqualTo(ConnectionStatus.STOPPED);
      assertThat(deviceMessages).extracting(BroadcastMessage::getMessage)
          .containsOnlyOnce("stopped");
      first.assertCancelled();

      first.next(reading(10));
      assertThat(stateService.load(DEVICE_ID).getStatus()).isEqualTo(ConnectionStatus.STOPPED);

      assertThat(secondLoop.isRunning()).isTrue();
      second.assertNotCancelled();
      second.next(reading(55));
      assertThat(stateService.load("rx-2").getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
      assertThat(ofType(allMessages, BroadcastMessageType.DEVICE_UPDATE))
          .extracting(BroadcastMessage::getDeviceId)
          .containsExactly("rx-2");
    } finally {
      secondLoop.cancel();
    }
    verify(alertNotifier, never()).notify(anyString(), anyString());
  }

  @Test
  public void testStartAfterStopConnectsAgain() throws Exception {
    ScriptedDeviceStreamClient client = new ScriptedDeviceStreamClient()
        .thenServe(Flux.never())
        .thenServe(Flux.never());
    TelemetryIngestLoop loop = loop(DEVICE_ID, client, 3, Duration.ZERO);

    loop.start();
    loop.start();
    assertThat(client.getConnects()).isEqualTo(1);

    loop.stop();
    assertThat(stateService.load(DEVICE_ID).getStatus()).isEqualTo(ConnectionStatus.STOPPED);

    loop.start();
    try {
      assertThat(loop.isRunning()).isTrue();
      assertThat(client.getConnects()).isEqualTo(2);
      assertThat(stateService.load(DEVICE_ID).getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
    } finally {
      loop.cancel();
    }
  }

  @Test
  public void testStopUnregisteredDevice() {
    TelemetryIngestLoop loop = loop(DEVICE_ID, new ScriptedDeviceStreamClient(), 3,
        Duration.ZERO);
    stateService.remove(DEVICE_ID);

    assertThatThrownBy(loop::stop).isInstanceOf(NoSuchConnectionException.class);
  }
}
