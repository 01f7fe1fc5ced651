package com.micboard.realtime.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.micboard.realtime.exceptions.NoSuchConnectionException;
import com.micboard.realtime.model.ConnectionState;
import com.micboard.realtime.model.ConnectionStatus;
import com.micboard.realtime.model.ConnectionType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ConnectionStateServiceTest {

  private InMemoryConnectionStateRepository repository;

  private ConnectionStateService service;

  /** Setup the tests. */
  @BeforeEach
  public void init() {
    repository = new InMemoryConnectionStateRepository();
    service = new ConnectionStateService(repository, new ConnectionStateMachine(
        new ConnectionStateMachineTest.MutableClock(Instant.parse("2024-03-01T10:00:00Z"))));
  }

  @Test
  public void testRegisterCreatesDisconnectedState() {
    ConnectionState state = service.register("rx-1", ConnectionType.SSE, 4);

    assertThat(state.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
    assertThat(state.getMaxReconnectAttempts()).isEqualTo(4);
    assertThat(repository.load("rx-1")).contains(state);
  }

  @Test
  public void testRegisterKeepsExistingHistory() throws Exception {
    service.register("rx-1", ConnectionType.SSE, 4);
    service.markError("rx-1", "refused");

    ConnectionState state = service.register("rx-1", ConnectionType.WEBSOCKET, 6);

    assertThat(state.getStatus()).isEqualTo(ConnectionStatus.ERROR);
    assertThat(state.getErrorCount()).isEqualTo(1);
    assertThat(state.getConnectionType()).isEqualTo(ConnectionType.WEBSOCKET);
    assertThat(state.getMaxReconnectAttempts()).isEqualTo(6);
  }

  @Test
  public void testTransitionsAreSaved() throws Exception {
    service.register("rx-1", ConnectionType.SSE, 4);

    service.markConnecting("rx-1");
    assertThat(service.load("rx-1").getStatus()).isEqualTo(ConnectionStatus.CONNECTING);

    service.markConnected("rx-1");
    service.receivedMessage("rx-1");
    assertThat(service.load("rx-1").getStatus()).isEqualTo(ConnectionStatus.CONNECTED);

    service.markDisconnected("rx-1", "No data");
    service.incrementReconnectAttempt("rx-1");
    ConnectionState state = service.load("rx-1");
    assertThat(state.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
    assertThat(state.getErrorCount()).isEqualTo(1);
    assertThat(state.getReconnectAttempts()).isEqualTo(1);
    assertThat(service.shouldReconnect("rx-1")).isTrue();

    service.resetReconnectAttempts("rx-1");
    service.markStopped("rx-1");
    state = service.load("rx-1");
    assertThat(state.getStatus()).isEqualTo(ConnectionStatus.STOPPED);
    assertThat(state.getReconnectAttempts()).isZero();
    assertThat(service.shouldReconnect("rx-1")).isFalse();
  }

  @Test
  public void testUnknownDevice() {
    assertThatThrownBy(() -> service.markConnecting("missing"))
        .isInstanceOf(NoSuchConnectionException.class)
        .hasMessageContaining("missing");
  }

  @Test
  public void testRemove() {
    service.register("rx-1", ConnectionType.SSE, 4);

    assertThat(service.remove("rx-1")).isTrue();
    assertThat(service.remove("rx-1")).isFalse();
    assertThat(service.findAll()).isEmpty();
  }

  @Test
  public void testConcurrentUpdatesToOneDeviceAreSerialized() throws Exception {
    service.register("rx-1", ConnectionType.SSE, 10_000);
    int threads = 8;
    int increments = 500;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      futures.add(executor.submit(() -> {
        start.await();
        for (int j = 0; j < increments; j++) {
          service.incrementReconnectAttempt("rx-1");
        }
        return null;
      }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }
    executor.shutdown();

    assertThat(service.load("rx-1").getReconnectAttempts()).isEqualTo(threads * increments);
  }
}
