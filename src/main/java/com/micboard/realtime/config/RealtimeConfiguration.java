package com.micboard.realtime.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.micboard.realtime.connection.ConnectionHealthReporter;
import com.micboard.realtime.connection.ConnectionHealthService;
import com.micboard.realtime.connection.ConnectionStateMachine;
import com.micboard.realtime.connection.ConnectionStateRepository;
import com.micboard.realtime.connection.ConnectionStateService;
import com.micboard.realtime.connection.InMemoryConnectionStateRepository;
import com.micboard.realtime.ingest.AlertNotifier;
import com.micboard.realtime.ingest.LoggingAlertNotifier;
import com.micboard.realtime.ingest.TelemetryIngestService;
import com.micboard.realtime.model.BroadcastMessage;
import com.micboard.realtime.model.ConnectionType;
import com.micboard.realtime.model.DeviceEndpoint;
import com.micboard.realtime.retry.ReconnectPolicy;
import com.micboard.realtime.routing.BroadcastHub;
import com.micboard.realtime.streams.ConditionalDeviceStreamClient;
import com.micboard.realtime.streams.DeviceStreamClient;
import com.micboard.realtime.streams.SseDeviceStreamClient;
import com.micboard.realtime.streams.WebSocketDeviceStreamClient;
import com.micboard.realtime.websocket.ViewerSessionHandler;
import java.time.Clock;
import java.util.Collections;
import lombok.extern.java.Log;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Log
@Configuration
@EnableConfigurationProperties(RealtimeProperties.class)
public class RealtimeConfiguration {

  @Bean
  Clock realtimeClock() {
    return Clock.systemUTC();
  }

  @Bean
  Scheduler realtimeScheduler() {
    return Schedulers.parallel();
  }

  @Bean
  ConnectionStateMachine connectionStateMachine(Clock realtimeClock) {
    return new ConnectionStateMachine(realtimeClock);
  }

  @Bean
  ConnectionStateRepository connectionStateRepository() {
    return new InMemoryConnectionStateRepository();
  }

  @Bean
  ConnectionStateService connectionStateService(
      ConnectionStateRepository connectionStateRepository,
      ConnectionStateMachine connectionStateMachine) {
    return new ConnectionStateService(connectionStateRepository, connectionStateMachine);
  }

  @Bean
  ConnectionHealthService connectionHealthService(
      ConnectionStateRepository connectionStateRepository,
      Clock realtimeClock,
      RealtimeProperties properties) {
    return new ConnectionHealthService(
        connectionStateRepository, realtimeClock, properties.getHeartbeatTimeout());
  }

  @Bean(initMethod = "start", destroyMethod = "stop")
  ConnectionHealthReporter connectionHealthReporter(
      ConnectionHealthService connectionHealthService,
      Scheduler realtimeScheduler,
      RealtimeProperties properties) {
    return new ConnectionHealthReporter(
        connectionHealthService, properties.getHealthReportInterval(), realtimeScheduler);
  }

  @Bean
  BroadcastHub<BroadcastMessage> broadcastHub() {
    return new BroadcastHub<>();
  }

  @Bean
  ReconnectPolicy reconnectPolicy(RealtimeProperties properties) {
    return ReconnectPolicy.builder()
        .baseDelay(properties.getReconnectBaseDelay())
        .maxDelay(properties.getReconnectMaxDelay())
        .build();
  }

  @Bean
  AlertNotifier alertNotifier() {
    return new LoggingAlertNotifier();
  }

  @Bean
  WebClient deviceWebClient() {
    return WebClient.create();
  }

  @Bean
  WebSocketClient deviceWebSocketClient() {
    return new ReactorNettyWebSocketClient();
  }

  @Bean
  DeviceStreamClient<JsonNode> deviceStreamClient(
      WebClient deviceWebClient,
      WebSocketClient deviceWebSocketClient,
      ObjectMapper objectMapper) {
    ConditionalDeviceStreamClient<JsonNode> client = new ConditionalDeviceStreamClient<>();
    client.addClient(
        SseDeviceStreamClient.builder()
            .webClient(deviceWebClient)
            .objectMapper(objectMapper)
            .build(),
        endpoint -> endpoint.getConnectionType() == ConnectionType.SSE);
    client.addClient(
        WebSocketDeviceStreamClient.builder()
            .webSocketClient(deviceWebSocketClient)
            .objectMapper(objectMapper)
            .build(),
        endpoint -> endpoint.getConnectionType() == ConnectionType.WEBSOCKET);
    return client;
  }

  @Bean(destroyMethod = "stopAll")
  TelemetryIngestService telemetryIngestService(
      DeviceStreamClient<JsonNode> deviceStreamClient,
      ConnectionStateService connectionStateService,
      BroadcastHub<BroadcastMessage> broadcastHub,
      AlertNotifier alertNotifier,
      ReconnectPolicy reconnectPolicy,
      Scheduler realtimeScheduler,
      RealtimeProperties properties) {
    return TelemetryIngestService.builder()
        .streamClient(deviceStreamClient)
        .connectionStateService(connectionStateService)
        .broadcastHub(broadcastHub)
        .alertNotifier(alertNotifier)
        .reconnectPolicy(reconnectPolicy)
        .maxReconnectAttempts(properties.getMaxReconnectAttempts())
        .messageTimeout(properties.getMessageTimeout())
        .scheduler(realtimeScheduler)
        .build();
  }

  @Bean
  ViewerSessionHandler viewerSessionHandler(
      BroadcastHub<BroadcastMessage> broadcastHub,
      ObjectMapper objectMapper,
      RealtimeProperties properties) {
    return ViewerSessionHandler.builder()
        .broadcastHub(broadcastHub)
        .objectMapper(objectMapper)
        .bufferSize(properties.getViewerBufferSize())
        .build();
  }

  @Bean
  HandlerMapping viewerHandlerMapping(
      ViewerSessionHandler viewerSessionHandler, RealtimeProperties properties) {
    return new SimpleUrlHandlerMapping(
        Collections.singletonMap(properties.getViewerPath(), viewerSessionHandler), -1);
  }

  @Bean
  WebSocketHandlerAdapter webSocketHandlerAdapter() {
    return new WebSocketHandlerAdapter();
  }

  @Bean
  ApplicationRunner deviceMonitorRunner(
      TelemetryIngestService telemetryIngestService, RealtimeProperties properties) {
    return args -> properties.getDevices().forEach(device -> {
      log.info("Monitoring configured device " + device.getId());
      telemetryIngestService.monitor(DeviceEndpoint.builder()
          .deviceId(device.getId())
          .uri(device.getUri())
          .connectionType(device.getConnectionType())
          .build());
    });
  }
}
