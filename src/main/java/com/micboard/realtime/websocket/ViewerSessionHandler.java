package com.micboard.realtime.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.micboard.realtime.exceptions.DeliveryFailedException;
import com.micboard.realtime.model.BroadcastMessage;
import com.micboard.realtime.model.ViewerCommand;
import com.micboard.realtime.routing.BroadcastHub;
import com.micboard.realtime.routing.TopicSubscription;
import com.micboard.realtime.routing.Topics;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.extern.java.Log;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

/**
 * Browser-facing WebSocket endpoint.
 *
 * <p>Each session subscribes to the topic of every {@code device} query parameter, or to the
 * all-devices topic when none is given, and receives the matching broadcast messages as JSON.
 * The only inbound command is {@code {"command":"ping"}}, answered with
 * {@code {"type":"pong"}}. Any other input is ignored.
 */
@Log
public class ViewerSessionHandler implements WebSocketHandler {
  public static final String DEVICE_PARAMETER = "device";

  public static final int DEFAULT_BUFFER_SIZE = 256;

  private final BroadcastHub<BroadcastMessage> broadcastHub;

  private final ObjectMapper objectMapper;

  private final int bufferSize;

  private final Function<WebSocketSession, List<String>> topicResolver;

  /**
   * Build a viewer session handler.
   *
   * @param broadcastHub Source of messages for viewers.
   * @param objectMapper Serializes outbound messages and parses commands.
   * @param bufferSize Messages queued per viewer before the session is dropped.
   * @param topicResolver Chooses the topics a session subscribes to.
   */
  @Builder
  public ViewerSessionHandler(
      BroadcastHub<BroadcastMessage> broadcastHub,
      ObjectMapper objectMapper,
      Integer bufferSize,
      Function<WebSocketSession, List<String>> topicResolver) {
    this.broadcastHub = broadcastHub;
    this.objectMapper = objectMapper;
    this.bufferSize = Optional.ofNullable(bufferSize).orElse(DEFAULT_BUFFER_SIZE);
    this.topicResolver = Optional.ofNullable(topicResolver)
        .orElse(ViewerSessionHandler::resolveDeviceTopics);
  }

  @Override
  public Mono<Void> handle(WebSocketSession session) {
    return Mono.defer(() -> {
      ViewerSession viewer = new ViewerSession(session.getId(), objectMapper, bufferSize);
      List<TopicSubscription> subscriptions = topicResolver.apply(session).stream()
          .map(topic -> broadcastHub.subscribe(topic, viewer::send))
          .collect(Collectors.toList());
      log.info(MessageFormat.format("Viewer {0} subscribed to {1}", session.getId(),
          subscriptions.stream().map(TopicSubscription::getTopic).collect(Collectors.toList())));

      Mono<Void> input = session.receive()
          .map(WebSocketMessage::getPayloadAsText)
          .doOnNext(payload -> handleCommand(viewer, payload))
          .then()
          .doFinally(signalType -> viewer.complete());

      Mono<Void> output = session.send(viewer.asFlux().map(session::textMessage));

      return Mono.zip(input, output).then()
          .doFinally(signalType -> {
            subscriptions.forEach(broadcastHub::unsubscribe);
            log.info(MessageFormat.format(
                "Viewer {0} closed with signal {1}", session.getId(), signalType));
          });
    });
  }

  protected void handleCommand(ViewerSession viewer, String payload) {
    log.log(Level.FINE, "\u001B[34mRECEIVED {0}\u001B[0m from {1}",
        new Object[] {payload, viewer.getId()});
    ViewerCommand command;
    try {
      command = objectMapper.readValue(payload, ViewerCommand.class);
    } catch (JsonProcessingException ex) {
      log.log(Level.FINE, MessageFormat.format(
          "Ignoring malformed command from viewer {0}", viewer.getId()), ex);
      return;
    }

    if (command == null || !command.isPing()) {
      log.log(Level.FINE, MessageFormat.format(
          "Ignoring unknown command from viewer {0}: {1}", viewer.getId(), payload));
      return;
    }

    try {
      viewer.send(BroadcastMessage.pong());
    } catch (DeliveryFailedException ex) {
      log.log(Level.WARNING, "Unable to answer ping", ex);
    }
  }

  /**
   * Subscribe to the topic of each {@code device} query parameter, or to all devices.
   *
   * @param session The viewer session
   * @return The topics to subscribe to
   */
  public static List<String> resolveDeviceTopics(WebSocketSession session) {
    List<String> deviceIds = UriComponentsBuilder
        .fromUri(session.getHandshakeInfo().getUri())
        .build()
        .getQueryParams()
        .getOrDefault(DEVICE_PARAMETER, Collections.emptyList());
    List<String> topics = deviceIds.stream()
        .filter(deviceId -> deviceId != null && !deviceId.isBlank())
        .map(deviceId -> UriUtils.decode(deviceId, StandardCharsets.UTF_8))
        .distinct()
        .map(Topics::deviceTopic)
        .collect(Collectors.toList());
    return topics.isEmpty() ? Collections.singletonList(Topics.ALL_DEVICES) : topics;
  }
}
