package com.micboard.realtime.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.micboard.realtime.exceptions.DeliveryFailedException;
import com.micboard.realtime.model.BroadcastMessage;
import java.text.MessageFormat;
import java.util.logging.Level;
import lombok.Getter;
import lombok.extern.java.Log;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Outbound side of one viewer connection.
 *
 * <p>Messages are serialized and queued in a bounded buffer until the socket takes them. When
 * the buffer is full the outbound flux fails, which closes the session.
 */
@Log
public class ViewerSession {

  @Getter
  private final String id;

  private final ObjectMapper objectMapper;

  private final Sinks.Many<String> sendSink;

  ViewerSession(String id, ObjectMapper objectMapper, int bufferSize) {
    this.id = id;
    this.objectMapper = objectMapper;
    this.sendSink = Sinks.many().unicast()
        .onBackpressureBuffer(Queues.<String>get(bufferSize).get());
  }

  /**
   * Queue a message for this viewer.
   *
   * @param message The message
   * @throws DeliveryFailedException If the viewer cannot take the message
   */
  public synchronized void send(BroadcastMessage message) throws DeliveryFailedException {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      throw new DeliveryFailedException("Unable to serialize " + message.getType(), ex);
    }

    Sinks.EmitResult result = sendSink.tryEmitNext(payload);
    if (result == Sinks.EmitResult.FAIL_OVERFLOW
        || result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
      // A full buffer is reported as zero subscribers until the socket starts sending.
      DeliveryFailedException overflow = new DeliveryFailedException(
          MessageFormat.format("Viewer {0} send buffer is full", id));
      sendSink.tryEmitError(overflow);
      throw overflow;
    } else if (result.isFailure()) {
      throw new DeliveryFailedException(
          MessageFormat.format("Viewer {0} is not accepting messages ({1})", id, result));
    }
    log.log(Level.FINE, "\u001B[32mSENDING  ↑ {0}\u001B[0m to {1}", new Object[] {payload, id});
  }

  public synchronized void complete() {
    sendSink.tryEmitComplete();
  }

  public Flux<String> asFlux() {
    return sendSink.asFlux();
  }
}
