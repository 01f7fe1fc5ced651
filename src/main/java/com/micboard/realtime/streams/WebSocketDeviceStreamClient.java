package com.micboard.realtime.streams;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.micboard.realtime.exceptions.ConnectionFailedException;
import com.micboard.realtime.mappers.JsonPayloadDecoder;
import com.micboard.realtime.model.DeviceEndpoint;
import java.net.URI;
import java.text.MessageFormat;
import java.util.logging.Level;
import javax.annotation.Nonnull;
import lombok.Builder;
import lombok.extern.java.Log;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Streams JSON text frames from a device WebSocket.
 *
 * <p>The connect completes once the session is open. The stream ends when the remote side
 * closes the socket, and closing the stream closes the socket.
 */
@Log
@Builder
public class WebSocketDeviceStreamClient implements DeviceStreamClient<JsonNode> {

  @Nonnull
  protected final WebSocketClient webSocketClient;

  @Nonnull
  protected final ObjectMapper objectMapper;

  @Builder.Default private Mono<HttpHeaders> webSocketHeadersProvider
      = Mono.fromSupplier(HttpHeaders::new);

  @Override
  public Mono<DeviceStream<JsonNode>> connect(DeviceEndpoint endpoint) {
    return Mono.defer(() -> {
      Sinks.One<WebSocketSession> sessionSink = Sinks.one();
      Sinks.Many<String> receiveSink = Sinks.many().unicast().onBackpressureBuffer();
      URI transportUri = endpoint.getUri();

      Mono<Void> openSocket = webSocketHeadersProvider
          .flatMap(headers -> {
            log.info("Connecting to " + transportUri);
            return webSocketClient.execute(
                transportUri, headers, createHandler(sessionSink, receiveSink));
          })
          .doOnError(sessionSink::tryEmitError)
          .doFinally(signal -> {
            receiveSink.tryEmitComplete();
            sessionSink.tryEmitEmpty();
            log.info(MessageFormat.format(
                "Socket to {0} closed with signal {1}", transportUri, signal));
          });

      JsonPayloadDecoder decoder = new JsonPayloadDecoder(objectMapper, endpoint.getDeviceId());
      Flux<JsonNode> payloads = Flux.merge(
          openSocket.then(Mono.<String>empty()),
          receiveSink.asFlux())
          .concatMap(decoder);

      PulledDeviceStream<JsonNode> stream = PulledDeviceStream.of(payloads);
      return sessionSink.asMono()
          .switchIfEmpty(Mono.error(() -> new ConnectionFailedException(
              "WebSocket to " + transportUri + " closed before opening")))
          .<DeviceStream<JsonNode>>thenReturn(stream)
          .onErrorResume(error -> stream.close().then(Mono.<DeviceStream<JsonNode>>error(
              error instanceof ConnectionFailedException ? error
                  : new ConnectionFailedException(
                      "Unable to connect to " + transportUri, error))))
          .doOnCancel(stream::dispose);
    });
  }

  protected WebSocketHandler createHandler(
      Sinks.One<WebSocketSession> sessionSink, Sinks.Many<String> receiveSink) {
    return session -> {
      log.info(MessageFormat.format("Handled opened session ({0})", session.getId()));
      sessionSink.tryEmitValue(session);
      return session.receive()
          .map(message -> message.getPayloadAsText())
          .doOnNext(payload -> {
            log.log(Level.FINE, "\u001B[34mRECEIVED {0}\u001B[0m", new Object[] {payload});
            receiveSink.tryEmitNext(payload);
          })
          .then();
    };
  }
}
