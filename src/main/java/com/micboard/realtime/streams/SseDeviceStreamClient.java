package com.micboard.realtime.streams;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.micboard.realtime.exceptions.ConnectionFailedException;
import com.micboard.realtime.mappers.JsonPayloadDecoder;
import com.micboard.realtime.model.DeviceEndpoint;
import java.util.Optional;
import java.util.logging.Level;
import javax.annotation.Nonnull;
import lombok.Builder;
import lombok.extern.java.Log;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Streams JSON server-sent events from a device. */
@Log
@Builder
public class SseDeviceStreamClient implements DeviceStreamClient<JsonNode> {

  private static final ParameterizedTypeReference<ServerSentEvent<String>> EVENT_TYPE =
      new ParameterizedTypeReference<ServerSentEvent<String>>() {};

  @Nonnull
  protected final WebClient webClient;

  @Nonnull
  protected final ObjectMapper objectMapper;

  @Override
  public Mono<DeviceStream<JsonNode>> connect(DeviceEndpoint endpoint) {
    JsonPayloadDecoder decoder = new JsonPayloadDecoder(objectMapper, endpoint.getDeviceId());
    return Mono.defer(() -> {
      log.info("Connecting to " + endpoint.getUri());
      return webClient.get()
          .uri(endpoint.getUri())
          .accept(MediaType.TEXT_EVENT_STREAM)
          .retrieve()
          .toEntityFlux(EVENT_TYPE);
    })
        .onErrorMap(error -> new ConnectionFailedException(
            "Unable to connect to " + endpoint.getUri(), error))
        .<DeviceStream<JsonNode>>map(entity -> {
          Flux<JsonNode> payloads = Optional.ofNullable(entity.getBody())
              .orElseGet(Flux::empty)
              .doOnNext(event -> log.log(Level.FINE,
                  "\u001B[34mRECEIVED {0}\u001B[0m", new Object[] {event.data()}))
              .filter(event -> event.data() != null)
              .concatMap(event -> decoder.apply(event.data()));
          return PulledDeviceStream.of(payloads);
        });
  }
}
