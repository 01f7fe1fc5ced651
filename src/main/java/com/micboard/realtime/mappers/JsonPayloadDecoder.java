package com.micboard.realtime.mappers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.text.MessageFormat;
import java.util.function.Function;
import java.util.logging.Level;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;
import reactor.core.publisher.Mono;

/** Decode a raw text payload into JSON, dropping anything that does not parse. */
@Log
@RequiredArgsConstructor
public class JsonPayloadDecoder implements Function<String, Mono<JsonNode>> {

  private final ObjectMapper objectMapper;

  private final String source;

  @Override
  public Mono<JsonNode> apply(String payload) {
    if (payload == null || payload.isBlank()) {
      return Mono.empty();
    }
    try {
      return Mono.justOrEmpty(objectMapper.readTree(payload));
    } catch (JsonProcessingException ex) {
      log.log(Level.WARNING, MessageFormat.format(
          "Dropping malformed payload from {0}: {1}", source, ex.getOriginalMessage()));
      return Mono.empty();
    }
  }
}
