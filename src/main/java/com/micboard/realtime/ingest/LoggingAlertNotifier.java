package com.micboard.realtime.ingest;

import java.text.MessageFormat;
import java.util.logging.Level;
import lombok.extern.java.Log;
import reactor.core.publisher.Mono;

@Log
public class LoggingAlertNotifier implements AlertNotifier {

  @Override
  public Mono<Void> notify(String deviceId, String reason) {
    return Mono.fromRunnable(() -> log.log(Level.SEVERE, MessageFormat.format(
        "\u001B[31mDevice {0} needs attention: {1}\u001B[0m", deviceId, reason)));
  }
}
