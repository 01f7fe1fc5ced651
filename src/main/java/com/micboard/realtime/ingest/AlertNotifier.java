package com.micboard.realtime.ingest;

import reactor.core.publisher.Mono;

/** Raises an operator-visible alert for a device that needs manual intervention. */
@FunctionalInterface
public interface AlertNotifier {

  Mono<Void> notify(String deviceId, String reason);
}
