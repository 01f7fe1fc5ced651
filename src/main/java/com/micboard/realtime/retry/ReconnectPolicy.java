package com.micboard.realtime.retry;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;

/**
 * Exponential backoff between reconnection attempts.
 *
 * <p>The delay before attempt {@code n} (counting from zero) is
 * {@code min(baseDelay * 2^n, maxDelay)}.
 */
@Getter
@Builder
public class ReconnectPolicy {
  @Builder.Default private Duration baseDelay = Duration.ofSeconds(1);
  @Builder.Default private Duration maxDelay = Duration.ofSeconds(60);

  /**
   * Get the delay before the next attempt.
   *
   * @param attempts Reconnect attempts made so far
   * @return The delay to wait
   */
  public Duration getDelay(int attempts) {
    if (attempts < 0) {
      throw new IllegalArgumentException("Attempts must not be negative: " + attempts);
    }
    long baseMs = baseDelay.toMillis();
    long maxMs = maxDelay.toMillis();
    if (baseMs <= 0) {
      return Duration.ZERO;
    }
    if (attempts >= Long.SIZE - 1 || baseMs > (maxMs >> attempts)) {
      return maxDelay;
    }
    return Duration.ofMillis(Math.min(baseMs << attempts, maxMs));
  }
}
