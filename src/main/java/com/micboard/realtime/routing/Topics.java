package com.micboard.realtime.routing;

import java.util.Optional;

public final class Topics {
  public static final String ALL_DEVICES = "micboard_updates";

  public static final String DEVICE_PREFIX = "device:";

  private Topics() {}

  public static String deviceTopic(String deviceId) {
    return DEVICE_PREFIX + deviceId;
  }

  /**
   * Extract the device identifier from a per-device topic.
   *
   * @param topic The topic name
   * @return The device identifier, empty for any other topic
   */
  public static Optional<String> parseDeviceId(String topic) {
    if (topic == null || !topic.startsWith(DEVICE_PREFIX)
        || topic.length() == DEVICE_PREFIX.length()) {
      return Optional.empty();
    }
    return Optional.of(topic.substring(DEVICE_PREFIX.length()));
  }
}
