package com.micboard.realtime.exceptions;

import lombok.Getter;

public class NoSuchConnectionException extends Exception {

  private static final long serialVersionUID = 8391507736021149753L;

  @Getter
  private final String deviceId;

  public NoSuchConnectionException(String deviceId) {
    super("No real-time connection registered for device " + deviceId);
    this.deviceId = deviceId;
  }
}
