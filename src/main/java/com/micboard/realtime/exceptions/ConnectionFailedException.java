package com.micboard.realtime.exceptions;

public class ConnectionFailedException extends Exception {

  private static final long serialVersionUID = -4120735208861374925L;

  public ConnectionFailedException(String message) {
    super(message);
  }

  public ConnectionFailedException(String message, Throwable cause) {
    super(message, cause);
  }

  public ConnectionFailedException(Throwable cause) {
    super(cause);
  }
}
