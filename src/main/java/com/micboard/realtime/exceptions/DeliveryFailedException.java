package com.micboard.realtime.exceptions;

public class DeliveryFailedException extends Exception {

  private static final long serialVersionUID = 6620153920174410247L;

  public DeliveryFailedException(String message) {
    super(message);
  }

  public DeliveryFailedException(String message, Throwable cause) {
    super(message, cause);
  }

  public DeliveryFailedException(Throwable cause) {
    super(cause);
  }
}
