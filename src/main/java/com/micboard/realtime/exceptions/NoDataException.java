package com.micboard.realtime.exceptions;

public class NoDataException extends Exception {

  private static final long serialVersionUID = 2873390157712046138L;

  public NoDataException(String message) {
    super(message);
  }

  public NoDataException(String message, Throwable cause) {
    super(message, cause);
  }

  public NoDataException(Throwable cause) {
    super(cause);
  }
}
