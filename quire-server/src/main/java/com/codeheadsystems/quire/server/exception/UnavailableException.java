package com.codeheadsystems.quire.server.exception;

/**
 * Storage timed out or failed. Safe for the caller to retry with backoff.
 */
public class UnavailableException extends QuireException {

  public static final String MESSAGE = "Service temporarily unavailable";

  public UnavailableException(Throwable cause) {
    super(MESSAGE, cause);
  }

  public UnavailableException() {
    super(MESSAGE);
  }

  @Override
  public String errorCode() {
    return "Unavailable";
  }
}
