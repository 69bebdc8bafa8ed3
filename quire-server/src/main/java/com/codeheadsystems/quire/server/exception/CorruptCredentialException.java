package com.codeheadsystems.quire.server.exception;

/**
 * A stored credential hash could not be parsed. Callers treat this as a failed verification
 * and log it as an integrity anomaly; it is never surfaced to clients as-is.
 */
public class CorruptCredentialException extends QuireException {

  public CorruptCredentialException(String message) {
    super(message);
  }

  public CorruptCredentialException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String errorCode() {
    return "InvalidCredentials";
  }
}
