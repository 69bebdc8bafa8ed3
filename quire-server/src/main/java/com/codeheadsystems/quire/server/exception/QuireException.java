package com.codeheadsystems.quire.server.exception;

/**
 * Base type for every failure the auth core reports to its callers.
 * <p>
 * Messages are safe to show to clients: they never carry stack state, storage paths, or hash
 * parameters. Anything more detailed belongs in the log, not in the exception message.
 */
public abstract class QuireException extends RuntimeException {

  /**
   * Instantiates a new Quire exception.
   *
   * @param message the client-safe message
   */
  protected QuireException(String message) {
    super(message);
  }

  /**
   * Instantiates a new Quire exception.
   *
   * @param message the client-safe message
   * @param cause   the cause
   */
  protected QuireException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Stable machine-readable code returned in the {@code error} field of the response body.
   *
   * @return the error code
   */
  public abstract String errorCode();
}
