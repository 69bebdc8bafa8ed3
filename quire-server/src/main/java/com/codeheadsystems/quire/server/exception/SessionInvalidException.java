package com.codeheadsystems.quire.server.exception;

/**
 * A session token is unknown, expired, or revoked. Reported to clients as {@code Unauthorized}.
 */
public class SessionInvalidException extends UnauthorizedException {

  private final Reason reason;

  /**
   * Instantiates a new Session invalid exception.
   *
   * @param reason why the token was rejected, for logging and tests only
   */
  public SessionInvalidException(Reason reason) {
    this.reason = reason;
  }

  /**
   * Reason.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }

  /**
   * Why a token was rejected. Never sent to the client.
   */
  public enum Reason {
    UNKNOWN, EXPIRED, REVOKED
  }
}
