package com.codeheadsystems.quire.server.exception;

/**
 * The request carries no usable session.
 */
public class UnauthorizedException extends QuireException {

  public static final String MESSAGE = "Authentication required";

  public UnauthorizedException() {
    super(MESSAGE);
  }

  @Override
  public String errorCode() {
    return "Unauthorized";
  }
}
