package com.codeheadsystems.quire.server.exception;

/**
 * Login failed. The message is the same whether the identity is unknown or the credential is
 * wrong, so the response cannot be used to probe which accounts exist.
 */
public class InvalidCredentialsException extends QuireException {

  public static final String MESSAGE = "Invalid identity or credential";

  public InvalidCredentialsException() {
    super(MESSAGE);
  }

  @Override
  public String errorCode() {
    return "InvalidCredentials";
  }
}
