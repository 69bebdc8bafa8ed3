package com.codeheadsystems.quire.server.exception;

/**
 * Malformed input: missing field, bad identity shape, credential too short.
 */
public class ValidationException extends QuireException {

  public ValidationException(String message) {
    super(message);
  }

  @Override
  public String errorCode() {
    return "ValidationError";
  }
}
