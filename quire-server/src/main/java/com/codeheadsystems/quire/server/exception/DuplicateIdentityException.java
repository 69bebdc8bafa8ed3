package com.codeheadsystems.quire.server.exception;

/**
 * An account with the same normalized identity already exists.
 */
public class DuplicateIdentityException extends QuireException {

  public DuplicateIdentityException() {
    super("An account with this identity already exists");
  }

  @Override
  public String errorCode() {
    return "DuplicateIdentity";
  }
}
