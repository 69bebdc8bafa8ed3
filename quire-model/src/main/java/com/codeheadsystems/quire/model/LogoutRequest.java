package com.codeheadsystems.quire.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of a logout call, for front-ends that hold the token themselves rather than
 * sending it as a header or cookie.
 * <p>
 * Used by: {@code POST /api/logout}
 *
 * @param token the session token to end
 */
public record LogoutRequest(@JsonProperty("token") String token) {

  @Override
  public String toString() {
    return "LogoutRequest[token=<redacted>]";
  }
}
