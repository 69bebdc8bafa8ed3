package com.codeheadsystems.quire.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a login attempt.
 * <p>
 * Used by: {@code POST /api/login}
 *
 * @param identity   the login identifier
 * @param credential the plaintext credential, never included in {@link #toString()}
 */
public record LoginRequest(
    @JsonProperty("identity") String identity,
    @JsonProperty("credential") String credential) {

  @Override
  public String toString() {
    return "LoginRequest[identity=" + identity + ", credential=<redacted>]";
  }
}
