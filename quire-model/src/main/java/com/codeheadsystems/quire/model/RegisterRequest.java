package com.codeheadsystems.quire.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for account registration.
 * <p>
 * The credential travels in plaintext over TLS and is hashed by the server before anything is
 * stored. It is excluded from {@link #toString()} so request logging cannot leak it.
 * <p>
 * Used by: {@code POST /api/register}
 *
 * @param identity    the login identifier, normally an email address
 * @param credential  the plaintext credential
 * @param displayName human-readable name shown by the front-end
 */
public record RegisterRequest(
    @JsonProperty("identity") String identity,
    @JsonProperty("credential") String credential,
    @JsonProperty("displayName") String displayName) {

  @Override
  public String toString() {
    return "RegisterRequest[identity=" + identity + ", credential=<redacted>, displayName="
        + displayName + "]";
  }
}
