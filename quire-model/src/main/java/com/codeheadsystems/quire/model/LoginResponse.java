package com.codeheadsystems.quire.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Wire model returned after a successful login.
 * <p>
 * The token is an opaque bearer value. The front-end presents it either in an
 * {@code Authorization: Bearer} header or through the session cookie set alongside this response.
 * <p>
 * Used by: {@code POST /api/login}
 *
 * @param token     opaque session token
 * @param expiresAt ISO-8601 instant after which the token is no longer accepted
 */
public record LoginResponse(
    @JsonProperty("token") String token,
    @JsonProperty("expiresAt") String expiresAt) {

  /**
   * Instantiates a new Login response.
   *
   * @param token     the token
   * @param expiresAt the expiry instant
   */
  public LoginResponse(String token, Instant expiresAt) {
    this(token, expiresAt.toString());
  }

  /**
   * Parses the expiry back into an instant.
   *
   * @return the instant
   */
  public Instant expiresAtInstant() {
    return Instant.parse(expiresAt);
  }
}
