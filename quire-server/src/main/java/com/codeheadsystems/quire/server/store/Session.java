package com.codeheadsystems.quire.server.store;

import java.time.Instant;

/**
 * An issued session. Immutable; a change of state is a new instance swapped in through
 * {@link SessionStore#replace(Session, Session)}.
 *
 * @param token           opaque bearer value
 * @param accountId       id of the owning account
 * @param accountIdentity normalized identity of the owning account
 * @param issuedAt        when the session was created
 * @param expiresAt       when the session stops being valid
 * @param revoked         whether the session was explicitly ended
 */
public record Session(
    String token,
    String accountId,
    String accountIdentity,
    Instant issuedAt,
    Instant expiresAt,
    boolean revoked) {

  /**
   * Valid iff not revoked and {@code now} is strictly before {@link #expiresAt()}.
   *
   * @param now the current instant
   * @return true if the session may be used
   */
  public boolean isValidAt(Instant now) {
    return !revoked && now.isBefore(expiresAt);
  }

  public Session withExpiresAt(Instant newExpiresAt) {
    return new Session(token, accountId, accountIdentity, issuedAt, newExpiresAt, revoked);
  }

  public Session asRevoked() {
    return revoked ? this : new Session(token, accountId, accountIdentity, issuedAt, expiresAt, true);
  }

  @Override
  public String toString() {
    return "Session[token=" + tokenPrefix(token) + "..., accountId=" + accountId
        + ", accountIdentity=" + accountIdentity
        + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + ", revoked=" + revoked + "]";
  }

  /**
   * The first eight characters of a token, the most that may appear in a log line.
   *
   * @param token the token
   * @return a loggable prefix
   */
  public static String tokenPrefix(String token) {
    if (token == null) {
      return "null";
    }
    return token.length() <= 8 ? token : token.substring(0, 8);
  }
}
