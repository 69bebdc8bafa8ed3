package com.codeheadsystems.quire.server.store;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Storage abstraction for issued sessions, keyed by token.
 * <p>
 * Implementations must be thread-safe.
 * <p>
 * <strong>Account deletion contract:</strong> when an account is deleted, <em>all</em> of its
 * sessions must stop being accepted immediately. Implementations must maintain whatever index
 * is necessary to support {@link #revokeByAccountIdentity(String)} without a full-store scan.
 */
public interface SessionStore {

  /**
   * Stores a new session.
   *
   * @param session the session
   */
  void store(Session session);

  /**
   * Loads a session by token. Expired or revoked sessions may still be returned until they are
   * swept; callers decide validity.
   *
   * @param token the token
   * @return the session, or empty if not found
   */
  Optional<Session> load(String token);

  /**
   * Atomically replaces {@code expected} with {@code updated} if the stored value is still
   * {@code expected}.
   *
   * @param expected the value previously loaded
   * @param updated  the replacement, with the same token
   * @return true if the swap happened
   */
  boolean replace(Session expected, Session updated);

  /**
   * Marks a single session revoked. Unknown tokens are ignored.
   *
   * @param token the token
   */
  void revoke(String token);

  /**
   * Revokes every session belonging to the given account. Must not throw when the account has
   * no sessions.
   *
   * @param accountIdentity normalized identity
   * @return number of sessions revoked
   */
  int revokeByAccountIdentity(String accountIdentity);

  /**
   * Removes every session matching the predicate.
   *
   * @param predicate the predicate
   * @return number of sessions removed
   */
  int removeIf(Predicate<Session> predicate);

  /**
   * Number of stored sessions, including ones not yet swept.
   *
   * @return the size
   */
  int size();
}
