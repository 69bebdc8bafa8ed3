package com.codeheadsystems.quire.server.store;

import com.codeheadsystems.quire.server.exception.DuplicateIdentityException;
import com.codeheadsystems.quire.server.exception.UnavailableException;
import java.util.Optional;

/**
 * Storage abstraction for accounts and their credential hashes.
 * <p>
 * Implementations must be thread-safe. Identities are compared after
 * {@link Identities#normalize(String)}; two concurrent {@link #create} calls for the same
 * normalized identity must produce exactly one success. A successful {@link #create} must be
 * durable before it returns.
 */
public interface CredentialStore {

  /**
   * Creates an account if no account with the same normalized identity exists.
   *
   * @param identity       the identity, normalized by the store
   * @param credentialHash output of the password hasher
   * @param displayName    the display name
   * @return the stored account
   * @throws DuplicateIdentityException if the identity is taken
   * @throws UnavailableException       if the store timed out or failed to persist
   */
  Account create(String identity, String credentialHash, String displayName);

  /**
   * Looks up an account.
   *
   * @param identity the identity, normalized by the store
   * @return the account, or empty if not registered
   */
  Optional<Account> find(String identity);

  /**
   * Removes an account, if present. Callers are responsible for revoking the account's sessions.
   *
   * @param identity the identity, normalized by the store
   * @return true if an account was removed
   * @throws UnavailableException if the store timed out or failed to persist
   */
  boolean delete(String identity);

  /**
   * Number of stored accounts.
   *
   * @return the count
   */
  long count();

  /**
   * Whether the backing storage is currently usable.
   *
   * @return true if reads and writes are expected to succeed
   */
  boolean isAvailable();
}
