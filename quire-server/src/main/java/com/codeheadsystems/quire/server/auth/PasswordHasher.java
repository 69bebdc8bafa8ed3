package com.codeheadsystems.quire.server.auth;

import com.codeheadsystems.quire.server.exception.CorruptCredentialException;

/**
 * One-way credential transform.
 * <p>
 * Implementations must salt every call independently and encode the salt and work-factor
 * parameters into the returned value, so that {@link #verify} needs nothing but its arguments.
 * The plaintext must not be retained, logged, or returned.
 */
public interface PasswordHasher {

  /**
   * Hashes a plaintext credential with a fresh random salt.
   *
   * @param plaintext the credential
   * @return the self-describing credential hash
   */
  String hash(String plaintext);

  /**
   * Recomputes the digest with the parameters embedded in {@code credentialHash} and compares
   * it in constant time.
   *
   * @param plaintext      the presented credential
   * @param credentialHash a value previously returned by {@link #hash}
   * @return true if the credential matches
   * @throws CorruptCredentialException if {@code credentialHash} cannot be parsed
   */
  boolean verify(String plaintext, String credentialHash);

  /**
   * Whether a stored hash was produced with weaker parameters than this hasher currently uses.
   *
   * @param credentialHash the stored hash
   * @return true if the hash should be upgraded on the next opportunity
   * @throws CorruptCredentialException if {@code credentialHash} cannot be parsed
   */
  boolean needsRehash(String credentialHash);
}
