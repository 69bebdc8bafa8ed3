package com.codeheadsystems.quire.server.store;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity normalization shared by every {@link CredentialStore}.
 */
public final class Identities {

  private Identities() {
  }

  /**
   * Trims surrounding whitespace and lower-cases with {@link Locale#ROOT}, so that
   * {@code " Alice@Example.COM "} and {@code "alice@example.com"} name the same account.
   *
   * @param identity the raw identity
   * @return the normalized identity
   */
  public static String normalize(String identity) {
    Objects.requireNonNull(identity, "identity");
    return identity.strip().toLowerCase(Locale.ROOT);
  }
}
