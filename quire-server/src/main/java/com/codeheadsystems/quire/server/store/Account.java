package com.codeheadsystems.quire.server.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * A registered account.
 *
 * @param accountId      server-assigned identifier
 * @param identity       normalized login identifier, unique across all accounts
 * @param displayName    human-readable name
 * @param credentialHash self-describing output of the password hasher
 * @param createdAt      registration time
 */
public record Account(
    @JsonProperty("accountId") String accountId,
    @JsonProperty("identity") String identity,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("credentialHash") String credentialHash,
    @JsonProperty("createdAt") Instant createdAt) {

  /**
   * Builds a new account with a random id, stamped with the clock's current instant.
   *
   * @param identity       the identity, normalized here
   * @param credentialHash the credential hash
   * @param displayName    the display name
   * @param clock          the clock
   * @return the account
   */
  public static Account newAccount(String identity, String credentialHash, String displayName,
                                   Clock clock) {
    return new Account(UUID.randomUUID().toString(), Identities.normalize(identity), displayName,
        credentialHash, clock.instant());
  }

  @Override
  public String toString() {
    return "Account[accountId=" + accountId + ", identity=" + identity + ", displayName="
        + displayName + ", createdAt=" + createdAt + "]";
  }
}
