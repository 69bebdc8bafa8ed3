package com.codeheadsystems.quire.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.quire.server.store.CredentialStore;

/**
 * Health check that verifies the credential store is reachable and reports the account count.
 */
public class CredentialStoreHealthCheck extends HealthCheck {

  private final CredentialStore credentialStore;

  /**
   * Instantiates a new Credential store health check.
   *
   * @param credentialStore the credential store
   */
  public CredentialStoreHealthCheck(CredentialStore credentialStore) {
    this.credentialStore = credentialStore;
  }

  @Override
  protected Result check() {
    if (!credentialStore.isAvailable()) {
      return Result.unhealthy("Credential store is not writable");
    }
    return Result.healthy("accounts=%d", credentialStore.count());
  }
}
