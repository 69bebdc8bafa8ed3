package com.codeheadsystems.quire.dropwizard;

/**
 * Which {@link com.codeheadsystems.quire.server.store.CredentialStore} the bundle builds.
 */
public enum StorageType {
  /** Accounts live in memory and are lost on restart. Dev/test only. */
  MEMORY,
  /** One JSON file per account under {@code storageDirectory}. */
  FILE
}
