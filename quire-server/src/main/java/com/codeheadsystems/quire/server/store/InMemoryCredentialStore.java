package com.codeheadsystems.quire.server.store;

import com.codeheadsystems.quire.server.exception.DuplicateIdentityException;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All accounts are lost on server restart. Suitable for development and integration testing
 * only. Use {@link FileCredentialStore} or another persistent implementation for production.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final ConcurrentHashMap<String, Account> store = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryCredentialStore() {
    this(Clock.systemUTC());
  }

  public InMemoryCredentialStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryCredentialStore: accounts will NOT survive restarts. "
        + "Configure a persistent CredentialStore for production.");
  }

  @Override
  public Account create(String identity, String credentialHash, String displayName) {
    Account account = Account.newAccount(identity, credentialHash, displayName, clock);
    Account existing = store.putIfAbsent(account.identity(), account);
    if (existing != null) {
      log.debug("create: identity already registered");
      throw new DuplicateIdentityException();
    }
    log.debug("Stored account {}", account.accountId());
    return account;
  }

  @Override
  public Optional<Account> find(String identity) {
    return Optional.ofNullable(store.get(Identities.normalize(identity)));
  }

  @Override
  public boolean delete(String identity) {
    return store.remove(Identities.normalize(identity)) != null;
  }

  @Override
  public long count() {
    return store.size();
  }

  @Override
  public boolean isAvailable() {
    return true;
  }
}
