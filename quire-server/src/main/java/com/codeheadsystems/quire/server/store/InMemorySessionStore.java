package com.codeheadsystems.quire.server.store;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All sessions are lost on server restart, which logs every user out.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, Session> store = new ConcurrentHashMap<>();
  // Reverse index: account identity -> tokens, kept in sync with store.
  private final ConcurrentHashMap<String, Set<String>> identityToTokens = new ConcurrentHashMap<>();

  @Override
  public void store(Session session) {
    // Put before indexing: an indexed token is always one revokeByAccountIdentity can revoke.
    store.put(session.token(), session);
    identityToTokens.compute(session.accountIdentity(), (k, tokens) -> {
      Set<String> set = tokens == null ? ConcurrentHashMap.newKeySet() : tokens;
      set.add(session.token());
      return set;
    });
    log.debug("Stored session token={}...", Session.tokenPrefix(session.token()));
  }

  @Override
  public Optional<Session> load(String token) {
    if (token == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(store.get(token));
  }

  @Override
  public boolean replace(Session expected, Session updated) {
    return store.replace(expected.token(), expected, updated);
  }

  @Override
  public void revoke(String token) {
    if (token == null) {
      return;
    }
    Session revoked = store.computeIfPresent(token, (k, s) -> s.asRevoked());
    log.debug("Revoke session token={}... found={}", Session.tokenPrefix(token), revoked != null);
  }

  @Override
  public int revokeByAccountIdentity(String accountIdentity) {
    Set<String> tokens = identityToTokens.remove(accountIdentity);
    if (tokens == null) {
      return 0;
    }
    int count = 0;
    for (String token : tokens) {
      if (store.computeIfPresent(token, (k, s) -> s.asRevoked()) != null) {
        count++;
      }
    }
    log.debug("Revoked {} session(s) for account", count);
    return count;
  }

  @Override
  public int removeIf(Predicate<Session> predicate) {
    int removed = 0;
    Iterator<Map.Entry<String, Session>> it = store.entrySet().iterator();
    while (it.hasNext()) {
      Session session = it.next().getValue();
      if (predicate.test(session) && store.remove(session.token(), session)) {
        unindex(session);
        removed++;
      }
    }
    return removed;
  }

  @Override
  public int size() {
    return store.size();
  }

  private void unindex(Session session) {
    identityToTokens.computeIfPresent(session.accountIdentity(), (k, tokens) -> {
      tokens.remove(session.token());
      return tokens.isEmpty() ? null : tokens;
    });
  }
}
