package com.codeheadsystems.quire.server.manager;

import com.codeheadsystems.quire.server.auth.RandomProvider;
import com.codeheadsystems.quire.server.exception.SessionInvalidException;
import com.codeheadsystems.quire.server.store.Identities;
import com.codeheadsystems.quire.server.store.Session;
import com.codeheadsystems.quire.server.store.SessionStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, validates and expires opaque session tokens.
 * <p>
 * Tokens are 32 random bytes, base64url-encoded, with no relation to the account or the time
 * of issue. Validity is always computed from the injected {@link Clock} at validation time; the
 * background sweep only reclaims memory.
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  static final int TOKEN_BYTES = 32;

  private final SessionStore sessionStore;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final Duration ttl;
  private final boolean slidingSessions;
  private final ScheduledExecutorService sessionReaper;

  /**
   * Creates a new SessionManager.
   *
   * @param sessionStore    backing store
   * @param randomProvider  token source
   * @param clock           time source for issue and expiry decisions
   * @param ttl             session lifetime
   * @param slidingSessions whether each successful validation pushes expiry to now + ttl
   * @param sweepInterval   how often expired and revoked sessions are purged; zero disables
   */
  public SessionManager(SessionStore sessionStore, RandomProvider randomProvider, Clock clock,
                        Duration ttl, boolean slidingSessions, Duration sweepInterval) {
    this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
    this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.slidingSessions = slidingSessions;
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    if (sweepInterval.isZero() || sweepInterval.isNegative()) {
      this.sessionReaper = null;
    } else {
      this.sessionReaper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "quire-session-reaper");
        t.setDaemon(true);
        return t;
      });
      long millis = sweepInterval.toMillis();
      sessionReaper.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
    }
    log.info("SessionManager(ttl={}, sliding={}, sweepInterval={})", ttl, slidingSessions, sweepInterval);
  }

  /**
   * Issues a new session for an account.
   *
   * @param accountId       the owning account's id
   * @param accountIdentity the owning account's identity
   * @return the stored session
   */
  public Session issue(String accountId, String accountIdentity) {
    Objects.requireNonNull(accountId, "accountId");
    Instant now = clock.instant();
    Session session = new Session(randomProvider.randomToken(TOKEN_BYTES), accountId,
        Identities.normalize(accountIdentity), now, now.plus(ttl), false);
    sessionStore.store(session);
    log.debug("Issued session token={}...", Session.tokenPrefix(session.token()));
    return session;
  }

  /**
   * Resolves a token to its live session.
   *
   * @param token the presented token
   * @return the session, as stored after any sliding extension
   * @throws SessionInvalidException if the token is unknown, expired, or revoked
   */
  public Session validate(String token) {
    if (token == null || token.isBlank()) {
      throw new SessionInvalidException(SessionInvalidException.Reason.UNKNOWN);
    }
    Instant now = clock.instant();
    Session current = load(token);
    while (true) {
      if (current.revoked()) {
        log.debug("Rejected revoked session token={}...", Session.tokenPrefix(token));
        throw new SessionInvalidException(SessionInvalidException.Reason.REVOKED);
      }
      if (!current.isValidAt(now)) {
        log.debug("Rejected expired session token={}...", Session.tokenPrefix(token));
        throw new SessionInvalidException(SessionInvalidException.Reason.EXPIRED);
      }
      if (!slidingSessions) {
        return current;
      }
      Instant extended = now.plus(ttl);
      if (!extended.isAfter(current.expiresAt())) {
        return current;
      }
      Session updated = current.withExpiresAt(extended);
      if (sessionStore.replace(current, updated)) {
        return updated;
      }
      // Lost a race with a concurrent revoke or extension; re-check the stored state.
      current = load(token);
    }
  }

  /**
   * Revokes a session. Unknown, blank or already revoked tokens are ignored.
   *
   * @param token the token
   */
  public void revoke(String token) {
    if (token == null || token.isBlank()) {
      return;
    }
    sessionStore.revoke(token);
  }

  /**
   * Revokes every session of an account.
   *
   * @param accountIdentity the account's identity
   * @return number of sessions revoked
   */
  public int revokeAll(String accountIdentity) {
    return sessionStore.revokeByAccountIdentity(Identities.normalize(accountIdentity));
  }

  /**
   * Removes expired and revoked sessions.
   *
   * @return number removed
   */
  public int sweep() {
    Instant now = clock.instant();
    int removed = sessionStore.removeIf(s -> !s.isValidAt(now));
    if (removed > 0) {
      log.debug("Swept {} session(s)", removed);
    }
    return removed;
  }

  /**
   * Session lifetime.
   *
   * @return the ttl
   */
  public Duration ttl() {
    return ttl;
  }

  /**
   * Shuts down the session reaper thread.
   * <p>
   * In Dropwizard, register this instance as a {@code Managed} component.
   */
  public void shutdown() {
    if (sessionReaper != null) {
      sessionReaper.shutdownNow();
    }
  }

  private Session load(String token) {
    return sessionStore.load(token)
        .orElseThrow(() -> new SessionInvalidException(SessionInvalidException.Reason.UNKNOWN));
  }

  private void sweepSafely() {
    try {
      sweep();
    } catch (RuntimeException e) {
      // An exception escaping a scheduled task cancels every future run.
      log.error("Session sweep failed", e);
    }
  }
}
