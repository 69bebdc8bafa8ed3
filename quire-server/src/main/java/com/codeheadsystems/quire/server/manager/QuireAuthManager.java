package com.codeheadsystems.quire.server.manager;

import com.codeheadsystems.quire.model.AccountResponse;
import com.codeheadsystems.quire.model.LoginRequest;
import com.codeheadsystems.quire.model.LoginResponse;
import com.codeheadsystems.quire.model.RegisterRequest;
import com.codeheadsystems.quire.model.WhoAmIResponse;
import com.codeheadsystems.quire.server.auth.PasswordHasher;
import com.codeheadsystems.quire.server.auth.RandomProvider;
import com.codeheadsystems.quire.server.exception.CorruptCredentialException;
import com.codeheadsystems.quire.server.exception.DuplicateIdentityException;
import com.codeheadsystems.quire.server.exception.InvalidCredentialsException;
import com.codeheadsystems.quire.server.exception.UnauthorizedException;
import com.codeheadsystems.quire.server.exception.UnavailableException;
import com.codeheadsystems.quire.server.exception.ValidationException;
import com.codeheadsystems.quire.server.store.Account;
import com.codeheadsystems.quire.server.store.CredentialStore;
import com.codeheadsystems.quire.server.store.Identities;
import com.codeheadsystems.quire.server.store.Session;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing registration, login, whoami, logout and account
 * deletion.
 * <p>
 * Framework adapters ({@code AuthResource} for JAX-RS, the Dropwizard resources) stay thin
 * wrappers; all validation and policy lives here.
 * <p>
 * <strong>Exception contract</strong> (callers map these to HTTP responses):
 * <ul>
 *   <li>{@link ValidationException}: malformed registration input → HTTP 400</li>
 *   <li>{@link DuplicateIdentityException}: identity taken → HTTP 409</li>
 *   <li>{@link InvalidCredentialsException}: login failed, for any reason → HTTP 401</li>
 *   <li>{@link UnauthorizedException}: no usable session → HTTP 401</li>
 *   <li>{@link UnavailableException}: storage timed out or failed → HTTP 503</li>
 * </ul>
 */
public class QuireAuthManager {

  private static final Logger log = LoggerFactory.getLogger(QuireAuthManager.class);

  static final int MAX_IDENTITY_LENGTH = 254;
  static final int MAX_CREDENTIAL_LENGTH = 1024;
  static final int MAX_DISPLAY_NAME_LENGTH = 100;
  public static final int DEFAULT_MINIMUM_CREDENTIAL_LENGTH = 8;

  // local@domain.tld with no whitespace and a single '@'.
  private static final Pattern IDENTITY_SHAPE = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s.]+$");

  private final CredentialStore credentialStore;
  private final PasswordHasher passwordHasher;
  private final SessionManager sessionManager;
  private final int minimumCredentialLength;
  private final String dummyHash;

  /**
   * Creates a new QuireAuthManager.
   *
   * @param credentialStore         account storage
   * @param passwordHasher          credential hasher
   * @param sessionManager          session issuer
   * @param minimumCredentialLength shortest credential accepted at registration
   */
  public QuireAuthManager(CredentialStore credentialStore, PasswordHasher passwordHasher,
                          SessionManager sessionManager, int minimumCredentialLength) {
    this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore");
    this.passwordHasher = Objects.requireNonNull(passwordHasher, "passwordHasher");
    this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
    if (minimumCredentialLength < 1 || minimumCredentialLength > MAX_CREDENTIAL_LENGTH) {
      throw new IllegalArgumentException("minimumCredentialLength out of range");
    }
    this.minimumCredentialLength = minimumCredentialLength;
    // Verified against on unknown identities so that both login failure paths cost one hash.
    this.dummyHash = passwordHasher.hash(new RandomProvider().randomToken(24));
  }

  public QuireAuthManager(CredentialStore credentialStore, PasswordHasher passwordHasher,
                          SessionManager sessionManager) {
    this(credentialStore, passwordHasher, sessionManager, DEFAULT_MINIMUM_CREDENTIAL_LENGTH);
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Creates an account.
   *
   * @param request identity, credential and display name
   * @return the public view of the new account
   * @throws ValidationException        if any field is missing or malformed
   * @throws DuplicateIdentityException if the normalized identity is taken
   */
  public AccountResponse register(RegisterRequest request) {
    log.debug("register()");
    if (request == null) {
      throw new ValidationException("Request body is required");
    }
    String identity = validateIdentity(request.identity());
    String credential = validateCredential(request.credential());
    String displayName = validateDisplayName(request.displayName());

    Account account = credentialStore.create(identity, passwordHasher.hash(credential), displayName);
    log.info("Registered account {}", account.accountId());
    return new AccountResponse(account.accountId(), account.identity(), account.displayName());
  }

  // ── Authentication ────────────────────────────────────────────────────────

  /**
   * Verifies a credential and issues a session.
   * <p>
   * Unknown identities are verified against a dummy hash, so the failure takes as long and
   * looks the same as a wrong credential.
   *
   * @param request identity and credential
   * @return the session token and its expiry
   * @throws InvalidCredentialsException on any failure
   */
  public LoginResponse login(LoginRequest request) {
    log.debug("login()");
    if (request == null || request.identity() == null || request.identity().isBlank()
        || request.credential() == null || request.credential().length() > MAX_CREDENTIAL_LENGTH) {
      throw new InvalidCredentialsException();
    }
    Optional<Account> account = credentialStore.find(request.identity());
    if (account.isEmpty()) {
      passwordHasher.verify(request.credential(), dummyHash);
      log.debug("login: unknown identity");
      throw new InvalidCredentialsException();
    }
    Account found = account.get();
    try {
      if (!passwordHasher.verify(request.credential(), found.credentialHash())) {
        log.debug("login: credential mismatch for account {}", found.accountId());
        throw new InvalidCredentialsException();
      }
      if (passwordHasher.needsRehash(found.credentialHash())) {
        log.info("Account {} has a credential hash below the current work factors", found.accountId());
      }
    } catch (CorruptCredentialException e) {
      log.warn("Integrity anomaly: stored credential hash for account {} is corrupt: {}",
          found.accountId(), e.getMessage());
      throw new InvalidCredentialsException();
    }
    Session session = sessionManager.issue(found.accountId(), found.identity());
    // The account may have been deleted while the credential was being verified.
    if (!isOwnedByLiveAccount(session)) {
      log.debug("login: account {} removed before session was issued", found.accountId());
      sessionManager.revoke(session.token());
      throw new InvalidCredentialsException();
    }
    return new LoginResponse(session.token(), session.expiresAt());
  }

  /**
   * Resolves a session token to the account it belongs to.
   *
   * @param token the session token
   * @return identity and display name
   * @throws UnauthorizedException if the token is not valid or the account no longer exists
   */
  public WhoAmIResponse whoami(String token) {
    Session session = sessionManager.validate(token);
    Optional<Account> account = credentialStore.find(session.accountIdentity())
        .filter(a -> a.accountId().equals(session.accountId()));
    if (account.isEmpty()) {
      log.debug("whoami: session outlived account {}, revoking", session.accountId());
      sessionManager.revoke(token);
      throw new UnauthorizedException();
    }
    return new WhoAmIResponse(account.get().identity(), account.get().displayName());
  }

  /**
   * Ends a session. Always succeeds, including for null, blank, unknown or revoked tokens.
   *
   * @param token the session token
   */
  public void logout(String token) {
    log.debug("logout()");
    sessionManager.revoke(token);
  }

  /**
   * Deletes an account and revokes every one of its sessions.
   *
   * @param identity the account's identity
   * @return true if an account was removed
   * @throws UnavailableException if storage timed out or failed
   */
  public boolean deleteAccount(String identity) {
    log.debug("deleteAccount()");
    if (identity == null || identity.isBlank()) {
      throw new ValidationException("identity is required");
    }
    boolean removed = credentialStore.delete(identity);
    int revoked = sessionManager.revokeAll(identity);
    log.info("Deleted account (removed={}, sessionsRevoked={})", removed, revoked);
    return removed;
  }

  private boolean isOwnedByLiveAccount(Session session) {
    return credentialStore.find(session.accountIdentity())
        .map(a -> a.accountId().equals(session.accountId()))
        .orElse(false);
  }

  private String validateIdentity(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ValidationException("identity is required");
    }
    String identity = Identities.normalize(raw);
    if (identity.length() > MAX_IDENTITY_LENGTH) {
      throw new ValidationException("identity is too long");
    }
    if (!IDENTITY_SHAPE.matcher(identity).matches()) {
      throw new ValidationException("identity must be an email address");
    }
    return identity;
  }

  private String validateCredential(String credential) {
    if (credential == null || credential.isEmpty()) {
      throw new ValidationException("credential is required");
    }
    if (credential.length() < minimumCredentialLength) {
      throw new ValidationException(
          "credential must be at least " + minimumCredentialLength + " characters");
    }
    if (credential.length() > MAX_CREDENTIAL_LENGTH) {
      throw new ValidationException("credential is too long");
    }
    return credential;
  }

  private String validateDisplayName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ValidationException("displayName is required");
    }
    String displayName = raw.strip();
    if (displayName.length() > MAX_DISPLAY_NAME_LENGTH) {
      throw new ValidationException("displayName is too long");
    }
    return displayName;
  }
}
