package com.codeheadsystems.quire.dropwizard.auth;

import com.codeheadsystems.quire.model.WhoAmIResponse;
import com.codeheadsystems.quire.server.exception.UnauthorizedException;
import com.codeheadsystems.quire.server.manager.QuireAuthManager;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that resolves session tokens through
 * {@link QuireAuthManager#whoami(String)}.
 * <p>
 * Storage failures are not caught here: they propagate as
 * {@link com.codeheadsystems.quire.server.exception.UnavailableException} and become a 503.
 */
public class QuireAuthenticator implements Authenticator<String, QuirePrincipal> {

  private static final Logger log = LoggerFactory.getLogger(QuireAuthenticator.class);

  private final QuireAuthManager authManager;

  /**
   * Instantiates a new Quire authenticator.
   *
   * @param authManager the auth manager
   */
  public QuireAuthenticator(QuireAuthManager authManager) {
    this.authManager = authManager;
  }

  @Override
  public Optional<QuirePrincipal> authenticate(String token) {
    try {
      WhoAmIResponse account = authManager.whoami(token);
      return Optional.of(new QuirePrincipal(account.identity(), account.displayName(), token));
    } catch (UnauthorizedException e) {
      log.debug("Session rejected: {}", e.getClass().getSimpleName());
      return Optional.empty();
    }
  }
}
