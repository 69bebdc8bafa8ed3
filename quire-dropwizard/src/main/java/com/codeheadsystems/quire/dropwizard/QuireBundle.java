package com.codeheadsystems.quire.dropwizard;

import com.codeheadsystems.quire.dropwizard.auth.JsonUnauthorizedHandler;
import com.codeheadsystems.quire.dropwizard.auth.QuireAuthenticator;
import com.codeheadsystems.quire.dropwizard.auth.QuirePrincipal;
import com.codeheadsystems.quire.dropwizard.auth.SessionTokenAuthFilter;
import com.codeheadsystems.quire.dropwizard.filter.CorsFilter;
import com.codeheadsystems.quire.dropwizard.filter.RequestSizeLimitFilter;
import com.codeheadsystems.quire.dropwizard.health.CredentialStoreHealthCheck;
import com.codeheadsystems.quire.dropwizard.resource.AccountResource;
import com.codeheadsystems.quire.dropwizard.resource.WhoAmIResource;
import com.codeheadsystems.quire.server.auth.Argon2idPasswordHasher;
import com.codeheadsystems.quire.server.auth.HashingConfig;
import com.codeheadsystems.quire.server.auth.PasswordHasher;
import com.codeheadsystems.quire.server.auth.RandomProvider;
import com.codeheadsystems.quire.server.manager.QuireAuthManager;
import com.codeheadsystems.quire.server.manager.SessionManager;
import com.codeheadsystems.quire.server.resource.AuthResource;
import com.codeheadsystems.quire.server.resource.QuireExceptionMapper;
import com.codeheadsystems.quire.server.resource.SessionCookies;
import com.codeheadsystems.quire.server.store.CredentialStore;
import com.codeheadsystems.quire.server.store.FileCredentialStore;
import com.codeheadsystems.quire.server.store.InMemoryCredentialStore;
import com.codeheadsystems.quire.server.store.InMemorySessionStore;
import com.codeheadsystems.quire.server.store.SessionStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the Quire auth API into an existing Dropwizard application.
 * <p>
 * Registers the register/login/logout, whoami and account resources, the session-token auth
 * filter, the CORS and request-size filters, the exception mapper, and the
 * {@code credential-store} health check. Requires a {@link QuireConfiguration} block in the
 * application's YAML config.
 * <p>
 * Let the configuration pick the credential store:
 * <pre>{@code
 *   bootstrap.addBundle(new QuireBundle<>());
 * }</pre>
 * <p>
 * Or supply your own stores:
 * <pre>{@code
 *   bootstrap.addBundle(new QuireBundle<>(myCredentialStore, mySessionStore));
 * }</pre>
 */
public class QuireBundle<C extends QuireConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(QuireBundle.class);

  static final String REALM = "quire";
  static final String HEALTH_CHECK_NAME = "credential-store";

  private final CredentialStore suppliedCredentialStore;
  private final SessionStore suppliedSessionStore;
  private final Clock clock;

  /**
   * Creates a bundle whose credential store is chosen by {@code storageType} and whose sessions
   * live in memory.
   */
  public QuireBundle() {
    this(null, null, Clock.systemUTC());
  }

  /**
   * Creates a bundle backed by the supplied stores. {@code storageType} is ignored.
   *
   * @param credentialStore the credential store
   * @param sessionStore    the session store
   */
  public QuireBundle(CredentialStore credentialStore, SessionStore sessionStore) {
    this(credentialStore, sessionStore, Clock.systemUTC());
  }

  QuireBundle(CredentialStore credentialStore, SessionStore sessionStore, Clock clock) {
    this.suppliedCredentialStore = credentialStore;
    this.suppliedSessionStore = sessionStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    CredentialStore credentialStore = suppliedCredentialStore != null
        ? suppliedCredentialStore : buildCredentialStore(configuration);
    SessionStore sessionStore = suppliedSessionStore != null
        ? suppliedSessionStore : new InMemorySessionStore();

    PasswordHasher passwordHasher = new Argon2idPasswordHasher(new HashingConfig(
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism()));
    SessionManager sessionManager = new SessionManager(sessionStore, new RandomProvider(), clock,
        Duration.ofSeconds(configuration.getSessionTtlSeconds()),
        configuration.isSlidingSessions(),
        Duration.ofSeconds(configuration.getSessionSweepIntervalSeconds()));
    environment.lifecycle().manage(new Managed() {
      @Override
      public void stop() {
        sessionManager.shutdown();
      }
    });
    QuireAuthManager authManager = new QuireAuthManager(credentialStore, passwordHasher, sessionManager,
        configuration.getMinimumCredentialLength());
    SessionCookies sessionCookies = new SessionCookies(configuration.isSessionCookieEnabled(),
        configuration.getSessionCookieName(), configuration.isSessionCookieSecure());
    if (sessionCookies.cookieEnabled() && !sessionCookies.cookieSecure()) {
      log.warn("Session cookie is not marked Secure. Do not use in production.");
    }

    environment.jersey().register(new AuthResource(authManager, sessionManager, sessionCookies));
    environment.jersey().register(new WhoAmIResource());
    environment.jersey().register(new AccountResource(authManager, sessionCookies));
    environment.jersey().register(new QuireExceptionMapper());
    environment.jersey().register(new CorsFilter(configuration.getAllowedOrigins()));
    environment.jersey().register(new RequestSizeLimitFilter(configuration.getMaxRequestBodyBytes()));
    environment.healthChecks().register(HEALTH_CHECK_NAME, new CredentialStoreHealthCheck(credentialStore));

    // Session-token auth filter
    environment.jersey().register(new AuthDynamicFeature(
        new SessionTokenAuthFilter.Builder<QuirePrincipal>()
            .setSessionCookies(sessionCookies)
            .setAuthenticator(new QuireAuthenticator(authManager))
            .setUnauthorizedHandler(new JsonUnauthorizedHandler())
            .setPrefix("Bearer")
            .setRealm(REALM)
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(QuirePrincipal.class));
  }

  private CredentialStore buildCredentialStore(C configuration) {
    return switch (configuration.getStorageType()) {
      case MEMORY -> new InMemoryCredentialStore(clock);
      case FILE -> {
        String directory = configuration.getStorageDirectory();
        if (directory == null || directory.isBlank()) {
          throw new IllegalStateException("storageDirectory must be set when storageType is file");
        }
        yield new FileCredentialStore(Path.of(directory),
            Duration.ofMillis(configuration.getStorageTimeoutMillis()), clock);
      }
    };
  }
}
