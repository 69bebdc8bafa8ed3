package com.codeheadsystems.quire.dropwizard.auth;

import com.codeheadsystems.quire.server.resource.SessionCookies;
import io.dropwizard.auth.AuthFilter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import java.io.IOException;
import java.security.Principal;
import java.util.Objects;

/**
 * Auth filter that accepts a session token from {@code Authorization: Bearer} or, when enabled,
 * from the session cookie.
 *
 * @param <P> the principal type
 */
@Priority(Priorities.AUTHENTICATION)
public class SessionTokenAuthFilter<P extends Principal> extends AuthFilter<String, P> {

  private final SessionCookies sessionCookies;

  private SessionTokenAuthFilter(SessionCookies sessionCookies) {
    this.sessionCookies = sessionCookies;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) throws IOException {
    String token = sessionCookies.token(requestContext.getHeaderString(HttpHeaders.AUTHORIZATION),
        requestContext.getCookies()).orElse(null);
    if (!authenticate(requestContext, token, prefix)) {
      throw new WebApplicationException(unauthorizedHandler.buildResponse(prefix, realm));
    }
  }

  /**
   * Builder for {@link SessionTokenAuthFilter}.
   *
   * @param <P> the principal type
   */
  public static class Builder<P extends Principal>
      extends AuthFilterBuilder<String, P, SessionTokenAuthFilter<P>> {

    private SessionCookies sessionCookies = SessionCookies.headerOnly();

    public Builder<P> setSessionCookies(SessionCookies sessionCookies) {
      this.sessionCookies = Objects.requireNonNull(sessionCookies, "sessionCookies");
      return this;
    }

    @Override
    protected SessionTokenAuthFilter<P> newInstance() {
      return new SessionTokenAuthFilter<>(sessionCookies);
    }
  }
}
