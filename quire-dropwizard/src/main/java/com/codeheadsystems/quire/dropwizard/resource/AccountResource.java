package com.codeheadsystems.quire.dropwizard.resource;

import com.codeheadsystems.quire.dropwizard.auth.QuirePrincipal;
import com.codeheadsystems.quire.server.manager.QuireAuthManager;
import com.codeheadsystems.quire.server.resource.SessionCookies;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets an authenticated account delete itself. Every session of the account, including the
 * one making the call, stops working immediately.
 */
@Path("/api/account")
@Produces(MediaType.APPLICATION_JSON)
public class AccountResource {

  private static final Logger log = LoggerFactory.getLogger(AccountResource.class);

  private final QuireAuthManager authManager;
  private final SessionCookies sessionCookies;

  public AccountResource(QuireAuthManager authManager, SessionCookies sessionCookies) {
    this.authManager = authManager;
    this.sessionCookies = sessionCookies;
  }

  @DELETE
  public Response delete(@Auth QuirePrincipal principal) {
    log.debug("delete()");
    authManager.deleteAccount(principal.identity());
    Response.ResponseBuilder builder = Response.noContent();
    if (sessionCookies.cookieEnabled()) {
      builder.header(HttpHeaders.SET_COOKIE, sessionCookies.clearingCookie());
    }
    return builder.build();
  }
}
