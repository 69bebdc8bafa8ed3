package com.codeheadsystems.quire.server.resource;

import com.codeheadsystems.quire.model.AccountResponse;
import com.codeheadsystems.quire.model.LoginRequest;
import com.codeheadsystems.quire.model.LoginResponse;
import com.codeheadsystems.quire.model.LogoutRequest;
import com.codeheadsystems.quire.model.RegisterRequest;
import com.codeheadsystems.quire.server.manager.QuireAuthManager;
import com.codeheadsystems.quire.server.manager.SessionManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for registration, login and logout.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/register}: create an account, 201 with its public view</li>
 *   <li>{@code POST /api/login}: verify a credential, 200 with a session token</li>
 *   <li>{@code POST /api/logout}: revoke the presented session, always 204</li>
 * </ul>
 * <p>
 * Thin wrapper around {@link QuireAuthManager}; failures surface as
 * {@link com.codeheadsystems.quire.server.exception.QuireException}s and are rendered by
 * {@link QuireExceptionMapper}.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final QuireAuthManager authManager;
  private final SessionCookies sessionCookies;
  private final Duration sessionTtl;

  /**
   * Instantiates a new Auth resource.
   *
   * @param authManager    the auth manager
   * @param sessionManager source of the session lifetime used for cookie Max-Age
   * @param sessionCookies token transport settings
   */
  public AuthResource(QuireAuthManager authManager, SessionManager sessionManager,
                      SessionCookies sessionCookies) {
    this.authManager = authManager;
    this.sessionCookies = sessionCookies;
    this.sessionTtl = sessionManager.ttl();
  }

  @POST
  @Path("/register")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response register(RegisterRequest request) {
    log.debug("register()");
    AccountResponse account = authManager.register(request);
    return Response.status(Response.Status.CREATED).entity(account).build();
  }

  @POST
  @Path("/login")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response login(LoginRequest request) {
    log.debug("login()");
    LoginResponse login = authManager.login(request);
    Response.ResponseBuilder builder = Response.ok(login);
    if (sessionCookies.cookieEnabled()) {
      builder.header(HttpHeaders.SET_COOKIE,
          sessionCookies.sessionCookie(login.token(), sessionTtl.toSeconds()));
    }
    return builder.build();
  }

  /**
   * Ends the presented session. The token is taken from the Bearer header or cookie, else
   * from an optional {@code {"token": ...}} body.
   *
   * @param headers the request headers
   * @param request the optional body, null when none was sent
   * @return always 204
   */
  @POST
  @Path("/logout")
  public Response logout(@Context HttpHeaders headers, LogoutRequest request) {
    log.debug("logout()");
    sessionCookies.token(headers)
        .or(() -> Optional.ofNullable(request).map(LogoutRequest::token))
        .ifPresent(authManager::logout);
    Response.ResponseBuilder builder = Response.noContent();
    if (sessionCookies.cookieEnabled()) {
      builder.header(HttpHeaders.SET_COOKIE, sessionCookies.clearingCookie());
    }
    return builder.build();
  }
}
