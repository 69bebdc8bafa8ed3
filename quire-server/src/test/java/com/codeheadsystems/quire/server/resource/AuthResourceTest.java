package com.codeheadsystems.quire.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.quire.model.AccountResponse;
import com.codeheadsystems.quire.model.ErrorResponse;
import com.codeheadsystems.quire.model.LoginRequest;
import com.codeheadsystems.quire.model.LoginResponse;
import com.codeheadsystems.quire.model.LogoutRequest;
import com.codeheadsystems.quire.model.RegisterRequest;
import com.codeheadsystems.quire.server.auth.Argon2idPasswordHasher;
import com.codeheadsystems.quire.server.auth.HashingConfig;
import com.codeheadsystems.quire.server.auth.RandomProvider;
import com.codeheadsystems.quire.server.exception.UnauthorizedException;
import com.codeheadsystems.quire.server.exception.UnavailableException;
import com.codeheadsystems.quire.server.manager.QuireAuthManager;
import com.codeheadsystems.quire.server.manager.SessionManager;
import com.codeheadsystems.quire.server.store.InMemoryCredentialStore;
import com.codeheadsystems.quire.server.store.InMemorySessionStore;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(DropwizardExtensionsSupport.class)
class AuthResourceTest {

  private static final Duration TTL = Duration.ofMinutes(30);
  private static final String PASSWORD = "correct-horse-battery";

  private static final SessionManager SESSION_MANAGER = new SessionManager(new InMemorySessionStore(),
      new RandomProvider(), Clock.systemUTC(), TTL, false, Duration.ZERO);
  private static final QuireAuthManager AUTH_MANAGER = new QuireAuthManager(
      new InMemoryCredentialStore(), new Argon2idPasswordHasher(new HashingConfig(1024, 1, 1)),
      SESSION_MANAGER);

  static final ResourceExtension RESOURCES = ResourceExtension.builder()
      .addResource(new AuthResource(AUTH_MANAGER, SESSION_MANAGER,
          new SessionCookies(true, "quire_session", true)))
      .addProvider(new QuireExceptionMapper())
      .build();

  private Response register(String identity) {
    return RESOURCES.target("/api/register").request()
        .post(Entity.json(new RegisterRequest(identity, PASSWORD, "Reader")));
  }

  private Response login(String identity, String credential) {
    return RESOURCES.target("/api/login").request()
        .post(Entity.json(new LoginRequest(identity, credential)));
  }

  private String loginToken(String identity) {
    return login(identity, PASSWORD).readEntity(LoginResponse.class).token();
  }

  @Test
  void register_returns201WithPublicView() {
    Response response = register("register-201@example.com");

    assertThat(response.getStatus()).isEqualTo(201);
    AccountResponse account = response.readEntity(AccountResponse.class);
    assertThat(account.identity()).isEqualTo("register-201@example.com");
    assertThat(account.displayName()).isEqualTo("Reader");
    assertThat(account.accountId()).isNotBlank();
  }

  @Test
  void register_duplicate_returns409() {
    register("dup@example.com");

    Response response = register("DUP@example.com");

    assertThat(response.getStatus()).isEqualTo(409);
    assertThat(response.readEntity(ErrorResponse.class).error()).isEqualTo("DuplicateIdentity");
  }

  @Test
  void register_invalidIdentity_returns400() {
    Response response = register("not-an-email");

    assertThat(response.getStatus()).isEqualTo(400);
    ErrorResponse error = response.readEntity(ErrorResponse.class);
    assertThat(error.error()).isEqualTo("ValidationError");
    assertThat(error.message()).contains("identity");
  }

  @Test
  void login_returnsTokenAndSessionCookie() {
    register("login-ok@example.com");

    Response response = login("login-ok@example.com", PASSWORD);

    assertThat(response.getStatus()).isEqualTo(200);
    LoginResponse body = response.readEntity(LoginResponse.class);
    assertThat(body.token()).hasSize(43);
    assertThat(body.expiresAt()).endsWith("Z");
    assertThat(response.getHeaderString(HttpHeaders.SET_COOKIE))
        .isEqualTo("quire_session=" + body.token()
            + "; Path=/; Max-Age=1800; HttpOnly; SameSite=Strict; Secure");
  }

  @Test
  void login_unknownAndWrong_returnIdenticalBodies() {
    register("login-bad@example.com");

    Response unknown = login("nobody@example.com", PASSWORD);
    Response wrong = login("login-bad@example.com", "wrong-credential");

    assertThat(unknown.getStatus()).isEqualTo(401);
    assertThat(wrong.getStatus()).isEqualTo(401);
    assertThat(unknown.readEntity(String.class)).isEqualTo(wrong.readEntity(String.class));
    assertThat(unknown.getHeaderString(HttpHeaders.SET_COOKIE)).isNull();
  }

  @Test
  void logout_bearerToken_revokesAndClearsCookie() {
    register("logout@example.com");
    String token = login("logout@example.com", PASSWORD).readEntity(LoginResponse.class).token();

    Response first = RESOURCES.target("/api/logout").request()
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
        .post(Entity.json(""));
    Response second = RESOURCES.target("/api/logout").request()
        .cookie("quire_session", token)
        .post(Entity.json(""));

    assertThat(first.getStatus()).isEqualTo(204);
    assertThat(second.getStatus()).isEqualTo(204);
    assertThat(first.getHeaderString(HttpHeaders.SET_COOKIE)).startsWith("quire_session=;");
    assertThatThrownBy(() -> SESSION_MANAGER.validate(token))
        .isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void logout_tokenInBody_revokes() {
    register("logout-body@example.com");
    String token = loginToken("logout-body@example.com");

    Response response = RESOURCES.target("/api/logout").request()
        .post(Entity.json(new LogoutRequest(token)));

    assertThat(response.getStatus()).isEqualTo(204);
    assertThatThrownBy(() -> SESSION_MANAGER.validate(token))
        .isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void logout_headerTokenWinsOverBodyToken() {
    register("logout-both@example.com");
    String headerToken = loginToken("logout-both@example.com");
    String bodyToken = loginToken("logout-both@example.com");

    RESOURCES.target("/api/logout").request()
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + headerToken)
        .post(Entity.json(new LogoutRequest(bodyToken)));

    assertThatThrownBy(() -> SESSION_MANAGER.validate(headerToken))
        .isInstanceOf(UnauthorizedException.class);
    assertThat(SESSION_MANAGER.validate(bodyToken).token()).isEqualTo(bodyToken);
  }

  @Test
  void logout_withoutToken_returns204() {
    Response response = RESOURCES.target("/api/logout").request().post(Entity.json(""));

    assertThat(response.getStatus()).isEqualTo(204);
  }

  @Test
  void exceptionMapper_unavailable_setsRetryAfter() {
    Response response = new QuireExceptionMapper().toResponse(new UnavailableException());

    assertThat(response.getStatus()).isEqualTo(503);
    assertThat(response.getHeaderString(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
    assertThat(((ErrorResponse) response.getEntity()).error()).isEqualTo("Unavailable");
  }
}
