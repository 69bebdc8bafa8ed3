package com.codeheadsystems.quire.server.resource;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.ws.rs.core.Cookie;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SessionCookiesTest {

  private final SessionCookies cookies = new SessionCookies(true, "quire_session", true);

  @Test
  void token_prefersBearerHeader() {
    Map<String, Cookie> jar = Map.of("quire_session", new Cookie("quire_session", "from-cookie"));

    assertThat(cookies.token("Bearer from-header", jar)).contains("from-header");
  }

  @Test
  void token_bearerSchemeIsCaseInsensitive() {
    assertThat(cookies.token("bearer abc", null)).contains("abc");
  }

  @Test
  void token_fallsBackToCookie() {
    Map<String, Cookie> jar = Map.of("quire_session", new Cookie("quire_session", "from-cookie"));

    assertThat(cookies.token(null, jar)).contains("from-cookie");
    assertThat(cookies.token("Basic dXNlcjpwdw==", jar)).contains("from-cookie");
    assertThat(cookies.token("Bearer    ", jar)).contains("from-cookie");
  }

  @Test
  void token_cookieIgnoredWhenDisabled() {
    Map<String, Cookie> jar = Map.of("quire_session", new Cookie("quire_session", "from-cookie"));

    assertThat(SessionCookies.headerOnly().token(null, jar)).isEmpty();
  }

  @Test
  void token_nothingPresented_isEmpty() {
    assertThat(cookies.token(null, Map.of())).isEmpty();
    assertThat(cookies.token("Bearer", null)).isEmpty();
  }

  @Test
  void sessionCookie_carriesSecurityAttributes() {
    assertThat(cookies.sessionCookie("tok", 1800))
        .isEqualTo("quire_session=tok; Path=/; Max-Age=1800; HttpOnly; SameSite=Strict; Secure");
  }

  @Test
  void sessionCookie_withoutSecure() {
    SessionCookies insecure = new SessionCookies(true, "sid", false);

    assertThat(insecure.sessionCookie("tok", 60))
        .isEqualTo("sid=tok; Path=/; Max-Age=60; HttpOnly; SameSite=Strict");
  }

  @Test
  void clearingCookie_expiresImmediately() {
    assertThat(cookies.clearingCookie())
        .isEqualTo("quire_session=; Path=/; Max-Age=0; HttpOnly; SameSite=Strict; Secure");
  }
}
