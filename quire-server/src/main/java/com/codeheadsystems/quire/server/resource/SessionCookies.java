package com.codeheadsystems.quire.server.resource;

import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * How session tokens travel between the front-end and the server.
 * <p>
 * A token is read from {@code Authorization: Bearer <token>} first and, when cookies are
 * enabled, from the session cookie second. The cookie is always {@code HttpOnly} and
 * {@code SameSite=Strict}; {@code Secure} is added when configured.
 *
 * @param cookieEnabled whether login sets, logout clears, and requests may present the cookie
 * @param cookieName    cookie name
 * @param cookieSecure  whether the cookie carries the {@code Secure} attribute
 */
public record SessionCookies(boolean cookieEnabled, String cookieName, boolean cookieSecure) {

  public static final String DEFAULT_COOKIE_NAME = "quire_session";
  private static final String BEARER_SCHEME = "bearer ";

  public SessionCookies {
    Objects.requireNonNull(cookieName, "cookieName");
  }

  /**
   * Header-only transport.
   *
   * @return settings with cookies disabled
   */
  public static SessionCookies headerOnly() {
    return new SessionCookies(false, DEFAULT_COOKIE_NAME, true);
  }

  /**
   * Extracts a token from request headers.
   *
   * @param headers the request headers
   * @return the token, if one was presented
   */
  public Optional<String> token(HttpHeaders headers) {
    return token(headers.getHeaderString(HttpHeaders.AUTHORIZATION), headers.getCookies());
  }

  /**
   * Extracts a token from an {@code Authorization} header value and the request cookies.
   *
   * @param authorization the raw header value, may be null
   * @param cookies       the request cookies, may be null
   * @return the token, if one was presented
   */
  public Optional<String> token(String authorization, Map<String, Cookie> cookies) {
    if (authorization != null
        && authorization.length() > BEARER_SCHEME.length()
        && authorization.regionMatches(true, 0, BEARER_SCHEME, 0, BEARER_SCHEME.length())) {
      String token = authorization.substring(BEARER_SCHEME.length()).strip();
      if (!token.isEmpty()) {
        return Optional.of(token);
      }
    }
    if (cookieEnabled && cookies != null) {
      Cookie cookie = cookies.get(cookieName);
      if (cookie != null && cookie.getValue() != null && !cookie.getValue().isBlank()) {
        return Optional.of(cookie.getValue());
      }
    }
    return Optional.empty();
  }

  /**
   * {@code Set-Cookie} value carrying a freshly issued token.
   *
   * @param token         the token
   * @param maxAgeSeconds cookie lifetime
   * @return the header value
   */
  public String sessionCookie(String token, long maxAgeSeconds) {
    return cookieName + "=" + token + attributes(maxAgeSeconds);
  }

  /**
   * {@code Set-Cookie} value that makes the browser drop the session cookie.
   *
   * @return the header value
   */
  public String clearingCookie() {
    return cookieName + "=" + attributes(0);
  }

  private String attributes(long maxAgeSeconds) {
    String attributes = String.format(Locale.ROOT, "; Path=/; Max-Age=%d; HttpOnly; SameSite=Strict",
        maxAgeSeconds);
    return cookieSecure ? attributes + "; Secure" : attributes;
  }
}
