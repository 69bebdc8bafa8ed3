package com.codeheadsystems.quire.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated Quire account.
 *
 * @param identity    normalized account identity
 * @param displayName the account's display name
 * @param token       the session token the request presented
 */
public record QuirePrincipal(String identity, String displayName, String token) implements Principal {

  @Override
  public String getName() {
    return identity;
  }

  @Override
  public String toString() {
    return "QuirePrincipal[identity=" + identity + "]";
  }
}
