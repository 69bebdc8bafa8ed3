package com.codeheadsystems.quire.server.auth;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used by {@link Argon2idPasswordHasher} for salts and by the session manager for tokens.
 */
public record RandomProvider(SecureRandom random) {

  private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Generates a URL-safe token carrying {@code byteLength * 8} bits of entropy.
   *
   * @param byteLength the number of random bytes behind the token
   * @return base64url text without padding
   */
  public String randomToken(int byteLength) {
    return URL_ENCODER.encodeToString(randomBytes(byteLength));
  }
}
