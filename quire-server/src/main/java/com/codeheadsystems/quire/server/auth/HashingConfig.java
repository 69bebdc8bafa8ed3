package com.codeheadsystems.quire.server.auth;

/**
 * Argon2id work factors.
 *
 * @param memoryKib   memory cost in kibibytes
 * @param iterations  number of passes
 * @param parallelism lanes
 */
public record HashingConfig(int memoryKib, int iterations, int parallelism) {

  /**
   * Production defaults: 64 MiB, 3 passes, 1 lane.
   */
  public static final HashingConfig DEFAULT = new HashingConfig(65536, 3, 1);

  public HashingConfig {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1");
    }
    if (iterations < 1) {
      throw new IllegalArgumentException("iterations must be >= 1");
    }
    // Argon2 requires at least 8 KiB per lane.
    if (memoryKib < 8 * parallelism) {
      throw new IllegalArgumentException("memoryKib must be >= 8 * parallelism");
    }
  }
}
