package com.codeheadsystems.quire.server.auth;

import com.codeheadsystems.quire.server.exception.CorruptCredentialException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PasswordHasher} backed by BouncyCastle's Argon2id.
 * <p>
 * Output uses the PHC string format, e.g.
 * <pre>
 *   $argon2id$v=19$m=65536,t=3,p=1$&lt;salt&gt;$&lt;digest&gt;
 * </pre>
 * with unpadded standard base64 for salt and digest. Every call to {@link #hash} draws a fresh
 * 16-byte salt.
 */
public class Argon2idPasswordHasher implements PasswordHasher {

  private static final Logger log = LoggerFactory.getLogger(Argon2idPasswordHasher.class);
  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  static final String ALGORITHM = "argon2id";
  static final int VERSION = Argon2Parameters.ARGON2_VERSION_13;
  static final int SALT_LENGTH = 16;
  static final int HASH_LENGTH = 32;

  // Bounds applied when parsing stored hashes; anything outside is treated as corrupt.
  private static final int MAX_MEMORY_KIB = 4 * 1024 * 1024;
  private static final int MAX_ITERATIONS = 64;
  private static final int MAX_PARALLELISM = 64;
  private static final int MIN_SALT_LENGTH = 8;
  private static final int MIN_HASH_LENGTH = 16;
  private static final int MAX_HASH_LENGTH = 128;

  private final HashingConfig config;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Argon2id password hasher.
   *
   * @param config         the work factors used for new hashes
   * @param randomProvider the salt source
   */
  public Argon2idPasswordHasher(HashingConfig config, RandomProvider randomProvider) {
    this.config = Objects.requireNonNull(config, "config");
    this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
    log.info("Argon2idPasswordHasher(m={}, t={}, p={})",
        config.memoryKib(), config.iterations(), config.parallelism());
  }

  /**
   * Instantiates a new Argon2id password hasher with a default {@link RandomProvider}.
   *
   * @param config the work factors used for new hashes
   */
  public Argon2idPasswordHasher(HashingConfig config) {
    this(config, new RandomProvider());
  }

  @Override
  public String hash(String plaintext) {
    Objects.requireNonNull(plaintext, "plaintext");
    byte[] salt = randomProvider.randomBytes(SALT_LENGTH);
    byte[] digest = derive(plaintext, salt, config.memoryKib(), config.iterations(),
        config.parallelism(), HASH_LENGTH);
    return String.format(Locale.ROOT, "$%s$v=%d$m=%d,t=%d,p=%d$%s$%s",
        ALGORITHM, VERSION, config.memoryKib(), config.iterations(), config.parallelism(),
        B64.encodeToString(salt), B64.encodeToString(digest));
  }

  @Override
  public boolean verify(String plaintext, String credentialHash) {
    Objects.requireNonNull(plaintext, "plaintext");
    ParsedHash parsed = parse(credentialHash);
    byte[] candidate = derive(plaintext, parsed.salt(), parsed.memoryKib(), parsed.iterations(),
        parsed.parallelism(), parsed.digest().length);
    return Arrays.constantTimeAreEqual(candidate, parsed.digest());
  }

  @Override
  public boolean needsRehash(String credentialHash) {
    ParsedHash parsed = parse(credentialHash);
    return parsed.memoryKib() < config.memoryKib()
        || parsed.iterations() < config.iterations()
        || parsed.parallelism() != config.parallelism()
        || parsed.digest().length < HASH_LENGTH;
  }

  private static byte[] derive(String plaintext, byte[] salt, int memoryKib, int iterations,
                               int parallelism, int length) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(VERSION)
        .withSalt(salt)
        .withMemoryAsKB(memoryKib)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(params);
    byte[] password = plaintext.getBytes(StandardCharsets.UTF_8);
    byte[] out = new byte[length];
    try {
      generator.generateBytes(password, out, 0, out.length);
    } finally {
      Arrays.fill(password, (byte) 0);
    }
    return out;
  }

  static ParsedHash parse(String credentialHash) {
    if (credentialHash == null || credentialHash.isEmpty()) {
      throw new CorruptCredentialException("Credential hash is empty");
    }
    // "$argon2id$v=19$m=..,t=..,p=..$salt$digest" splits into 6 parts, the first empty.
    String[] parts = credentialHash.split("\\$", -1);
    if (parts.length != 6 || !parts[0].isEmpty()) {
      throw new CorruptCredentialException("Credential hash has an unexpected layout");
    }
    if (!ALGORITHM.equals(parts[1])) {
      throw new CorruptCredentialException("Unsupported hash algorithm");
    }
    if (!("v=" + VERSION).equals(parts[2])) {
      throw new CorruptCredentialException("Unsupported Argon2 version");
    }
    int memoryKib = -1;
    int iterations = -1;
    int parallelism = -1;
    for (String param : parts[3].split(",", -1)) {
      int eq = param.indexOf('=');
      if (eq <= 0) {
        throw new CorruptCredentialException("Malformed hash parameter");
      }
      int value = parseInt(param.substring(eq + 1));
      switch (param.substring(0, eq)) {
        case "m" -> memoryKib = value;
        case "t" -> iterations = value;
        case "p" -> parallelism = value;
        default -> throw new CorruptCredentialException("Unknown hash parameter");
      }
    }
    if (parallelism < 1 || parallelism > MAX_PARALLELISM
        || iterations < 1 || iterations > MAX_ITERATIONS
        || memoryKib < 8 * parallelism || memoryKib > MAX_MEMORY_KIB) {
      throw new CorruptCredentialException("Hash parameters out of range");
    }
    byte[] salt = decode(parts[4]);
    byte[] digest = decode(parts[5]);
    if (salt.length < MIN_SALT_LENGTH) {
      throw new CorruptCredentialException("Salt too short");
    }
    if (digest.length < MIN_HASH_LENGTH || digest.length > MAX_HASH_LENGTH) {
      throw new CorruptCredentialException("Digest length out of range");
    }
    return new ParsedHash(memoryKib, iterations, parallelism, salt, digest);
  }

  private static int parseInt(String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new CorruptCredentialException("Malformed hash parameter", e);
    }
  }

  private static byte[] decode(String value) {
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new CorruptCredentialException("Invalid base64 in credential hash", e);
    }
  }

  record ParsedHash(int memoryKib, int iterations, int parallelism, byte[] salt, byte[] digest) {
  }
}
