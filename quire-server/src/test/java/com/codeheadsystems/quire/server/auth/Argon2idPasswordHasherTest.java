package com.codeheadsystems.quire.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.quire.server.exception.CorruptCredentialException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class Argon2idPasswordHasherTest {

  // Deliberately tiny work factors so the suite stays fast.
  private static final HashingConfig FAST = new HashingConfig(1024, 1, 1);
  private static final String PASSWORD = "correct horse battery staple";
  private static final String WELL_FORMED_FOREIGN_HASH =
      "$argon2id$v=19$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0$ZGlnZXN0ZGlnZXN0ZGlnZXN0";

  private Argon2idPasswordHasher hasher;

  @BeforeEach
  void setUp() {
    hasher = new Argon2idPasswordHasher(FAST);
  }

  @Test
  void hash_producesPhcString() {
    String hash = hasher.hash(PASSWORD);

    assertThat(hash).startsWith("$argon2id$v=19$m=1024,t=1,p=1$");
    assertThat(hash.split("\\$")).hasSize(6);
  }

  @Test
  void hash_neverContainsPlaintext() {
    assertThat(hasher.hash(PASSWORD)).doesNotContain(PASSWORD);
  }

  @Test
  void hash_samePlaintextTwice_differsBySalt() {
    assertThat(hasher.hash(PASSWORD)).isNotEqualTo(hasher.hash(PASSWORD));
  }

  @Test
  void verify_correctPlaintext_returnsTrue() {
    String hash = hasher.hash(PASSWORD);

    assertThat(hasher.verify(PASSWORD, hash)).isTrue();
  }

  @Test
  void verify_wrongPlaintext_returnsFalse() {
    String hash = hasher.hash(PASSWORD);

    assertThat(hasher.verify("correct horse battery stapler", hash)).isFalse();
    assertThat(hasher.verify("", hash)).isFalse();
  }

  @Test
  void verify_unicodePlaintext_roundTrips() {
    String hash = hasher.hash("pässwörd-日本語");

    assertThat(hasher.verify("pässwörd-日本語", hash)).isTrue();
    assertThat(hasher.verify("passwort-日本語", hash)).isFalse();
  }

  @Test
  void verify_usesParametersEmbeddedInHash() {
    Argon2idPasswordHasher stronger = new Argon2idPasswordHasher(new HashingConfig(2048, 2, 1));
    String weakHash = hasher.hash(PASSWORD);

    assertThat(stronger.verify(PASSWORD, weakHash)).isTrue();
  }

  @Test
  void verify_wellFormedForeignHash_returnsFalse() {
    assertThat(hasher.verify(PASSWORD, WELL_FORMED_FOREIGN_HASH)).isFalse();
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "",
      "plaintext-password",
      "argon2id$v=19$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0$ZGlnZXN0ZGlnZXN0ZGlnZXN0",
      "$argon2i$v=19$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0$ZGlnZXN0ZGlnZXN0ZGlnZXN0",
      "$argon2id$v=16$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0$ZGlnZXN0ZGlnZXN0ZGlnZXN0",
      "$argon2id$v=19$m=abc,t=1,p=1$c2FsdHNhbHRzYWx0$ZGlnZXN0ZGlnZXN0ZGlnZXN0",
      "$argon2id$v=19$m=1024,t=0,p=1$c2FsdHNhbHRzYWx0$ZGlnZXN0ZGlnZXN0ZGlnZXN0",
      "$argon2id$v=19$m=4,t=1,p=1$c2FsdHNhbHRzYWx0$ZGlnZXN0ZGlnZXN0ZGlnZXN0",
      "$argon2id$v=19$m=1024,t=1,x=1$c2FsdHNhbHRzYWx0$ZGlnZXN0ZGlnZXN0ZGlnZXN0",
      "$argon2id$v=19$m=1024,t=1,p=1$!!!notbase64$ZGlnZXN0ZGlnZXN0ZGlnZXN0",
      "$argon2id$v=19$m=1024,t=1,p=1$c2FsdA$ZGlnZXN0ZGlnZXN0ZGlnZXN0",
      "$argon2id$v=19$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0$c2hvcnQ",
      "$argon2id$v=19$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0"
  })
  void verify_corruptHash_throwsCorruptCredential(String corrupt) {
    assertThatThrownBy(() -> hasher.verify(PASSWORD, corrupt))
        .isInstanceOf(CorruptCredentialException.class);
  }

  @Test
  void verify_nullHash_throwsCorruptCredential() {
    assertThatThrownBy(() -> hasher.verify(PASSWORD, null))
        .isInstanceOf(CorruptCredentialException.class);
  }

  @Test
  void needsRehash_sameParameters_returnsFalse() {
    assertThat(hasher.needsRehash(hasher.hash(PASSWORD))).isFalse();
  }

  @Test
  void needsRehash_weakerStoredParameters_returnsTrue() {
    Argon2idPasswordHasher stronger = new Argon2idPasswordHasher(new HashingConfig(2048, 2, 1));

    assertThat(stronger.needsRehash(hasher.hash(PASSWORD))).isTrue();
  }

  @Test
  void parse_extractsParameters() {
    Argon2idPasswordHasher.ParsedHash parsed = Argon2idPasswordHasher.parse(WELL_FORMED_FOREIGN_HASH);

    assertThat(parsed.memoryKib()).isEqualTo(1024);
    assertThat(parsed.iterations()).isEqualTo(1);
    assertThat(parsed.parallelism()).isEqualTo(1);
    assertThat(parsed.salt()).hasSize(12);
    assertThat(parsed.digest()).hasSize(18);
  }
}
