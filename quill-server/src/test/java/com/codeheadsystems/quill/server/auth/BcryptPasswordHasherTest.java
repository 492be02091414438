package com.codeheadsystems.quill.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BcryptPasswordHasherTest {

  // minimum cost keeps the suite fast
  private final BcryptPasswordHasher hasher = new BcryptPasswordHasher(4);

  @Test
  void hash_thenVerify_matches() {
    String hash = hasher.hash("P@ss1234");

    assertThat(hash).startsWith("$2");
    assertThat(hash).doesNotContain("P@ss1234");
    assertThat(hasher.verify("P@ss1234", hash)).isTrue();
  }

  @Test
  void verify_wrongPassword_isFalse() {
    String hash = hasher.hash("P@ss1234");

    assertThat(hasher.verify("wrong", hash)).isFalse();
  }

  @Test
  void hash_isSalted() {
    assertThat(hasher.hash("same")).isNotEqualTo(hasher.hash("same"));
  }

  @Test
  void verify_acceptsHashFromOtherCost() {
    String hash = new BcryptPasswordHasher(5).hash("P@ss1234");

    assertThat(hash).contains("$05$");
    assertThat(hasher.verify("P@ss1234", hash)).isTrue();
  }

  @Test
  void verify_malformedHash_isFalse() {
    assertThat(hasher.verify("P@ss1234", "plaintext-in-the-db")).isFalse();
    assertThat(hasher.verify("P@ss1234", "")).isFalse();
    assertThat(hasher.verify("P@ss1234", null)).isFalse();
  }

  @Test
  void hash_emptyPassword_throws() {
    assertThatThrownBy(() -> hasher.hash("")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_costOutOfRange_throws() {
    assertThatThrownBy(() -> new BcryptPasswordHasher(3)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new BcryptPasswordHasher(32)).isInstanceOf(IllegalArgumentException.class);
  }
}
