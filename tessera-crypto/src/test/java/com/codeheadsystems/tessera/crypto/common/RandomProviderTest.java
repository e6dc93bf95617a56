package com.codeheadsystems.tessera.crypto.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  @Test
  void customRandom_isPreserved() {
    SecureRandom custom = new SecureRandom();
    RandomProvider rp = new RandomProvider(custom);
    assertThat(rp.random()).isSameAs(custom);
  }

  @Test
  void randomBytes_returnsCorrectLength() {
    RandomProvider rp = new RandomProvider();
    assertThat(rp.randomBytes(0)).hasSize(0);
    assertThat(rp.randomBytes(32)).hasSize(32);
  }

  @Test
  void randomBytes_returnsDifferentValues() {
    RandomProvider rp = new RandomProvider();
    assertThat(rp.randomBytes(32)).isNotEqualTo(rp.randomBytes(32));
  }

  @Test
  void randomInt_staysWithinBounds() {
    RandomProvider rp = new RandomProvider();
    for (int i = 0; i < 10_000; i++) {
      assertThat(rp.randomInt(100_000, 1_000_000)).isBetween(100_000, 999_999);
    }
  }

  @Test
  void randomInt_invalidRange_throws() {
    RandomProvider rp = new RandomProvider();
    assertThatThrownBy(() -> rp.randomInt(5, 5)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void urlSafeToken_hasNoPaddingOrUnsafeCharacters() {
    RandomProvider rp = new RandomProvider();
    String token = rp.urlSafeToken(16);
    // 16 bytes -> 22 unpadded base64 characters
    assertThat(token).hasSize(22).matches("[A-Za-z0-9_-]+");
  }
}
