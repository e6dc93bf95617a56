package com.codeheadsystems.tessera.crypto.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  @Test
  void concat_joinsInOrder() {
    assertThat(ByteUtils.concat(new byte[]{1, 2}, new byte[0], new byte[]{3}))
        .containsExactly(1, 2, 3);
  }

  @Test
  void slice_copiesRange() {
    byte[] source = {0, 1, 2, 3, 4};
    assertThat(ByteUtils.slice(source, 1, 3)).containsExactly(1, 2, 3);
    assertThat(ByteUtils.slice(source, 5, 0)).isEmpty();
  }

  @Test
  void slice_outOfBounds_throws() {
    assertThatThrownBy(() -> ByteUtils.slice(new byte[4], 2, 3))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constantTimeEquals_detectsDifferenceAtAnyPosition() {
    byte[] reference = new byte[64];
    for (int position = 0; position < reference.length; position++) {
      byte[] other = reference.clone();
      other[position] = 1;
      assertThat(ByteUtils.constantTimeEquals(reference, other)).isFalse();
    }
    assertThat(ByteUtils.constantTimeEquals(reference, reference.clone())).isTrue();
  }

  @Test
  void constantTimeEquals_mismatchPosition_doesNotChangeComparisonTime() {
    // Large inputs so an early exit would be orders of magnitude faster on a first-byte mismatch.
    byte[] reference = new byte[1 << 16];
    byte[] firstDiffers = reference.clone();
    firstDiffers[0] = 1;
    byte[] lastDiffers = reference.clone();
    lastDiffers[lastDiffers.length - 1] = 1;

    for (int i = 0; i < 2_000; i++) {
      ByteUtils.constantTimeEquals(reference, firstDiffers);
      ByteUtils.constantTimeEquals(reference, lastDiffers);
    }

    int rounds = 41;
    long[] first = new long[rounds];
    long[] last = new long[rounds];
    int matches = 0;
    for (int round = 0; round < rounds; round++) {
      long started = System.nanoTime();
      for (int i = 0; i < 50; i++) {
        matches += ByteUtils.constantTimeEquals(reference, firstDiffers) ? 1 : 0;
      }
      first[round] = System.nanoTime() - started;
      started = System.nanoTime();
      for (int i = 0; i < 50; i++) {
        matches += ByteUtils.constantTimeEquals(reference, lastDiffers) ? 1 : 0;
      }
      last[round] = System.nanoTime() - started;
    }
    Arrays.sort(first);
    Arrays.sort(last);
    double ratio = (double) last[rounds / 2] / first[rounds / 2];

    assertThat(matches).isZero();
    assertThat(ratio).isBetween(1.0 / 3, 3.0);
  }

  @Test
  void constantTimeEquals_differentLengthsOrNull_isFalse() {
    assertThat(ByteUtils.constantTimeEquals(new byte[2], new byte[3])).isFalse();
    assertThat(ByteUtils.constantTimeEquals((byte[]) null, new byte[3])).isFalse();
    assertThat(ByteUtils.constantTimeEquals("abc", null)).isFalse();
    assertThat(ByteUtils.constantTimeEquals("abc", "abc")).isTrue();
  }

  @Test
  void wipe_zeroesArray() {
    byte[] secret = {9, 9, 9};
    ByteUtils.wipe(secret);
    assertThat(secret).containsOnly(0);
    ByteUtils.wipe(null);
  }
}
