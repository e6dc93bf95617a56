package com.codeheadsystems.tessera.server.otp;

import com.codeheadsystems.tessera.crypto.common.RandomProvider;

/**
 * Six digit codes drawn uniformly from [100000, 999999].
 */
public class OtpCodeGenerator {

  public static final int MIN_CODE = 100_000;
  public static final int MAX_CODE = 999_999;

  private final RandomProvider randomProvider;

  public OtpCodeGenerator(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  public String generate() {
    return Integer.toString(randomProvider.randomInt(MIN_CODE, MAX_CODE + 1));
  }
}
