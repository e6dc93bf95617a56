package com.codeheadsystems.tessera.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tessera.crypto.cipher.CredentialCipher;
import com.codeheadsystems.tessera.crypto.cipher.EncryptedBlob;
import com.codeheadsystems.tessera.crypto.common.RandomProvider;
import com.codeheadsystems.tessera.crypto.kdf.KdfConfigReport;
import java.util.Arrays;

/**
 * Health check that runs one encrypt/decrypt round trip through the configured KDF and reports
 * the active algorithm. Fails when the KDF pool is saturated or a derivation times out.
 */
public class CredentialCipherHealthCheck extends HealthCheck {

  private static final int PROBE_LENGTH = 16;

  private final CredentialCipher cipher;
  private final RandomProvider randomProvider;

  public CredentialCipherHealthCheck(CredentialCipher cipher, RandomProvider randomProvider) {
    this.cipher = cipher;
    this.randomProvider = randomProvider;
  }

  @Override
  protected Result check() {
    byte[] probe = randomProvider.randomBytes(PROBE_LENGTH);
    byte[] passphrase = randomProvider.randomBytes(PROBE_LENGTH);
    try {
      EncryptedBlob blob = cipher.encrypt(probe, passphrase);
      if (!Arrays.equals(probe, cipher.decrypt(blob, passphrase))) {
        return Result.unhealthy("Round trip returned different plaintext");
      }
    } catch (RuntimeException e) {
      return Result.unhealthy(e);
    }
    KdfConfigReport report = cipher.configReport();
    if (!report.warnings().isEmpty()) {
      return Result.healthy("algorithm=%s memoryMib=%d warnings=%s",
          cipher.activeAlgorithm().id(), report.memoryMib(), report.warnings());
    }
    return Result.healthy("algorithm=%s memoryMib=%d", cipher.activeAlgorithm().id(), report.memoryMib());
  }
}
