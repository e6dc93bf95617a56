package com.codeheadsystems.tessera.springboot.health;

import com.codeheadsystems.tessera.crypto.cipher.CredentialCipher;
import com.codeheadsystems.tessera.crypto.cipher.EncryptedBlob;
import com.codeheadsystems.tessera.crypto.common.RandomProvider;
import com.codeheadsystems.tessera.crypto.kdf.KdfConfigReport;
import java.util.Arrays;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the credential cipher as up when a random probe survives an encrypt/decrypt round
 * trip. Goes down when the KDF pool is saturated or a derivation times out.
 */
@Component
public class CredentialCipherHealthIndicator implements HealthIndicator {

  private static final int PROBE_LENGTH = 16;

  private final CredentialCipher cipher;
  private final RandomProvider randomProvider;

  public CredentialCipherHealthIndicator(CredentialCipher cipher, RandomProvider randomProvider) {
    this.cipher = cipher;
    this.randomProvider = randomProvider;
  }

  @Override
  public Health health() {
    byte[] probe = randomProvider.randomBytes(PROBE_LENGTH);
    byte[] passphrase = randomProvider.randomBytes(PROBE_LENGTH);
    try {
      EncryptedBlob blob = cipher.encrypt(probe, passphrase);
      if (!Arrays.equals(probe, cipher.decrypt(blob, passphrase))) {
        return Health.down().withDetail("error", "Round trip returned different plaintext").build();
      }
    } catch (RuntimeException e) {
      return Health.down(e).build();
    }
    KdfConfigReport report = cipher.configReport();
    return Health.up()
        .withDetail("algorithm", cipher.activeAlgorithm().id())
        .withDetail("memoryMib", report.memoryMib())
        .withDetail("warnings", report.warnings())
        .build();
  }
}
