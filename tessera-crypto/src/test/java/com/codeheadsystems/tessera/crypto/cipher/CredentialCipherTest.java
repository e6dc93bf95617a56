package com.codeheadsystems.tessera.crypto.cipher;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.crypto.common.DeploymentMode;
import com.codeheadsystems.tessera.crypto.common.RandomProvider;
import com.codeheadsystems.tessera.crypto.exceptions.ConfigurationException;
import com.codeheadsystems.tessera.crypto.exceptions.DecryptionException;
import com.codeheadsystems.tessera.crypto.kdf.Argon2idBackend;
import com.codeheadsystems.tessera.crypto.kdf.KdfAlgorithm;
import com.codeheadsystems.tessera.crypto.kdf.KdfExecutor;
import com.codeheadsystems.tessera.crypto.kdf.KdfParameters;
import com.codeheadsystems.tessera.crypto.kdf.KeyDerivationBackendSelector;
import com.codeheadsystems.tessera.crypto.kdf.Pbkdf2Backend;
import java.time.Duration;
import java.util.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialCipherTest {

  private static final byte[] PASSPHRASE = "correct horse battery staple".getBytes(UTF_8);

  private CredentialCipher cipher;

  @BeforeEach
  void setUp() {
    cipher = new CredentialCipher(KdfParameters.forTesting(), DeploymentMode.DEVELOPMENT,
        new KeyDerivationBackendSelector(), new KdfExecutor(), new RandomProvider());
  }

  @AfterEach
  void tearDown() {
    cipher.shutdown();
  }

  // ── Round trip ───────────────────────────────────────────────────────────

  @Test
  void encryptDecrypt_roundTrip() {
    byte[] plaintext = "postgres://user:secret@db/prod".getBytes(UTF_8);
    EncryptedBlob blob = cipher.encrypt(plaintext, PASSPHRASE);
    assertThat(cipher.decrypt(blob, PASSPHRASE)).isEqualTo(plaintext);
  }

  @Test
  void encryptDecrypt_emptyPlaintext() {
    EncryptedBlob blob = cipher.encrypt(new byte[0], PASSPHRASE);
    assertThat(blob.ciphertext()).isEmpty();
    assertThat(cipher.decrypt(blob, PASSPHRASE)).isEmpty();
  }

  @Test
  void encryptToString_decryptToString() {
    String stored = cipher.encryptToString("api-key-123", "pass");
    assertThat(stored).startsWith("$argon2id$m=4096,t=2,p=1$");
    assertThat(cipher.decryptToString(stored, "pass")).isEqualTo("api-key-123");
  }

  @Test
  void encrypt_drawsFreshSaltAndIv() {
    EncryptedBlob first = cipher.encrypt("same".getBytes(UTF_8), PASSPHRASE);
    EncryptedBlob second = cipher.encrypt("same".getBytes(UTF_8), PASSPHRASE);
    assertThat(first.salt()).isNotEqualTo(second.salt());
    assertThat(first.iv()).isNotEqualTo(second.iv());
    assertThat(first.encode()).isNotEqualTo(second.encode());
  }

  // ── Tamper and failure ───────────────────────────────────────────────────

  @Test
  void decrypt_wrongPassphrase_fails() {
    EncryptedBlob blob = cipher.encrypt("secret".getBytes(UTF_8), PASSPHRASE);
    assertThatThrownBy(() -> cipher.decrypt(blob, "wrong".getBytes(UTF_8)))
        .isInstanceOf(DecryptionException.class)
        .hasMessage(DecryptionException.MESSAGE);
  }

  @Test
  void decrypt_flippedCiphertextOrTag_failsWithSameMessage() {
    EncryptedBlob blob = cipher.encrypt("secret".getBytes(UTF_8), PASSPHRASE);

    byte[] ciphertext = blob.ciphertext().clone();
    ciphertext[0] ^= 0x01;
    EncryptedBlob badCiphertext = new EncryptedBlob(blob.salt(), blob.iv(), blob.authTag(), ciphertext,
        blob.kdfParameters());

    byte[] tag = blob.authTag().clone();
    tag[tag.length - 1] ^= (byte) 0x80;
    EncryptedBlob badTag = new EncryptedBlob(blob.salt(), blob.iv(), tag, blob.ciphertext(),
        blob.kdfParameters());

    assertThatThrownBy(() -> cipher.decrypt(badCiphertext, PASSPHRASE))
        .isInstanceOf(DecryptionException.class)
        .hasMessage(DecryptionException.MESSAGE);
    assertThatThrownBy(() -> cipher.decrypt(badTag, PASSPHRASE))
        .isInstanceOf(DecryptionException.class)
        .hasMessage(DecryptionException.MESSAGE);
  }

  @Test
  void decrypt_shortOrMalformedInput_fails() {
    String tooShort = Base64.getEncoder().encodeToString(new byte[EncryptedBlob.MIN_WIRE_LENGTH - 1]);
    assertThatThrownBy(() -> cipher.decrypt(tooShort, PASSPHRASE))
        .isInstanceOf(DecryptionException.class);
    assertThatThrownBy(() -> cipher.decrypt("not base64 at all!", PASSPHRASE))
        .isInstanceOf(DecryptionException.class);
    assertThatThrownBy(() -> cipher.decryptToString(null, "pass"))
        .isInstanceOf(DecryptionException.class);
  }

  // ── Stored forms ─────────────────────────────────────────────────────────

  @Test
  void decrypt_blobWrittenWithOtherParameters_usesEmbeddedParameters() {
    CredentialCipher older = new CredentialCipher(KdfParameters.argon2id(13, 2), DeploymentMode.DEVELOPMENT,
        new KeyDerivationBackendSelector(), new KdfExecutor(), new RandomProvider());
    try {
      String stored = older.encryptToString("legacy", "pass");
      assertThat(cipher.decryptToString(stored, "pass")).isEqualTo("legacy");
    } finally {
      older.shutdown();
    }
  }

  @Test
  void decrypt_bareWireForm_usesConfiguredParameters() {
    EncryptedBlob blob = cipher.encrypt("bare".getBytes(UTF_8), PASSPHRASE);
    assertThat(cipher.decrypt(blob.encode(), PASSPHRASE)).isEqualTo("bare".getBytes(UTF_8));
  }

  @Test
  void decrypt_storedParametersBeyondDecodeBounds_failsWithoutDeriving() {
    EncryptedBlob blob = cipher.encrypt("x".getBytes(UTF_8), PASSPHRASE);
    String hostile = "$argon2id$m=" + (1 << 24) + ",t=3,p=1$" + blob.encode();
    assertThatThrownBy(() -> cipher.decrypt(hostile, PASSPHRASE))
        .isInstanceOf(DecryptionException.class);
  }

  @Test
  void decodeBounds_allowOneStepAboveConfigurableMaximum() {
    assertThat(EncryptedBlob.isDecodable(KdfParameters.argon2id(19, 3))).isTrue();
    assertThat(EncryptedBlob.isDecodable(KdfParameters.argon2id(20, 3))).isFalse();

    EncryptedBlob blob = cipher.encrypt("x".getBytes(UTF_8), PASSPHRASE);
    assertThatThrownBy(() -> cipher.decrypt("$argon2id$m=" + (1 << 20) + ",t=3,p=1$" + blob.encode(), PASSPHRASE))
        .isInstanceOf(DecryptionException.class);
  }

  // ── Passphrase hashing ───────────────────────────────────────────────────

  @Test
  void hashPassphrase_verifies() {
    String hash = cipher.hashPassphrase(PASSPHRASE);
    assertThat(hash).startsWith("$argon2id$v=19$m=4096,t=2,p=1$");
    assertThat(cipher.verifyPassphrase(PASSPHRASE, hash)).isTrue();
    assertThat(cipher.verifyPassphrase("nope".getBytes(UTF_8), hash)).isFalse();
  }

  @Test
  void hashPassphrase_saltsEachHash() {
    assertThat(cipher.hashPassphrase(PASSPHRASE)).isNotEqualTo(cipher.hashPassphrase(PASSPHRASE));
  }

  @Test
  void verifyPassphrase_neverThrows() {
    assertThat(cipher.verifyPassphrase(PASSPHRASE, null)).isFalse();
    assertThat(cipher.verifyPassphrase(PASSPHRASE, "")).isFalse();
    assertThat(cipher.verifyPassphrase(PASSPHRASE, "$argon2id$v=19$garbage")).isFalse();
    assertThat(cipher.verifyPassphrase(PASSPHRASE, "$bcrypt$2b$10$abc")).isFalse();
    assertThat(cipher.verifyPassphrase(null, cipher.hashPassphrase(PASSPHRASE))).isFalse();
  }

  @Test
  void verifyPassphrase_storedMemoryBeyondDecodeBounds_rejectedWithoutDeriving() {
    String hostile = cipher.hashPassphrase(PASSPHRASE).replace("m=4096,", "m=" + (1 << 22) + ",");

    long started = System.nanoTime();
    assertThat(cipher.verifyPassphrase(PASSPHRASE, hostile)).isFalse();
    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
  }

  // ── Configuration ────────────────────────────────────────────────────────

  @Test
  void production_outOfRangeParameters_rejectedAtConstruction() {
    assertThatThrownBy(() -> new CredentialCipher(KdfParameters.argon2id(10, 2), DeploymentMode.PRODUCTION,
        new KeyDerivationBackendSelector(), new KdfExecutor(1, 1, KdfExecutor.DEFAULT_TIMEOUT),
        new RandomProvider()))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void argon2Unavailable_fallsBackToPbkdf2() {
    CredentialCipher fallback = new CredentialCipher(KdfParameters.forTesting(), DeploymentMode.DEVELOPMENT,
        new KeyDerivationBackendSelector(() -> {
          throw new UnsatisfiedLinkError("argon2 unavailable");
        }, new Pbkdf2Backend()),
        new KdfExecutor(), new RandomProvider());
    try {
      assertThat(fallback.activeAlgorithm()).isEqualTo(KdfAlgorithm.PBKDF2_SHA256);
      String stored = fallback.encryptToString("fallback", "pass");
      assertThat(stored).startsWith("$pbkdf2-sha256$i=310000$");
      assertThat(fallback.decryptToString(stored, "pass")).isEqualTo("fallback");
      // blobs written with Argon2id cannot be opened without it
      String argon = cipher.encryptToString("argon", "pass");
      assertThatThrownBy(() -> fallback.decryptToString(argon, "pass"))
          .isInstanceOf(DecryptionException.class);
    } finally {
      fallback.shutdown();
    }
  }

  @Test
  void deriveKey_isDeterministic() {
    byte[] salt = new byte[EncryptedBlob.SALT_LENGTH];
    byte[] first = cipher.deriveKey(PASSPHRASE, salt, KdfParameters.forTesting());
    byte[] second = cipher.deriveKey(PASSPHRASE, salt, KdfParameters.forTesting());
    assertThat(first).hasSize(CredentialCipher.KEY_LENGTH).isEqualTo(second);
    assertThat(new Argon2idBackend().derive(PASSPHRASE, salt, KdfParameters.forTesting(),
        CredentialCipher.KEY_LENGTH)).isEqualTo(first);
  }
}
