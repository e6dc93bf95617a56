package com.codeheadsystems.tessera.crypto.cipher;

import static com.codeheadsystems.tessera.crypto.common.ByteUtils.concat;
import static com.codeheadsystems.tessera.crypto.common.ByteUtils.slice;

import com.codeheadsystems.tessera.crypto.common.ByteUtils;
import com.codeheadsystems.tessera.crypto.common.DeploymentMode;
import com.codeheadsystems.tessera.crypto.common.RandomProvider;
import com.codeheadsystems.tessera.crypto.exceptions.ConfigurationException;
import com.codeheadsystems.tessera.crypto.exceptions.DecryptionException;
import com.codeheadsystems.tessera.crypto.kdf.KdfAlgorithm;
import com.codeheadsystems.tessera.crypto.kdf.KdfConfigReport;
import com.codeheadsystems.tessera.crypto.kdf.KdfConfigValidator;
import com.codeheadsystems.tessera.crypto.kdf.KdfExecutor;
import com.codeheadsystems.tessera.crypto.kdf.KdfParameters;
import com.codeheadsystems.tessera.crypto.kdf.KeyDerivationBackend;
import com.codeheadsystems.tessera.crypto.kdf.KeyDerivationBackendSelector;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Password-based authenticated encryption of stored secrets.
 * <p>
 * Keys are derived with Argon2id (PBKDF2-HMAC-SHA256 when Argon2id cannot be loaded) on a bounded
 * {@link KdfExecutor} and used for AES-256-GCM. Every {@link #encrypt} call draws a fresh salt and
 * IV. No key material is kept between calls, so one instance may serve concurrent callers.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link DecryptionException}: any decryption failure, cause not revealed</li>
 *   <li>{@link ConfigurationException}: KDF parameters rejected at startup, or a derivation
 *       exceeded the executor timeout</li>
 * </ul>
 * {@link #verifyPassphrase} never throws.
 */
public class CredentialCipher {

  private static final Logger log = LoggerFactory.getLogger(CredentialCipher.class);

  public static final int KEY_LENGTH = 32;
  public static final int HASH_SALT_LENGTH = 16;
  public static final int HASH_LENGTH = 32;
  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int TAG_BITS = EncryptedBlob.TAG_LENGTH * 8;

  private final KdfParameters parameters;
  private final KdfConfigReport configReport;
  private final KeyDerivationBackendSelector backends;
  private final KdfExecutor executor;
  private final RandomProvider randomProvider;

  /**
   * Creates a cipher and validates its KDF parameters.
   *
   * @param parameters     preferred KDF parameters
   * @param mode           deployment mode, decides whether out-of-range parameters are fatal
   * @param backends       backend selector
   * @param executor       worker pool for derivations
   * @param randomProvider source of salts and IVs
   * @throws ConfigurationException in production when the parameters are out of range
   */
  public CredentialCipher(KdfParameters parameters,
                          DeploymentMode mode,
                          KeyDerivationBackendSelector backends,
                          KdfExecutor executor,
                          RandomProvider randomProvider) {
    this.configReport = KdfConfigValidator.validateOnStartup(parameters, mode);
    this.parameters = parameters;
    this.backends = backends;
    this.executor = executor;
    this.randomProvider = randomProvider;
  }

  /**
   * Cipher with the default backend selector, executor and random source.
   *
   * @param parameters preferred KDF parameters
   * @param mode       deployment mode
   * @return the cipher
   */
  public static CredentialCipher create(KdfParameters parameters, DeploymentMode mode) {
    return new CredentialCipher(parameters, mode, new KeyDerivationBackendSelector(),
        new KdfExecutor(), new RandomProvider());
  }

  // ── Key derivation ───────────────────────────────────────────────────────

  /**
   * Derives a 256-bit key.
   *
   * @param passphrase the passphrase
   * @param salt       the salt
   * @param params     KDF parameters
   * @return 32 key bytes
   * @throws ConfigurationException   if the derivation times out
   * @throws IllegalArgumentException if no loaded backend supports {@code params}
   */
  public byte[] deriveKey(byte[] passphrase, byte[] salt, KdfParameters params) {
    return derive(passphrase, salt, params, KEY_LENGTH);
  }

  // ── Encryption ───────────────────────────────────────────────────────────

  /**
   * Encrypts {@code plaintext} (possibly empty) under a key derived from {@code passphrase}.
   *
   * @param plaintext  the plaintext
   * @param passphrase the passphrase
   * @return the blob
   */
  public EncryptedBlob encrypt(byte[] plaintext, byte[] passphrase) {
    KdfParameters params = activeParameters();
    byte[] salt = randomProvider.randomBytes(EncryptedBlob.SALT_LENGTH);
    byte[] iv = randomProvider.randomBytes(EncryptedBlob.IV_LENGTH);
    byte[] key = deriveKey(passphrase, salt, params);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, iv));
      byte[] sealed = cipher.doFinal(plaintext);
      int ctLength = sealed.length - EncryptedBlob.TAG_LENGTH;
      return new EncryptedBlob(salt, iv,
          slice(sealed, ctLength, EncryptedBlob.TAG_LENGTH),
          slice(sealed, 0, ctLength),
          params);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM is not available", e);
    } finally {
      ByteUtils.wipe(key);
    }
  }

  /**
   * Encrypts a UTF-8 string and returns the stored form.
   *
   * @param plaintext  the plaintext
   * @param passphrase the passphrase
   * @return the stored form, see {@link EncryptedBlob#toStoredForm()}
   */
  public String encryptToString(String plaintext, String passphrase) {
    return encrypt(plaintext.getBytes(StandardCharsets.UTF_8),
        passphrase.getBytes(StandardCharsets.UTF_8)).toStoredForm();
  }

  // ── Decryption ───────────────────────────────────────────────────────────

  /**
   * Verifies the tag and decrypts. No plaintext is returned unless the tag verifies.
   *
   * @param blob       the blob
   * @param passphrase the passphrase
   * @return the plaintext
   * @throws DecryptionException on any failure
   */
  public byte[] decrypt(EncryptedBlob blob, byte[] passphrase) {
    if (blob == null || passphrase == null
        || blob.salt().length != EncryptedBlob.SALT_LENGTH
        || blob.iv().length != EncryptedBlob.IV_LENGTH
        || blob.authTag().length != EncryptedBlob.TAG_LENGTH) {
      throw new DecryptionException();
    }
    byte[] key;
    try {
      key = deriveKey(passphrase, blob.salt(), blob.kdfParameters());
    } catch (IllegalArgumentException e) {
      log.debug("No backend for blob parameters {}", blob.kdfParameters().algorithm());
      throw new DecryptionException(e);
    }
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
          new GCMParameterSpec(TAG_BITS, blob.iv()));
      return cipher.doFinal(concat(blob.ciphertext(), blob.authTag()));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      log.debug("Decryption failed: {}", e.getClass().getSimpleName());
      throw new DecryptionException(e);
    } finally {
      ByteUtils.wipe(key);
    }
  }

  /**
   * Decrypts a stored form, or a bare wire form using the configured parameters.
   *
   * @param stored     the stored form
   * @param passphrase the passphrase
   * @return the plaintext
   * @throws DecryptionException on any failure
   */
  public byte[] decrypt(String stored, byte[] passphrase) {
    return decrypt(EncryptedBlob.fromStoredForm(stored, activeParameters()), passphrase);
  }

  /**
   * Decrypts a stored form into a UTF-8 string.
   *
   * @param stored     the stored form
   * @param passphrase the passphrase
   * @return the plaintext
   * @throws DecryptionException on any failure
   */
  public String decryptToString(String stored, String passphrase) {
    if (passphrase == null) {
      throw new DecryptionException();
    }
    return new String(decrypt(stored, passphrase.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
  }

  // ── Passphrase hashing ───────────────────────────────────────────────────

  /**
   * Hashes a passphrase for storage with a fresh salt.
   *
   * @param passphrase the passphrase
   * @return the PHC string
   */
  public String hashPassphrase(byte[] passphrase) {
    KdfParameters params = activeParameters();
    byte[] salt = randomProvider.randomBytes(HASH_SALT_LENGTH);
    byte[] hash = derive(passphrase, salt, params, HASH_LENGTH);
    return new PassphraseHash(params, salt, hash).encode();
  }

  /**
   * Checks a passphrase against a stored PHC string in constant time.
   *
   * @param passphrase the passphrase
   * @param storedHash the PHC string
   * @return true on match; false on mismatch or any internal failure
   */
  public boolean verifyPassphrase(byte[] passphrase, String storedHash) {
    try {
      if (passphrase == null) {
        return false;
      }
      PassphraseHash expected = PassphraseHash.parse(storedHash);
      if (!EncryptedBlob.isDecodable(expected.parameters())) {
        return false;
      }
      byte[] actual = derive(passphrase, expected.salt(), expected.parameters(), expected.hash().length);
      return ByteUtils.constantTimeEquals(actual, expected.hash());
    } catch (RuntimeException e) {
      log.debug("Passphrase verification failed: {}", e.getClass().getSimpleName());
      return false;
    }
  }

  // ── Introspection ────────────────────────────────────────────────────────

  /**
   * Algorithm used for new blobs and hashes. Triggers backend selection.
   *
   * @return the algorithm
   */
  public KdfAlgorithm activeAlgorithm() {
    return activeParameters().algorithm();
  }

  /**
   * The parameters applied to new blobs and hashes: the configured ones, or the PBKDF2 default
   * if they name Argon2id and Argon2id could not be loaded.
   *
   * @return the parameters
   */
  public KdfParameters activeParameters() {
    if (backends.backendFor(parameters.algorithm()).isPresent()) {
      return parameters;
    }
    return KdfParameters.PBKDF2_DEFAULT;
  }

  public KdfConfigReport configReport() {
    return configReport;
  }

  /**
   * Releases the KDF worker threads.
   */
  public void shutdown() {
    executor.shutdown();
  }

  private byte[] derive(byte[] passphrase, byte[] salt, KdfParameters params, int length) {
    KeyDerivationBackend backend = backends.backendFor(params.algorithm())
        .orElseThrow(() -> new IllegalArgumentException("No backend for " + params.algorithm().id()));
    byte[] input = passphrase.clone();
    byte[] saltCopy = salt.clone();
    return executor.execute(() -> {
      try {
        return backend.derive(input, saltCopy, params, length);
      } finally {
        ByteUtils.wipe(input);
      }
    });
  }
}
