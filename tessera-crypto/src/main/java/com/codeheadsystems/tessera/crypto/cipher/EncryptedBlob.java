package com.codeheadsystems.tessera.crypto.cipher;

import static com.codeheadsystems.tessera.crypto.common.ByteUtils.concat;
import static com.codeheadsystems.tessera.crypto.common.ByteUtils.slice;

import com.codeheadsystems.tessera.crypto.exceptions.DecryptionException;
import com.codeheadsystems.tessera.crypto.kdf.KdfAlgorithm;
import com.codeheadsystems.tessera.crypto.kdf.KdfConfigValidator;
import com.codeheadsystems.tessera.crypto.kdf.KdfParameters;
import java.util.Base64;

/**
 * An AES-256-GCM ciphertext together with everything needed to decrypt it except the passphrase.
 * <p>
 * Wire form ({@link #encode()}): {@code base64(salt[32] ∥ iv[16] ∥ authTag[16] ∥ ciphertext)}.
 * Stored form ({@link #toStoredForm()}) prefixes the KDF parameters so they travel with the blob:
 * {@code $argon2id$m=65536,t=3,p=1$<wire>}.
 *
 * @param salt          KDF salt
 * @param iv            GCM nonce
 * @param authTag       GCM authentication tag
 * @param ciphertext    encrypted bytes, possibly empty
 * @param kdfParameters parameters used to derive the key
 */
public record EncryptedBlob(
    byte[] salt,
    byte[] iv,
    byte[] authTag,
    byte[] ciphertext,
    KdfParameters kdfParameters) {

  public static final int SALT_LENGTH = 32;
  public static final int IV_LENGTH = 16;
  public static final int TAG_LENGTH = 16;
  public static final int MIN_WIRE_LENGTH = SALT_LENGTH + IV_LENGTH + TAG_LENGTH;

  // Decode bounds; anything outside is treated as a malformed blob. Memory allows one step above
  // the configurable maximum so parameter upgrades stay readable.
  private static final int MAX_DECODE_MEMORY_EXPONENT = KdfConfigValidator.MAX_MEMORY_EXPONENT + 1;
  private static final int MAX_DECODE_TIME_COST = 10;
  private static final int MAX_DECODE_ITERATIONS = 10_000_000;

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  /**
   * Wire format, base64 of {@code salt ∥ iv ∥ authTag ∥ ciphertext}.
   *
   * @return the encoded blob
   */
  public String encode() {
    return B64.encodeToString(concat(salt, iv, authTag, ciphertext));
  }

  /**
   * Wire format prefixed with the encoded KDF parameters.
   *
   * @return the stored form
   */
  public String toStoredForm() {
    return "$" + kdfParameters.encode() + "$" + encode();
  }

  /**
   * Parses the wire format.
   *
   * @param wire          base64 wire form
   * @param kdfParameters parameters to associate with the blob
   * @return the blob
   * @throws DecryptionException if the input is not valid base64 or is too short
   */
  public static EncryptedBlob decode(String wire, KdfParameters kdfParameters) {
    if (wire == null) {
      throw new DecryptionException();
    }
    byte[] raw;
    try {
      raw = B64D.decode(wire.trim());
    } catch (IllegalArgumentException e) {
      throw new DecryptionException(e);
    }
    if (raw.length < MIN_WIRE_LENGTH) {
      throw new DecryptionException();
    }
    int offset = 0;
    byte[] salt = slice(raw, offset, SALT_LENGTH);
    offset += SALT_LENGTH;
    byte[] iv = slice(raw, offset, IV_LENGTH);
    offset += IV_LENGTH;
    byte[] tag = slice(raw, offset, TAG_LENGTH);
    offset += TAG_LENGTH;
    byte[] ciphertext = slice(raw, offset, raw.length - offset);
    return new EncryptedBlob(salt, iv, tag, ciphertext, kdfParameters);
  }

  /**
   * Parses the stored form. A value without the {@code $} prefix is treated as a bare wire
   * form and associated with {@code currentParameters}.
   *
   * @param stored            the stored form or wire form
   * @param currentParameters parameters for bare wire forms
   * @return the blob
   * @throws DecryptionException if the value is malformed or its parameters are out of bounds
   */
  public static EncryptedBlob fromStoredForm(String stored, KdfParameters currentParameters) {
    if (stored == null) {
      throw new DecryptionException();
    }
    if (!stored.startsWith("$")) {
      return decode(stored, currentParameters);
    }
    // "$alg$params$wire" splits into ["", alg, params, wire]
    String[] parts = stored.split("\\$", -1);
    if (parts.length != 4) {
      throw new DecryptionException();
    }
    KdfParameters parameters;
    try {
      parameters = KdfParameters.parse(parts[1], parts[2]);
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw new DecryptionException(e);
    }
    if (!isDecodable(parameters)) {
      throw new DecryptionException();
    }
    return decode(parts[3], parameters);
  }

  /**
   * Whether parameters read from storage are cheap enough to attempt a derivation with.
   *
   * @param parameters the parameters
   * @return true when within the decode bounds
   */
  static boolean isDecodable(KdfParameters parameters) {
    if (parameters.algorithm() == KdfAlgorithm.ARGON2ID) {
      return parameters.memoryExponent() <= MAX_DECODE_MEMORY_EXPONENT
          && parameters.timeCost() <= MAX_DECODE_TIME_COST;
    }
    return parameters.iterations() <= MAX_DECODE_ITERATIONS;
  }
}
