package com.codeheadsystems.tessera.crypto.cipher;

import com.codeheadsystems.tessera.crypto.kdf.KdfAlgorithm;
import com.codeheadsystems.tessera.crypto.kdf.KdfParameters;
import java.util.Base64;

/**
 * A PHC-format passphrase hash, for example
 * {@code $argon2id$v=19$m=65536,t=3,p=1$<salt>$<hash>} or
 * {@code $pbkdf2-sha256$i=310000$<salt>$<hash>}. Salt and hash use unpadded standard base64.
 * <p>
 * Argon2id memory must be a power of two KiB.
 *
 * @param parameters the KDF parameters
 * @param salt       the salt
 * @param hash       the derived hash
 */
public record PassphraseHash(KdfParameters parameters, byte[] salt, byte[] hash) {

  private static final String ARGON2_VERSION = "v=19";
  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  /**
   * Encodes this hash as a PHC string.
   *
   * @return the PHC string
   */
  public String encode() {
    String[] algorithmAndParams = parameters.encode().split("\\$");
    StringBuilder sb = new StringBuilder("$").append(algorithmAndParams[0]);
    if (parameters.algorithm() == KdfAlgorithm.ARGON2ID) {
      sb.append('$').append(ARGON2_VERSION);
    }
    return sb.append('$').append(algorithmAndParams[1])
        .append('$').append(B64.encodeToString(salt))
        .append('$').append(B64.encodeToString(hash))
        .toString();
  }

  /**
   * Parses a PHC string.
   *
   * @param encoded the PHC string
   * @return the parsed hash
   * @throws IllegalArgumentException if the string is malformed
   */
  public static PassphraseHash parse(String encoded) {
    if (encoded == null || !encoded.startsWith("$")) {
      throw new IllegalArgumentException("Not a PHC string");
    }
    String[] parts = encoded.split("\\$", -1);
    KdfAlgorithm algorithm = KdfAlgorithm.fromId(parts.length > 1 ? parts[1] : "");
    int index = 2;
    if (algorithm == KdfAlgorithm.ARGON2ID) {
      if (parts.length != 6 || !ARGON2_VERSION.equals(parts[2])) {
        throw new IllegalArgumentException("Unsupported Argon2 encoding");
      }
      index = 3;
    } else if (parts.length != 5) {
      throw new IllegalArgumentException("Unsupported PBKDF2 encoding");
    }
    KdfParameters parameters = KdfParameters.parse(algorithm.id(), parts[index]);
    byte[] salt = B64D.decode(parts[index + 1]);
    byte[] hash = B64D.decode(parts[index + 2]);
    if (salt.length == 0 || hash.length == 0) {
      throw new IllegalArgumentException("Empty salt or hash");
    }
    return new PassphraseHash(parameters, salt, hash);
  }
}
