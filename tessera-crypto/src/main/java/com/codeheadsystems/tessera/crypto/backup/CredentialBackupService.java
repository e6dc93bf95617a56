package com.codeheadsystems.tessera.crypto.backup;

import com.codeheadsystems.tessera.crypto.cipher.CredentialCipher;
import com.codeheadsystems.tessera.crypto.exceptions.DecryptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts a set of named credentials into a single portable backup string and restores it.
 * A backup that cannot be decrypted or parsed fails with {@link DecryptionException}.
 */
public class CredentialBackupService {

  private static final Logger log = LoggerFactory.getLogger(CredentialBackupService.class);

  public static final String VERSION = "1.0";

  private final CredentialCipher cipher;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Instantiates a new Credential backup service.
   *
   * @param cipher       the cipher
   * @param objectMapper JSON mapper for the backup payload
   * @param clock        source of the backup timestamp
   */
  public CredentialBackupService(CredentialCipher cipher, ObjectMapper objectMapper, Clock clock) {
    this.cipher = cipher;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Serializes and encrypts the credentials.
   *
   * @param credentials named secrets
   * @param passphrase  the backup passphrase
   * @return the encrypted backup in stored form
   */
  public String createBackup(Map<String, String> credentials, byte[] passphrase) {
    CredentialBackup backup = new CredentialBackup(credentials, clock.millis(), VERSION);
    byte[] json;
    try {
      json = objectMapper.writeValueAsBytes(backup);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize credential backup", e);
    }
    log.debug("createBackup(entries={})", backup.credentials().size());
    return cipher.encrypt(json, passphrase).toStoredForm();
  }

  /**
   * Decrypts and parses a backup.
   *
   * @param encryptedBackup the backup in stored form
   * @param passphrase      the backup passphrase
   * @return the backup content
   * @throws DecryptionException if the backup cannot be decrypted, parsed, or has an unknown version
   */
  public CredentialBackup restoreBackup(String encryptedBackup, byte[] passphrase) {
    byte[] json = cipher.decrypt(encryptedBackup, passphrase);
    CredentialBackup backup;
    try {
      backup = objectMapper.readValue(json, CredentialBackup.class);
    } catch (IOException e) {
      log.warn("Credential backup decrypted but its payload is not valid JSON");
      throw new DecryptionException(e);
    }
    if (!VERSION.equals(backup.version())) {
      log.warn("Unsupported credential backup version: {}", backup.version());
      throw new DecryptionException();
    }
    return backup;
  }
}
