package com.codeheadsystems.tessera.crypto.backup;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Plaintext content of an encrypted credential backup.
 *
 * @param credentials named secrets, for example connection strings
 * @param timestamp   creation time in epoch milliseconds
 * @param version     backup format version
 */
public record CredentialBackup(
    @JsonProperty("credentials") Map<String, String> credentials,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("version") String version) {

  public CredentialBackup {
    credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
  }
}
