package com.codeheadsystems.tessera.crypto.kdf;

import java.util.List;

/**
 * Result of checking KDF parameters against the supported range.
 *
 * @param parameters      the parameters that were checked
 * @param memoryMib       memory cost in MiB
 * @param warnings        problems found, empty when none
 * @param recommendations tuning suggestions for the deployment mode
 * @param withinBounds    false when a value lies outside the permitted range
 */
public record KdfConfigReport(
    KdfParameters parameters,
    long memoryMib,
    List<String> warnings,
    List<String> recommendations,
    boolean withinBounds) {

  public KdfConfigReport {
    warnings = List.copyOf(warnings);
    recommendations = List.copyOf(recommendations);
  }
}
