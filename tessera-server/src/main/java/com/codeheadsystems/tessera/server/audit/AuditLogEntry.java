package com.codeheadsystems.tessera.server.audit;

import java.time.Instant;
import java.util.Map;

/**
 * One append-only audit record. {@code subjectHash} and {@code details} carry hashes and
 * opaque ids only, never raw identifiers, codes or passphrases.
 *
 * @param eventType   what happened
 * @param subjectHash hashed identifier or key the event is about, may be null
 * @param timestamp   when it happened
 * @param details     additional non-sensitive attributes
 */
public record AuditLogEntry(AuditEventType eventType, String subjectHash, Instant timestamp,
                            Map<String, String> details) {

  public AuditLogEntry {
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
