package com.codeheadsystems.tessera.server.audit;

/**
 * Append-only destination for audit entries. Implementations must be thread-safe and must not
 * throw; a failing sink must never break an authentication flow.
 */
public interface AuditSink {

  void record(AuditLogEntry entry);
}
