package com.codeheadsystems.tessera.server.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps entries in memory. Intended for tests and local development.
 */
public class InMemoryAuditSink implements AuditSink {

  private final List<AuditLogEntry> entries = new CopyOnWriteArrayList<>();

  @Override
  public void record(AuditLogEntry entry) {
    entries.add(entry);
  }

  public List<AuditLogEntry> entries() {
    return List.copyOf(entries);
  }

  public List<AuditLogEntry> entriesOfType(AuditEventType type) {
    return entries.stream().filter(e -> e.eventType() == type).toList();
  }

  public void clear() {
    entries.clear();
  }
}
