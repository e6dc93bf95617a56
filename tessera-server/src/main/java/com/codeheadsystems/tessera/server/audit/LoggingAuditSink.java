package com.codeheadsystems.tessera.server.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit entries to the {@code tessera.audit} logger so they can be routed to their own
 * appender.
 */
public class LoggingAuditSink implements AuditSink {

  private static final Logger audit = LoggerFactory.getLogger("tessera.audit");

  @Override
  public void record(AuditLogEntry entry) {
    if (entry.eventType() == AuditEventType.CLONING_DETECTED) {
      audit.error("event={} subject={} at={} details={}",
          entry.eventType(), entry.subjectHash(), entry.timestamp(), entry.details());
    } else {
      audit.info("event={} subject={} at={} details={}",
          entry.eventType(), entry.subjectHash(), entry.timestamp(), entry.details());
    }
  }
}
