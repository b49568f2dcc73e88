package io.worktrack.backend.audit;

/**
 * Sink for audit events. The core writes an event on every lifecycle transition, entity mutation
 * and pay-period close; it never reads audit history back.
 */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);
}
