package io.b2mash.ledger.audit;

/** Sink for audit events emitted by ledger operations. */
public interface AuditService {

  /**
   * Records a single audit event. Implementations must never let a failure escape: money movement
   * is not blocked on the audit trail.
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);
}
