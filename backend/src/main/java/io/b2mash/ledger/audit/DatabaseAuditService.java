package io.b2mash.ledger.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Transaction semantics: {@code log()} only publishes the record. It is written AFTER_COMMIT
 * on the async executor in a transaction of its own, ensuring:
 *
 * <ol>
 *   <li>Audit rows exist only for committed ledger changes.
 *   <li>Audit failures are logged and never affect the ledger transaction.
 *   <li>The writer never asks for a connection while the caller still holds one.
 * </ol>
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate auditTx;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository,
      ApplicationEventPublisher eventPublisher,
      PlatformTransactionManager transactionManager) {
    this.auditEventRepository = auditEventRepository;
    this.eventPublisher = eventPublisher;
    this.auditTx = new TransactionTemplate(transactionManager);
  }

  @Override
  public void log(AuditEventRecord record) {
    eventPublisher.publishEvent(record);
  }

  @Async
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void persist(AuditEventRecord record) {
    try {
      auditTx.executeWithoutResult(status -> auditEventRepository.save(new AuditEvent(record)));
      log.debug(
          "Recorded audit event: type={}, entity={}/{}, actor={}",
          record.eventType(),
          record.entityType(),
          record.entityId(),
          record.actorId());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record audit event type={} entity={}/{}: {}",
          record.eventType(),
          record.entityType(),
          record.entityId(),
          e.getMessage(),
          e);
    }
  }
}
