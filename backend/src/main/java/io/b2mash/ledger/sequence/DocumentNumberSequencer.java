package io.b2mash.ledger.sequence;

import io.b2mash.ledger.config.LedgerProperties;
import io.b2mash.ledger.exception.SequencerExhaustedException;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Issues per-organization sequential document numbers.
 *
 * <p>Each attempt reads the most recently reserved number, increments its suffix and tries to
 * insert the candidate in its own transaction. A unique-constraint violation means another caller
 * won the race; the attempt is retried after a short random backoff. Once the retry budget is
 * spent, a timestamp-derived number is reserved instead and a warning is logged. Reservations are
 * committed independently of the calling transaction, so a rolled-back document leaves a gap
 * rather than a reusable number.
 */
@Service
public class DocumentNumberSequencer {

  private static final Logger log = LoggerFactory.getLogger(DocumentNumberSequencer.class);

  private final DocumentNumberRepository documentNumberRepository;
  private final TransactionTemplate reservationTx;
  private final int maxAttempts;
  private final long maxBackoffMillis;

  public DocumentNumberSequencer(
      DocumentNumberRepository documentNumberRepository,
      PlatformTransactionManager transactionManager,
      LedgerProperties ledgerProperties) {
    this.documentNumberRepository = documentNumberRepository;
    this.reservationTx = new TransactionTemplate(transactionManager);
    this.reservationTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.maxAttempts = Math.max(1, ledgerProperties.sequencer().maxAttempts());
    this.maxBackoffMillis = Math.max(0, ledgerProperties.sequencer().maxBackoffMillis());
  }

  public String next(UUID organizationId, DocumentNumberFormat format) {
    int attempt = 0;
    while (true) {
      attempt++;
      var outcome = attempt(organizationId, format, attempt);
      if (outcome instanceof SequenceAttempt.Issued issued) {
        return issued.number();
      }
      if (outcome instanceof SequenceAttempt.Exhausted exhausted) {
        return reserveFallback(organizationId, format, exhausted.attempts());
      }
      var retry = (SequenceAttempt.Retry) outcome;
      log.debug(
          "{} number {} already taken for org {} (attempt {}/{})",
          format.documentType(),
          retry.candidate(),
          organizationId,
          attempt,
          maxAttempts);
      backoff();
    }
  }

  private SequenceAttempt attempt(UUID organizationId, DocumentNumberFormat format, int attempt) {
    if (attempt > maxAttempts) {
      return new SequenceAttempt.Exhausted(maxAttempts);
    }
    var candidate = format.format(lastIssued(organizationId, format) + 1);
    if (tryReserve(organizationId, format.documentType(), candidate, false)) {
      return new SequenceAttempt.Issued(candidate);
    }
    return new SequenceAttempt.Retry(candidate);
  }

  private long lastIssued(UUID organizationId, DocumentNumberFormat format) {
    return documentNumberRepository
        .findFirstByOrganizationIdAndDocumentTypeAndFallbackFalseOrderByCreatedAtDesc(
            organizationId, format.documentType())
        .map(latest -> format.parse(latest.getNumber()).orElse(0L))
        .orElse(0L);
  }

  private String reserveFallback(UUID organizationId, DocumentNumberFormat format, int attempts) {
    var fallback = format.fallback(Instant.now().toEpochMilli());
    log.warn(
        "Sequential {} numbering exhausted {} attempts for org {}, falling back to {}",
        format.documentType(),
        attempts,
        organizationId,
        fallback);
    if (!tryReserve(organizationId, format.documentType(), fallback, true)) {
      throw new SequencerExhaustedException(format.documentType(), attempts);
    }
    return fallback;
  }

  private boolean tryReserve(
      UUID organizationId, String documentType, String number, boolean fallback) {
    try {
      reservationTx.executeWithoutResult(
          status ->
              documentNumberRepository.saveAndFlush(
                  new DocumentNumber(organizationId, documentType, number, fallback)));
      return true;
    } catch (DataIntegrityViolationException e) {
      return false;
    }
  }

  private void backoff() {
    if (maxBackoffMillis == 0) {
      return;
    }
    try {
      Thread.sleep(ThreadLocalRandom.current().nextLong(1, maxBackoffMillis + 1));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
