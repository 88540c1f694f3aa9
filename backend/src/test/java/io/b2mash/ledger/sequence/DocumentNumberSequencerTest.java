package io.b2mash.ledger.sequence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.ledger.config.LedgerProperties;
import io.b2mash.ledger.exception.SequencerExhaustedException;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class DocumentNumberSequencerTest {

  private static final UUID ORG_ID = UUID.randomUUID();
  private static final DocumentNumberFormat FORMAT =
      new DocumentNumberFormat("INVOICE", "INV-", 6);

  @Mock private DocumentNumberRepository documentNumberRepository;
  @Mock private PlatformTransactionManager transactionManager;

  private DocumentNumberSequencer sequencer;

  @BeforeEach
  void setUp() {
    var properties =
        new LedgerProperties(
            "CAD",
            new LedgerProperties.InvoiceNumber("INV-", 6),
            new LedgerProperties.Sequencer(3, 0),
            new LedgerProperties.ProcessorFee(new BigDecimal("2.9"), new BigDecimal("0.30")));
    sequencer =
        new DocumentNumberSequencer(documentNumberRepository, transactionManager, properties);
  }

  @Test
  void firstNumberForOrganizationStartsAtOne() {
    when(documentNumberRepository
            .findFirstByOrganizationIdAndDocumentTypeAndFallbackFalseOrderByCreatedAtDesc(
                ORG_ID, "INVOICE"))
        .thenReturn(Optional.empty());

    assertThat(sequencer.next(ORG_ID, FORMAT)).isEqualTo("INV-000001");
  }

  @Test
  void incrementsLatestIssuedNumber() {
    when(documentNumberRepository
            .findFirstByOrganizationIdAndDocumentTypeAndFallbackFalseOrderByCreatedAtDesc(
                ORG_ID, "INVOICE"))
        .thenReturn(Optional.of(new DocumentNumber(ORG_ID, "INVOICE", "INV-000041", false)));

    assertThat(sequencer.next(ORG_ID, FORMAT)).isEqualTo("INV-000042");
  }

  @Test
  void retriesWhenCandidateIsTaken() {
    when(documentNumberRepository
            .findFirstByOrganizationIdAndDocumentTypeAndFallbackFalseOrderByCreatedAtDesc(
                ORG_ID, "INVOICE"))
        .thenReturn(Optional.of(new DocumentNumber(ORG_ID, "INVOICE", "INV-000007", false)))
        .thenReturn(Optional.of(new DocumentNumber(ORG_ID, "INVOICE", "INV-000008", false)));
    when(documentNumberRepository.saveAndFlush(any(DocumentNumber.class)))
        .thenThrow(new DataIntegrityViolationException("duplicate key"))
        .thenAnswer(invocation -> invocation.getArgument(0));

    assertThat(sequencer.next(ORG_ID, FORMAT)).isEqualTo("INV-000009");
    verify(transactionManager, times(1)).rollback(any());
  }

  @Test
  void fallsBackToTimestampNumberWhenAttemptsAreExhausted() {
    when(documentNumberRepository
            .findFirstByOrganizationIdAndDocumentTypeAndFallbackFalseOrderByCreatedAtDesc(
                ORG_ID, "INVOICE"))
        .thenReturn(Optional.of(new DocumentNumber(ORG_ID, "INVOICE", "INV-000007", false)));
    when(documentNumberRepository.saveAndFlush(any(DocumentNumber.class)))
        .thenAnswer(
            invocation -> {
              DocumentNumber number = invocation.getArgument(0);
              if (!number.isFallback()) {
                throw new DataIntegrityViolationException("duplicate key");
              }
              return number;
            });

    var number = sequencer.next(ORG_ID, FORMAT);

    assertThat(number).startsWith("INV-T");
    verify(documentNumberRepository, times(4)).saveAndFlush(any(DocumentNumber.class));
  }

  @Test
  void throwsWhenFallbackCannotBeReserved() {
    when(documentNumberRepository
            .findFirstByOrganizationIdAndDocumentTypeAndFallbackFalseOrderByCreatedAtDesc(
                ORG_ID, "INVOICE"))
        .thenReturn(Optional.empty());
    when(documentNumberRepository.saveAndFlush(any(DocumentNumber.class)))
        .thenThrow(new DataIntegrityViolationException("duplicate key"));

    assertThatThrownBy(() -> sequencer.next(ORG_ID, FORMAT))
        .isInstanceOf(SequencerExhaustedException.class);
  }
}
