package io.b2mash.ledger.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.ledger.audit.AuditEventRecord;
import io.b2mash.ledger.audit.AuditService;
import io.b2mash.ledger.config.LedgerProperties;
import io.b2mash.ledger.customer.Customer;
import io.b2mash.ledger.customer.CustomerRepository;
import io.b2mash.ledger.exception.InvalidInputException;
import io.b2mash.ledger.exception.InvalidStateException;
import io.b2mash.ledger.exception.OverpaymentRejectedException;
import io.b2mash.ledger.exception.ResourceNotFoundException;
import io.b2mash.ledger.invoice.dto.CreateInvoiceRequest;
import io.b2mash.ledger.invoice.dto.LineItemRequest;
import io.b2mash.ledger.invoice.dto.UpdateInvoiceRequest;
import io.b2mash.ledger.multitenancy.LedgerContext;
import io.b2mash.ledger.quote.Quote;
import io.b2mash.ledger.quote.QuoteItem;
import io.b2mash.ledger.quote.QuoteItemRepository;
import io.b2mash.ledger.quote.QuoteRepository;
import io.b2mash.ledger.quote.QuoteStatus;
import io.b2mash.ledger.sequence.DocumentNumberFormat;
import io.b2mash.ledger.sequence.DocumentNumberSequencer;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class InvoiceLedgerServiceTest {

  private static final UUID ORG_ID = UUID.randomUUID();
  private static final UUID CUSTOMER_ID = UUID.randomUUID();
  private static final LocalDate ISSUE_DATE = LocalDate.of(2024, 3, 1);
  private static final LedgerContext CONTEXT =
      new LedgerContext(ORG_ID, UUID.randomUUID(), "10.0.0.1", "JUnit");

  @Mock private InvoiceRepository invoiceRepository;
  @Mock private InvoiceLineItemRepository lineItemRepository;
  @Mock private CustomerRepository customerRepository;
  @Mock private QuoteRepository quoteRepository;
  @Mock private QuoteItemRepository quoteItemRepository;
  @Mock private DocumentNumberSequencer sequencer;
  @Mock private AuditService auditService;
  @Mock private EntityManager entityManager;
  @Mock private PlatformTransactionManager transactionManager;

  private InvoiceLedgerService service;

  @BeforeEach
  void setUp() {
    var properties =
        new LedgerProperties(
            "CAD",
            new LedgerProperties.InvoiceNumber("INV-", 6),
            new LedgerProperties.Sequencer(5, 0),
            new LedgerProperties.ProcessorFee(new BigDecimal("2.9"), new BigDecimal("0.30")));
    service =
        new InvoiceLedgerService(
            invoiceRepository,
            lineItemRepository,
            customerRepository,
            quoteRepository,
            quoteItemRepository,
            sequencer,
            auditService,
            entityManager,
            new TransactionTemplate(transactionManager),
            properties);

    lenient()
        .when(invoiceRepository.save(any(Invoice.class)))
        .thenAnswer(invocation -> withId(invocation.getArgument(0)));
    lenient()
        .when(lineItemRepository.saveAll(ArgumentMatchers.<InvoiceLineItem>anyList()))
        .thenAnswer(
            invocation -> {
              List<InvoiceLineItem> lines = invocation.getArgument(0);
              lines.forEach(InvoiceLedgerServiceTest::withId);
              return lines;
            });
  }

  @Test
  void create_reservesNumberAndComputesTotals() {
    customerExists();
    when(sequencer.next(eq(ORG_ID), any(DocumentNumberFormat.class))).thenReturn("INV-000001");

    var response =
        service.create(
            CONTEXT,
            new CreateInvoiceRequest(
                CUSTOMER_ID,
                null,
                List.of(consultingLine()),
                new BigDecimal("50.00"),
                ISSUE_DATE,
                ISSUE_DATE.plusDays(30),
                "CAD",
                null,
                "Net 30",
                null));

    assertThat(response.invoiceNumber()).isEqualTo("INV-000001");
    assertThat(response.status()).isEqualTo(InvoiceStatus.DRAFT);
    assertThat(response.subtotal()).isEqualByComparingTo("225.00");
    assertThat(response.taxTotal()).isEqualByComparingTo("29.25");
    assertThat(response.total()).isEqualByComparingTo("254.25");
    assertThat(response.balance()).isEqualByComparingTo("254.25");
    assertThat(response.depositRequired()).isEqualByComparingTo("50.00");
    assertThat(response.lineItems()).hasSize(1);

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("invoice.created");
    assertThat(captor.getValue().actorType()).isEqualTo("USER");
    assertThat(captor.getValue().source()).isEqualTo("API");
  }

  @Test
  void create_reservesNumberBeforeOpeningInsertTransaction() {
    customerExists();
    when(sequencer.next(eq(ORG_ID), any(DocumentNumberFormat.class))).thenReturn("INV-000001");

    service.create(CONTEXT, request(List.of(consultingLine())));

    var order = inOrder(sequencer, transactionManager, invoiceRepository);
    order.verify(sequencer).next(eq(ORG_ID), any(DocumentNumberFormat.class));
    order.verify(transactionManager).getTransaction(any(TransactionDefinition.class));
    order.verify(invoiceRepository).save(any(Invoice.class));
  }

  @Test
  void create_zeroDecimalCurrencyKeepsWholeUnitAmounts() {
    customerExists();
    when(sequencer.next(eq(ORG_ID), any(DocumentNumberFormat.class))).thenReturn("INV-000003");
    var line =
        new LineItemRequest(
            "Rental", BigDecimal.ONE, new BigDecimal("100.50"), null, null, null, null);

    var response =
        service.create(
            CONTEXT,
            new CreateInvoiceRequest(
                CUSTOMER_ID,
                null,
                List.of(line),
                null,
                ISSUE_DATE,
                ISSUE_DATE.plusDays(30),
                "JPY",
                null,
                null,
                null));

    assertThat(response.currency()).isEqualTo("JPY");
    assertThat(response.total()).isEqualTo(new BigDecimal("101.00"));
    assertThat(response.lineItems())
        .singleElement()
        .satisfies(l -> assertThat(l.total()).isEqualTo(new BigDecimal("101.00")));
  }

  @Test
  void create_rejectsUnknownCustomer() {
    when(customerRepository.findByIdAndOrganizationIdAndDeletedAtIsNull(CUSTOMER_ID, ORG_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.create(CONTEXT, request(List.of(consultingLine()))))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(sequencer);
  }

  @Test
  void create_requiresAtLeastOneLineItem() {
    customerExists();

    assertThatThrownBy(() -> service.create(CONTEXT, request(List.of())))
        .isInstanceOf(InvalidInputException.class);
    verifyNoInteractions(sequencer);
  }

  @Test
  void create_rejectsDepositAboveTotalBeforeReservingNumber() {
    customerExists();
    var request =
        new CreateInvoiceRequest(
            CUSTOMER_ID,
            null,
            List.of(consultingLine()),
            new BigDecimal("300.00"),
            ISSUE_DATE,
            ISSUE_DATE.plusDays(30),
            "CAD",
            null,
            null,
            null);

    assertThatThrownBy(() -> service.create(CONTEXT, request))
        .isInstanceOf(InvalidInputException.class);
    verifyNoInteractions(sequencer);
  }

  @Test
  void create_fromAcceptedQuoteCopiesLinesAndCurrency() {
    customerExists();
    var quote = withId(new Quote(ORG_ID, CUSTOMER_ID, "QUO-0001", QuoteStatus.ACCEPTED, "USD"));
    when(quoteRepository.findByIdAndOrganizationIdAndDeletedAtIsNull(quote.getId(), ORG_ID))
        .thenReturn(Optional.of(quote));
    when(invoiceRepository.existsLiveInvoiceForQuote(quote.getId())).thenReturn(false);
    when(quoteItemRepository.findByQuoteIdOrderBySortOrder(quote.getId()))
        .thenReturn(
            List.of(
                new QuoteItem(
                    quote.getId(),
                    "Discovery workshop",
                    BigDecimal.ONE,
                    new BigDecimal("500.00"),
                    BigDecimal.ZERO,
                    new BigDecimal("13"),
                    0)));
    when(sequencer.next(eq(ORG_ID), any(DocumentNumberFormat.class))).thenReturn("INV-000002");

    var response =
        service.create(
            CONTEXT,
            new CreateInvoiceRequest(
                CUSTOMER_ID,
                quote.getId(),
                null,
                null,
                ISSUE_DATE,
                ISSUE_DATE.plusDays(14),
                null,
                null,
                null,
                null));

    assertThat(response.quoteId()).isEqualTo(quote.getId());
    assertThat(response.currency()).isEqualTo("USD");
    assertThat(response.lineItems())
        .singleElement()
        .satisfies(line -> assertThat(line.description()).isEqualTo("Discovery workshop"));
    assertThat(response.total()).isEqualByComparingTo("565.00");
  }

  @Test
  void create_rejectsQuoteThatIsNotAccepted() {
    customerExists();
    var quote = withId(new Quote(ORG_ID, CUSTOMER_ID, "QUO-0001", QuoteStatus.SENT, "CAD"));
    when(quoteRepository.findByIdAndOrganizationIdAndDeletedAtIsNull(quote.getId(), ORG_ID))
        .thenReturn(Optional.of(quote));

    assertThatThrownBy(() -> service.create(CONTEXT, quoteRequest(quote.getId())))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void create_rejectsQuoteAlreadyInvoiced() {
    customerExists();
    var quote = withId(new Quote(ORG_ID, CUSTOMER_ID, "QUO-0001", QuoteStatus.ACCEPTED, "CAD"));
    when(quoteRepository.findByIdAndOrganizationIdAndDeletedAtIsNull(quote.getId(), ORG_ID))
        .thenReturn(Optional.of(quote));
    when(invoiceRepository.existsLiveInvoiceForQuote(quote.getId())).thenReturn(true);

    assertThatThrownBy(() -> service.create(CONTEXT, quoteRequest(quote.getId())))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("already has an invoice");
  }

  @Test
  void create_rejectsQuoteConvertedWhileNumberWasReserved() {
    customerExists();
    var quote = withId(new Quote(ORG_ID, CUSTOMER_ID, "QUO-0001", QuoteStatus.ACCEPTED, "CAD"));
    when(quoteRepository.findByIdAndOrganizationIdAndDeletedAtIsNull(quote.getId(), ORG_ID))
        .thenReturn(Optional.of(quote));
    when(quoteItemRepository.findByQuoteIdOrderBySortOrder(quote.getId()))
        .thenReturn(
            List.of(
                new QuoteItem(
                    quote.getId(),
                    "Discovery workshop",
                    BigDecimal.ONE,
                    new BigDecimal("500.00"),
                    BigDecimal.ZERO,
                    BigDecimal.ZERO,
                    0)));
    when(invoiceRepository.existsLiveInvoiceForQuote(quote.getId())).thenReturn(false, true);
    when(sequencer.next(eq(ORG_ID), any(DocumentNumberFormat.class))).thenReturn("INV-000004");

    assertThatThrownBy(() -> service.create(CONTEXT, quoteRequest(quote.getId())))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("already has an invoice");
    verify(invoiceRepository, never()).save(any(Invoice.class));
    verify(transactionManager).rollback(any());
  }

  @Test
  void create_rejectsQuoteOfAnotherCustomer() {
    customerExists();
    var quote =
        withId(new Quote(ORG_ID, UUID.randomUUID(), "QUO-0001", QuoteStatus.ACCEPTED, "CAD"));
    when(quoteRepository.findByIdAndOrganizationIdAndDeletedAtIsNull(quote.getId(), ORG_ID))
        .thenReturn(Optional.of(quote));

    assertThatThrownBy(() -> service.create(CONTEXT, quoteRequest(quote.getId())))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void update_supersedesPreviousLinesAndLinksForward() {
    var invoice = draftInvoice();
    var oldLine =
        withId(
            new InvoiceLineItem(
                invoice.getId(),
                invoice.getCurrency(),
                LineItemInput.of("Hosting", BigDecimal.ONE, new BigDecimal("100.00"), null, null),
                0,
                invoice.nextLineRevision()));
    invoice.applyTotals(List.of(oldLine), null);
    invoiceExists(invoice);
    when(lineItemRepository.findByInvoiceIdAndLatestVersionTrueOrderBySortOrder(invoice.getId()))
        .thenReturn(List.of(oldLine));

    var response =
        service.update(
            CONTEXT,
            invoice.getId(),
            new UpdateInvoiceRequest(
                List.of(
                    new LineItemRequest(
                        "Hosting (annual)",
                        BigDecimal.ONE,
                        new BigDecimal("150.00"),
                        null,
                        null,
                        null,
                        null)),
                null,
                null,
                null,
                null,
                null));

    assertThat(response.total()).isEqualByComparingTo("150.00");
    assertThat(invoice.getLineRevision()).isEqualTo(2);
    assertThat(oldLine.isLatestVersion()).isFalse();
    assertThat(oldLine.getSupersededAt()).isNotNull();
    assertThat(oldLine.getSupersededById()).isEqualTo(response.lineItems().get(0).id());
  }

  @Test
  void update_rejectsInvoiceThatWasSent() {
    var invoice = draftInvoice();
    invoice.markSent();
    invoiceExists(invoice);

    assertThatThrownBy(
            () ->
                service.update(
                    CONTEXT,
                    invoice.getId(),
                    new UpdateInvoiceRequest(null, null, null, null, null, "late note")))
        .isInstanceOf(InvalidStateException.class);
    verify(invoiceRepository, never()).save(any(Invoice.class));
  }

  @Test
  void applyPayment_locksInvoiceBeforeWriting() {
    var invoice = invoiceWithTotal("100.00");
    invoiceExists(invoice);

    var updated = service.applyPayment(CONTEXT, invoice.getId(), new BigDecimal("40.00"));

    assertThat(updated.getBalance()).isEqualByComparingTo("60.00");
    assertThat(updated.getStatus()).isEqualTo(InvoiceStatus.PARTIALLY_PAID);
    var order = inOrder(entityManager, invoiceRepository);
    order.verify(entityManager).refresh(invoice, LockModeType.PESSIMISTIC_WRITE);
    order.verify(invoiceRepository).save(invoice);
  }

  @Test
  void applyPayment_overpaymentLeavesInvoiceUntouched() {
    var invoice = invoiceWithTotal("100.00");
    invoiceExists(invoice);

    assertThatThrownBy(
            () -> service.applyPayment(CONTEXT, invoice.getId(), new BigDecimal("100.01")))
        .isInstanceOf(OverpaymentRejectedException.class);
    assertThat(invoice.getAmountPaid()).isEqualByComparingTo("0.00");
    verify(invoiceRepository, never()).save(any(Invoice.class));
  }

  @Test
  void cancel_withPaymentsAppliedIsRejected() {
    var invoice = invoiceWithTotal("100.00");
    invoice.applyPayment(new BigDecimal("10.00"));
    invoiceExists(invoice);

    assertThatThrownBy(() -> service.cancel(CONTEXT, invoice.getId(), "duplicate"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void cancel_twiceWritesOnce() {
    var invoice = invoiceWithTotal("100.00");
    invoiceExists(invoice);

    service.cancel(CONTEXT, invoice.getId(), "duplicate");
    var response = service.cancel(CONTEXT, invoice.getId(), "duplicate");

    assertThat(response.status()).isEqualTo(InvoiceStatus.CANCELLED);
    verify(invoiceRepository).save(invoice);
  }

  @Test
  void get_invoiceOfAnotherOrganizationReadsAsMissing() {
    var invoiceId = UUID.randomUUID();
    when(invoiceRepository.findByIdAndOrganizationIdAndDeletedAtIsNull(invoiceId, ORG_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.get(CONTEXT, invoiceId))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  private void customerExists() {
    when(customerRepository.findByIdAndOrganizationIdAndDeletedAtIsNull(CUSTOMER_ID, ORG_ID))
        .thenReturn(Optional.of(new Customer(ORG_ID, "Acme Ltd", "billing@acme.test")));
  }

  private void invoiceExists(Invoice invoice) {
    when(invoiceRepository.findByIdAndOrganizationIdAndDeletedAtIsNull(invoice.getId(), ORG_ID))
        .thenReturn(Optional.of(invoice));
  }

  private static Invoice draftInvoice() {
    return withId(
        new Invoice(
            ORG_ID,
            "INV-000010",
            CUSTOMER_ID,
            null,
            "CAD",
            BigDecimal.ONE,
            ISSUE_DATE,
            ISSUE_DATE.plusDays(30)));
  }

  private static Invoice invoiceWithTotal(String total) {
    var invoice = draftInvoice();
    var line =
        new InvoiceLineItem(
            invoice.getId(),
            invoice.getCurrency(),
            LineItemInput.of("Retainer", BigDecimal.ONE, new BigDecimal(total), null, null),
            0,
            invoice.nextLineRevision());
    invoice.applyTotals(List.of(line), null);
    invoice.markSent();
    return invoice;
  }

  private static LineItemRequest consultingLine() {
    return new LineItemRequest(
        "Consulting",
        new BigDecimal("2"),
        new BigDecimal("125.00"),
        new BigDecimal("10"),
        new BigDecimal("13"),
        null,
        null);
  }

  private static CreateInvoiceRequest request(List<LineItemRequest> lines) {
    return new CreateInvoiceRequest(
        CUSTOMER_ID,
        null,
        lines,
        null,
        ISSUE_DATE,
        ISSUE_DATE.plusDays(30),
        "CAD",
        null,
        null,
        null);
  }

  private static CreateInvoiceRequest quoteRequest(UUID quoteId) {
    return new CreateInvoiceRequest(
        CUSTOMER_ID,
        quoteId,
        null,
        null,
        ISSUE_DATE,
        ISSUE_DATE.plusDays(30),
        null,
        null,
        null,
        null);
  }

  private static <T> T withId(T entity) {
    if (ReflectionTestUtils.getField(entity, "id") == null) {
      ReflectionTestUtils.setField(entity, "id", UUID.randomUUID());
    }
    return entity;
  }
}
