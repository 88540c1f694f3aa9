package io.b2mash.ledger.invoice;

import io.b2mash.ledger.audit.AuditEventBuilder;
import io.b2mash.ledger.audit.AuditService;
import io.b2mash.ledger.config.LedgerProperties;
import io.b2mash.ledger.customer.CustomerRepository;
import io.b2mash.ledger.exception.InvalidInputException;
import io.b2mash.ledger.exception.InvalidStateException;
import io.b2mash.ledger.exception.ResourceNotFoundException;
import io.b2mash.ledger.invoice.dto.CreateInvoiceRequest;
import io.b2mash.ledger.invoice.dto.InvoiceResponse;
import io.b2mash.ledger.invoice.dto.InvoiceStatsResponse;
import io.b2mash.ledger.invoice.dto.LineItemRequest;
import io.b2mash.ledger.invoice.dto.LineItemResponse;
import io.b2mash.ledger.invoice.dto.UpdateInvoiceRequest;
import io.b2mash.ledger.money.LineItemCalculator;
import io.b2mash.ledger.money.Money;
import io.b2mash.ledger.multitenancy.LedgerContext;
import io.b2mash.ledger.quote.Quote;
import io.b2mash.ledger.quote.QuoteItemRepository;
import io.b2mash.ledger.quote.QuoteRepository;
import io.b2mash.ledger.sequence.DocumentNumberFormat;
import io.b2mash.ledger.sequence.DocumentNumberSequencer;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the invoice lifecycle and is the only writer of {@code amountPaid}/{@code balance}.
 *
 * <p>Every mutation of an existing invoice re-reads the row with {@code SELECT ... FOR UPDATE}
 * before checking its state, so concurrent payments, refunds and cancellations serialize on the
 * invoice row.
 */
@Service
public class InvoiceLedgerService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceLedgerService.class);

  static final String DOCUMENT_TYPE = "INVOICE";

  private final InvoiceRepository invoiceRepository;
  private final InvoiceLineItemRepository lineItemRepository;
  private final CustomerRepository customerRepository;
  private final QuoteRepository quoteRepository;
  private final QuoteItemRepository quoteItemRepository;
  private final DocumentNumberSequencer sequencer;
  private final AuditService auditService;
  private final EntityManager entityManager;
  private final LedgerProperties ledgerProperties;
  private final TransactionTemplate transactionTemplate;
  private final DocumentNumberFormat invoiceNumberFormat;

  public InvoiceLedgerService(
      InvoiceRepository invoiceRepository,
      InvoiceLineItemRepository lineItemRepository,
      CustomerRepository customerRepository,
      QuoteRepository quoteRepository,
      QuoteItemRepository quoteItemRepository,
      DocumentNumberSequencer sequencer,
      AuditService auditService,
      EntityManager entityManager,
      TransactionTemplate transactionTemplate,
      LedgerProperties ledgerProperties) {
    this.invoiceRepository = invoiceRepository;
    this.lineItemRepository = lineItemRepository;
    this.customerRepository = customerRepository;
    this.quoteRepository = quoteRepository;
    this.quoteItemRepository = quoteItemRepository;
    this.sequencer = sequencer;
    this.auditService = auditService;
    this.entityManager = entityManager;
    this.ledgerProperties = ledgerProperties;
    this.transactionTemplate = transactionTemplate;
    this.invoiceNumberFormat =
        new DocumentNumberFormat(
            DOCUMENT_TYPE,
            ledgerProperties.invoiceNumber().prefix(),
            ledgerProperties.invoiceNumber().width());
  }

  /**
   * Creates a DRAFT invoice from explicit lines or an accepted quote.
   *
   * <p>Runs in three steps so that no step holds a pooled connection while asking for another: the
   * request is validated, the invoice number is reserved in the sequencer's own transaction, then
   * the invoice and its lines are inserted in a fresh transaction. A number reserved for an insert
   * that fails afterwards stays unused.
   */
  public InvoiceResponse create(LedgerContext context, CreateInvoiceRequest request) {
    var draft = prepareDraft(context, request);
    var invoiceNumber = sequencer.next(context.organizationId(), invoiceNumberFormat);
    return transactionTemplate.execute(
        status -> insertDraft(context, request, draft, invoiceNumber));
  }

  private DraftInvoice prepareDraft(LedgerContext context, CreateInvoiceRequest request) {
    customerRepository
        .findByIdAndOrganizationIdAndDeletedAtIsNull(request.customerId(), context.organizationId())
        .orElseThrow(() -> new ResourceNotFoundException("Customer", request.customerId()));

    var inputs = toInputs(request.lineItems());
    String currency = request.currency();
    if (request.quoteId() != null) {
      var quote = requireConvertibleQuote(context, request.quoteId(), request.customerId());
      if (inputs.isEmpty()) {
        inputs = copyQuoteLines(quote);
      }
      if (currency == null) {
        currency = quote.getCurrency();
      }
    }
    if (inputs.isEmpty()) {
      throw new InvalidInputException("Missing line items", "At least one line item is required");
    }
    currency = (currency != null ? currency : ledgerProperties.defaultCurrency()).toUpperCase();
    // Fail on bad amounts before a number is reserved.
    validateDeposit(request.depositRequired(), previewTotal(inputs, currency), currency);
    return new DraftInvoice(inputs, currency);
  }

  private InvoiceResponse insertDraft(
      LedgerContext context,
      CreateInvoiceRequest request,
      DraftInvoice draft,
      String invoiceNumber) {
    // the quote may have been converted by a concurrent request since validation
    var quoteId = request.quoteId();
    if (quoteId != null && invoiceRepository.existsLiveInvoiceForQuote(quoteId)) {
      throw new InvalidStateException(
          "Quote already invoiced", "Quote " + quoteId + " already has an invoice");
    }
    var invoice =
        new Invoice(
            context.organizationId(),
            invoiceNumber,
            request.customerId(),
            request.quoteId(),
            draft.currency(),
            request.exchangeRate() != null ? request.exchangeRate() : BigDecimal.ONE,
            request.issueDate(),
            request.dueDate());
    invoice.setTerms(request.terms());
    invoice.setNotes(request.notes());
    invoice = invoiceRepository.save(invoice);

    var lines = insertRevision(invoice, draft.inputs());
    invoice.applyTotals(lines, request.depositRequired());
    invoice = invoiceRepository.save(invoice);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invoice.created")
            .entityType("invoice")
            .entityId(invoice.getId())
            .context(context)
            .after(invoice.toAuditSnapshot())
            .detail("line_count", lines.size())
            .build());

    log.info(
        "Created invoice {} ({}) for customer {} total={} {}",
        invoice.getInvoiceNumber(),
        invoice.getId(),
        invoice.getCustomerId(),
        invoice.getTotal().toPlainString(),
        invoice.getCurrency());
    return InvoiceResponse.from(invoice, lines);
  }

  @Transactional
  public InvoiceResponse update(
      LedgerContext context, UUID invoiceId, UpdateInvoiceRequest request) {
    var invoice = lockInvoice(context, invoiceId);
    if (!invoice.getStatus().isEditable()) {
      throw new InvalidStateException(
          "Invoice not editable",
          "Invoice can only be edited in DRAFT status, not " + invoice.getStatus());
    }
    var before = invoice.toAuditSnapshot();

    invoice.reschedule(
        request.issueDate() != null ? request.issueDate() : invoice.getIssueDate(),
        request.dueDate() != null ? request.dueDate() : invoice.getDueDate());
    if (request.terms() != null) {
      invoice.setTerms(request.terms());
    }
    if (request.notes() != null) {
      invoice.setNotes(request.notes());
    }

    List<InvoiceLineItem> lines;
    if (request.lineItems() != null) {
      var inputs = toInputs(request.lineItems());
      if (inputs.isEmpty()) {
        throw new InvalidInputException(
            "Missing line items", "At least one line item is required");
      }
      lines = reviseLines(invoice, inputs);
    } else {
      lines = lineItemRepository.findByInvoiceIdAndLatestVersionTrueOrderBySortOrder(invoiceId);
    }
    invoice.applyTotals(
        lines,
        request.depositRequired() != null
            ? request.depositRequired()
            : invoice.getDepositRequired());
    invoice = invoiceRepository.save(invoice);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invoice.updated")
            .entityType("invoice")
            .entityId(invoice.getId())
            .context(context)
            .before(before)
            .after(invoice.toAuditSnapshot())
            .detail("lines_revised", request.lineItems() != null)
            .build());
    return InvoiceResponse.from(invoice, lines);
  }

  @Transactional
  public InvoiceResponse send(LedgerContext context, UUID invoiceId) {
    var invoice = lockInvoice(context, invoiceId);
    var before = invoice.toAuditSnapshot();
    invoice.markSent();
    invoice = invoiceRepository.save(invoice);
    audit("invoice.sent", context, invoice, before);
    log.info("Sent invoice {}", invoice.getInvoiceNumber());
    return toResponse(invoice);
  }

  @Transactional
  public InvoiceResponse markViewed(LedgerContext context, UUID invoiceId) {
    var invoice = lockInvoice(context, invoiceId);
    var before = invoice.toAuditSnapshot();
    if (invoice.markViewed()) {
      invoice = invoiceRepository.save(invoice);
      audit("invoice.viewed", context, invoice, before);
    }
    return toResponse(invoice);
  }

  @Transactional
  public InvoiceResponse cancel(LedgerContext context, UUID invoiceId, String reason) {
    var invoice = lockInvoice(context, invoiceId);
    var before = invoice.toAuditSnapshot();
    if (invoice.cancel(reason)) {
      invoice = invoiceRepository.save(invoice);
      audit("invoice.cancelled", context, invoice, before);
      log.info("Cancelled invoice {}", invoice.getInvoiceNumber());
    }
    return toResponse(invoice);
  }

  @Transactional
  public void delete(LedgerContext context, UUID invoiceId) {
    var invoice = lockInvoice(context, invoiceId);
    var before = invoice.toAuditSnapshot();
    invoice.softDelete();
    invoiceRepository.save(invoice);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invoice.deleted")
            .entityType("invoice")
            .entityId(invoice.getId())
            .context(context)
            .before(before)
            .build());
    log.info("Soft-deleted invoice {}", invoice.getInvoiceNumber());
  }

  /**
   * Adds {@code amount} to the invoice's amount paid. The overpayment check and the write happen
   * under the invoice row lock within the caller's transaction.
   */
  @Transactional
  public Invoice applyPayment(LedgerContext context, UUID invoiceId, BigDecimal amount) {
    var invoice = lockInvoice(context, invoiceId);
    var before = invoice.toAuditSnapshot();
    invoice.applyPayment(amount);
    invoice = invoiceRepository.save(invoice);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invoice.payment_applied")
            .entityType("invoice")
            .entityId(invoice.getId())
            .context(context)
            .before(before)
            .after(invoice.toAuditSnapshot())
            .detail("amount", Money.scale(amount).toPlainString())
            .build());
    log.info(
        "Applied payment of {} to invoice {}: amountPaid={}, balance={}, status={}",
        Money.scale(amount).toPlainString(),
        invoice.getInvoiceNumber(),
        invoice.getAmountPaid().toPlainString(),
        invoice.getBalance().toPlainString(),
        invoice.getStatus());
    return invoice;
  }

  /** Inverse of {@link #applyPayment}: returns refunded money to the invoice balance. */
  @Transactional
  public Invoice applyRefund(LedgerContext context, UUID invoiceId, BigDecimal amount) {
    var invoice = lockInvoice(context, invoiceId);
    var before = invoice.toAuditSnapshot();
    invoice.applyRefund(amount);
    invoice = invoiceRepository.save(invoice);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invoice.refund_applied")
            .entityType("invoice")
            .entityId(invoice.getId())
            .context(context)
            .before(before)
            .after(invoice.toAuditSnapshot())
            .detail("amount", Money.scale(amount).toPlainString())
            .build());
    log.info(
        "Applied refund of {} to invoice {}: amountPaid={}, balance={}, status={}",
        Money.scale(amount).toPlainString(),
        invoice.getInvoiceNumber(),
        invoice.getAmountPaid().toPlainString(),
        invoice.getBalance().toPlainString(),
        invoice.getStatus());
    return invoice;
  }

  @Transactional(readOnly = true)
  public InvoiceResponse get(LedgerContext context, UUID invoiceId) {
    return toResponse(requireInvoice(context, invoiceId));
  }

  @Transactional(readOnly = true)
  public List<InvoiceResponse> list(LedgerContext context, UUID customerId, InvoiceStatus status) {
    var organizationId = context.organizationId();
    List<Invoice> invoices;
    if (customerId != null && status != null) {
      invoices =
          invoiceRepository
              .findByOrganizationIdAndCustomerIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(
                  organizationId, customerId, status);
    } else if (customerId != null) {
      invoices =
          invoiceRepository.findByOrganizationIdAndCustomerIdAndDeletedAtIsNullOrderByCreatedAtDesc(
              organizationId, customerId);
    } else if (status != null) {
      invoices =
          invoiceRepository.findByOrganizationIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(
              organizationId, status);
    } else {
      invoices =
          invoiceRepository.findByOrganizationIdAndDeletedAtIsNullOrderByCreatedAtDesc(
              organizationId);
    }
    return invoices.stream().map(this::toResponse).toList();
  }

  /**
   * Organization-wide invoice figures. An invoice is overdue when it has been issued, still has a
   * balance and its due date is before {@code asOf}. Amounts are summed as stored, across
   * currencies.
   */
  @Transactional(readOnly = true)
  public InvoiceStatsResponse stats(LedgerContext context, LocalDate asOf) {
    var byStatus = new EnumMap<InvoiceStatus, Long>(InvoiceStatus.class);
    long invoiceCount = 0;
    var totalValue = Money.ZERO;
    var paidValue = Money.ZERO;
    var outstanding = Money.ZERO;
    for (var totals : invoiceRepository.summarizeByStatus(context.organizationId())) {
      invoiceCount += totals.getInvoiceCount();
      byStatus.put(totals.getStatus(), totals.getInvoiceCount());
      if (totals.getStatus() == InvoiceStatus.CANCELLED) {
        continue;
      }
      totalValue = totalValue.add(totals.getTotal());
      paidValue = paidValue.add(totals.getAmountPaid());
      outstanding = outstanding.add(totals.getBalance());
    }
    var overdue =
        invoiceRepository.summarizeOverdue(
            context.organizationId(), asOf, List.of(InvoiceStatus.DRAFT, InvoiceStatus.CANCELLED));
    return new InvoiceStatsResponse(
        invoiceCount,
        byStatus,
        Money.scale(totalValue),
        Money.scale(paidValue),
        Money.scale(outstanding),
        overdue.getInvoiceCount(),
        Money.scale(overdue.getBalance()));
  }

  /** Every stored version of every line, oldest first within each position. */
  @Transactional(readOnly = true)
  public List<LineItemResponse> lineItemHistory(LedgerContext context, UUID invoiceId) {
    requireInvoice(context, invoiceId);
    return lineItemRepository.findByInvoiceIdOrderBySortOrderAscVersionAsc(invoiceId).stream()
        .map(LineItemResponse::from)
        .toList();
  }

  /** Tenant-scoped lookup of a live invoice; other organizations' rows read as missing. */
  @Transactional(readOnly = true)
  public Invoice requireInvoice(LedgerContext context, UUID invoiceId) {
    return invoiceRepository
        .findByIdAndOrganizationIdAndDeletedAtIsNull(invoiceId, context.organizationId())
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }

  private Invoice lockInvoice(LedgerContext context, UUID invoiceId) {
    var invoice = requireInvoice(context, invoiceId);
    // refresh rather than a locking query: the entity may already sit stale in this context
    entityManager.refresh(invoice, LockModeType.PESSIMISTIC_WRITE);
    if (invoice.getDeletedAt() != null) {
      throw new ResourceNotFoundException("Invoice", invoiceId);
    }
    return invoice;
  }

  private Quote requireConvertibleQuote(LedgerContext context, UUID quoteId, UUID customerId) {
    var quote =
        quoteRepository
            .findByIdAndOrganizationIdAndDeletedAtIsNull(quoteId, context.organizationId())
            .orElseThrow(() -> new ResourceNotFoundException("Quote", quoteId));
    if (!quote.getCustomerId().equals(customerId)) {
      throw new InvalidInputException(
          "Quote customer mismatch", "Quote " + quoteId + " belongs to a different customer");
    }
    if (!quote.isAccepted()) {
      throw new InvalidStateException(
          "Quote not accepted",
          "Only accepted quotes can be invoiced. Quote status is " + quote.getStatus());
    }
    if (invoiceRepository.existsLiveInvoiceForQuote(quoteId)) {
      throw new InvalidStateException(
          "Quote already invoiced", "Quote " + quote.getQuoteNumber() + " already has an invoice");
    }
    return quote;
  }

  private List<LineItemInput> copyQuoteLines(Quote quote) {
    return quoteItemRepository.findByQuoteIdOrderBySortOrder(quote.getId()).stream()
        .map(
            item ->
                new LineItemInput(
                    item.getDescription(),
                    item.getQuantity(),
                    item.getUnitPrice(),
                    item.getDiscountPercent(),
                    item.getTaxRate(),
                    item.getProductId(),
                    item.getServiceId()))
        .toList();
  }

  private List<InvoiceLineItem> insertRevision(Invoice invoice, List<LineItemInput> inputs) {
    int revision = invoice.nextLineRevision();
    var lines = new ArrayList<InvoiceLineItem>(inputs.size());
    for (int i = 0; i < inputs.size(); i++) {
      lines.add(
          new InvoiceLineItem(invoice.getId(), invoice.getCurrency(), inputs.get(i), i, revision));
    }
    return lineItemRepository.saveAll(lines);
  }

  /**
   * Supersedes every current line and inserts the replacements as a new revision. Old line
   * {@code i} links forward to new line {@code i}; surplus old lines link to nothing.
   */
  private List<InvoiceLineItem> reviseLines(Invoice invoice, List<LineItemInput> inputs) {
    var previous =
        lineItemRepository.findByInvoiceIdAndLatestVersionTrueOrderBySortOrder(invoice.getId());
    var replacements = insertRevision(invoice, inputs);
    var now = Instant.now();
    for (int i = 0; i < previous.size(); i++) {
      var replacementId = i < replacements.size() ? replacements.get(i).getId() : null;
      previous.get(i).supersede(replacementId, now);
    }
    lineItemRepository.saveAll(previous);
    log.debug(
        "Revised invoice {} lines to revision {}: {} superseded, {} inserted",
        invoice.getInvoiceNumber(),
        invoice.getLineRevision(),
        previous.size(),
        replacements.size());
    return replacements;
  }

  private static List<LineItemInput> toInputs(List<LineItemRequest> requests) {
    if (requests == null) {
      return List.of();
    }
    return requests.stream().map(LineItemRequest::toInput).toList();
  }

  private static BigDecimal previewTotal(List<LineItemInput> inputs, String currency) {
    var total = Money.ZERO;
    for (var input : inputs) {
      total =
          total.add(
              LineItemCalculator.calculate(
                      input.quantity(),
                      input.unitPrice(),
                      input.discountPercent(),
                      input.taxRate(),
                      currency)
                  .total());
    }
    return total;
  }

  private static void validateDeposit(
      BigDecimal depositRequired, BigDecimal total, String currency) {
    var deposit = Money.scale(depositRequired, currency);
    if (deposit.signum() < 0 || deposit.compareTo(total) > 0) {
      throw new InvalidInputException(
          "Invalid deposit",
          "Deposit required must be between 0 and the invoice total of " + total.toPlainString());
    }
  }

  private InvoiceResponse toResponse(Invoice invoice) {
    return InvoiceResponse.from(
        invoice,
        lineItemRepository.findByInvoiceIdAndLatestVersionTrueOrderBySortOrder(invoice.getId()));
  }

  private void audit(
      String eventType, LedgerContext context, Invoice invoice, Map<String, Object> before) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("invoice")
            .entityId(invoice.getId())
            .context(context)
            .before(before)
            .after(invoice.toAuditSnapshot())
            .build());
  }

  private record DraftInvoice(List<LineItemInput> inputs, String currency) {}
}
