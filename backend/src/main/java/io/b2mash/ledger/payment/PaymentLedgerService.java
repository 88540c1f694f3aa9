package io.b2mash.ledger.payment;

import io.b2mash.ledger.audit.AuditEventBuilder;
import io.b2mash.ledger.audit.AuditService;
import io.b2mash.ledger.config.LedgerProperties;
import io.b2mash.ledger.customer.CustomerRepository;
import io.b2mash.ledger.exception.ExceedsBalanceException;
import io.b2mash.ledger.exception.InvalidInputException;
import io.b2mash.ledger.exception.InvalidStateException;
import io.b2mash.ledger.exception.OverpaymentRejectedException;
import io.b2mash.ledger.exception.ResourceNotFoundException;
import io.b2mash.ledger.integration.payment.ChargeRequest;
import io.b2mash.ledger.integration.payment.GatewayRefundRequest;
import io.b2mash.ledger.integration.payment.PaymentGateway;
import io.b2mash.ledger.invoice.Invoice;
import io.b2mash.ledger.invoice.InvoiceLedgerService;
import io.b2mash.ledger.invoice.InvoiceStatus;
import io.b2mash.ledger.money.Money;
import io.b2mash.ledger.multitenancy.LedgerContext;
import io.b2mash.ledger.payment.dto.AllocatePaymentRequest;
import io.b2mash.ledger.payment.dto.BatchPaymentRequest;
import io.b2mash.ledger.payment.dto.BatchPaymentResponse;
import io.b2mash.ledger.payment.dto.CreateGatewayPaymentRequest;
import io.b2mash.ledger.payment.dto.CreateManualPaymentRequest;
import io.b2mash.ledger.payment.dto.GatewayPaymentResponse;
import io.b2mash.ledger.payment.dto.PaymentAllocationResponse;
import io.b2mash.ledger.payment.dto.PaymentResponse;
import io.b2mash.ledger.payment.dto.PaymentStatsResponse;
import io.b2mash.ledger.payment.dto.RefundResponse;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.ErrorResponseException;

/**
 * Owns the payment lifecycle and drives balance changes through {@link InvoiceLedgerService}.
 *
 * <p>Gateway calls never run inside a database transaction: charges are created before the
 * PENDING row is written, confirmations arrive later by webhook, and refunds are reserved, sent to
 * the gateway, then completed in separate transactions.
 */
@Service
public class PaymentLedgerService {

  private static final Logger log = LoggerFactory.getLogger(PaymentLedgerService.class);

  private static final Duration RECENT_WINDOW = Duration.ofDays(30);

  private final PaymentRepository paymentRepository;
  private final RefundRepository refundRepository;
  private final PaymentAllocationRepository allocationRepository;
  private final CustomerRepository customerRepository;
  private final InvoiceLedgerService invoiceLedgerService;
  private final PaymentGateway paymentGateway;
  private final ProcessorFeeSchedule feeSchedule;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;
  private final LedgerProperties ledgerProperties;

  public PaymentLedgerService(
      PaymentRepository paymentRepository,
      RefundRepository refundRepository,
      PaymentAllocationRepository allocationRepository,
      CustomerRepository customerRepository,
      InvoiceLedgerService invoiceLedgerService,
      PaymentGateway paymentGateway,
      ProcessorFeeSchedule feeSchedule,
      AuditService auditService,
      TransactionTemplate transactionTemplate,
      LedgerProperties ledgerProperties) {
    this.paymentRepository = paymentRepository;
    this.refundRepository = refundRepository;
    this.allocationRepository = allocationRepository;
    this.customerRepository = customerRepository;
    this.invoiceLedgerService = invoiceLedgerService;
    this.paymentGateway = paymentGateway;
    this.feeSchedule = feeSchedule;
    this.auditService = auditService;
    this.transactionTemplate = transactionTemplate;
    this.ledgerProperties = ledgerProperties;
  }

  /**
   * Records a payment settled outside the gateway and applies it to the invoice in the same
   * transaction. The balance check here is advisory; the authoritative one runs under the invoice
   * row lock in {@link InvoiceLedgerService#applyPayment}.
   */
  @Transactional
  public PaymentResponse createManualPayment(
      LedgerContext context, CreateManualPaymentRequest request) {
    customerRepository
        .findByIdAndOrganizationIdAndDeletedAtIsNull(request.customerId(), context.organizationId())
        .orElseThrow(() -> new ResourceNotFoundException("Customer", request.customerId()));

    var currency = request.currency();
    if (request.invoiceId() != null) {
      var invoice = invoiceLedgerService.requireInvoice(context, request.invoiceId());
      if (!invoice.getCustomerId().equals(request.customerId())) {
        throw new InvalidInputException(
            "Invoice customer mismatch",
            "Invoice " + invoice.getInvoiceNumber() + " belongs to a different customer");
      }
      requirePayable(invoice, request.amount());
      currency = invoice.getCurrency();
    }

    var payment =
        Payment.manual(
            context.organizationId(),
            PaymentNumberGenerator.next(),
            request.customerId(),
            request.invoiceId(),
            request.paymentMethod(),
            request.amount(),
            currency != null ? currency : ledgerProperties.defaultCurrency(),
            request.paymentDate());
    payment.setReferenceNumber(request.referenceNumber());
    payment.setCustomerNotes(request.customerNotes());
    payment.setAdminNotes(request.adminNotes());
    payment = paymentRepository.save(payment);

    if (payment.getInvoiceId() != null) {
      invoiceLedgerService.applyPayment(context, payment.getInvoiceId(), payment.getAmount());
    }

    auditPayment("payment.created", context, payment, null);
    log.info(
        "Recorded {} payment {} of {} {} for customer {}",
        payment.getPaymentMethod(),
        payment.getPaymentNumber(),
        payment.getAmount().toPlainString(),
        payment.getCurrency(),
        payment.getCustomerId());
    return PaymentResponse.from(payment);
  }

  /**
   * Opens a card charge with the gateway and stores the payment as PENDING. The invoice balance is
   * untouched until the gateway confirms the charge.
   */
  public GatewayPaymentResponse createGatewayPayment(
      LedgerContext context, CreateGatewayPaymentRequest request) {
    var invoice = invoiceLedgerService.requireInvoice(context, request.invoiceId());
    var amount = requirePayable(invoice, request.amount());

    var charge =
        paymentGateway.createCharge(
            new ChargeRequest(
                Money.toMinorUnits(amount, invoice.getCurrency()),
                invoice.getCurrency(),
                Map.of(
                    "invoiceId", invoice.getId().toString(),
                    "invoiceNumber", invoice.getInvoiceNumber(),
                    "customerId", invoice.getCustomerId().toString(),
                    "organizationId", context.organizationId().toString())));

    var payment =
        transactionTemplate.execute(
            status -> {
              var saved =
                  paymentRepository.save(
                      Payment.pendingGateway(
                          context.organizationId(),
                          PaymentNumberGenerator.next(),
                          invoice.getCustomerId(),
                          invoice.getId(),
                          amount,
                          invoice.getCurrency(),
                          charge.gatewayRequestId()));
              auditPayment("payment.created", context, saved, null);
              return saved;
            });

    log.info(
        "Created pending {} payment {} for invoice {} (gateway request {})",
        paymentGateway.providerId(),
        payment.getPaymentNumber(),
        invoice.getInvoiceNumber(),
        charge.gatewayRequestId());
    return new GatewayPaymentResponse(PaymentResponse.from(payment), charge.clientSecret());
  }

  /**
   * Settles a PENDING gateway payment. Unknown request ids are logged and ignored; a payment that
   * is already completed is acknowledged without applying it twice.
   *
   * <p>A capture the ledger cannot accept leaves the payment PENDING with a reconciliation note
   * instead of completing it: the captured amount or currency differs from the payment, or the
   * invoice can no longer take the money because other payments settled first or it was cancelled.
   *
   * @param capturedMinorUnits amount the gateway reports as captured, or null if not reported
   * @param capturedCurrency currency of the capture, or null if not reported
   */
  public Optional<PaymentResponse> confirmGatewayPayment(
      String gatewayRequestId,
      String gatewayChargeId,
      Long capturedMinorUnits,
      String capturedCurrency) {
    try {
      return transactionTemplate.execute(
          status ->
              settleGatewayPayment(
                  gatewayRequestId, gatewayChargeId, capturedMinorUnits, capturedCurrency));
    } catch (OverpaymentRejectedException | InvalidStateException e) {
      var reason = e.getBody().getDetail();
      log.warn(
          "Gateway confirmation of {} rejected by the ledger: {}", gatewayRequestId, reason);
      return transactionTemplate.execute(
          status -> holdForReconciliation(gatewayRequestId, reason));
    }
  }

  private Optional<PaymentResponse> settleGatewayPayment(
      String gatewayRequestId,
      String gatewayChargeId,
      Long capturedMinorUnits,
      String capturedCurrency) {
    var found = paymentRepository.findByGatewayRequestIdForUpdate(gatewayRequestId);
    if (found.isEmpty()) {
      log.warn("No payment found for gateway request {}, ignoring confirmation", gatewayRequestId);
      return Optional.empty();
    }
    var payment = found.get();
    if (payment.getStatus() != PaymentStatus.PENDING) {
      log.info(
          "Payment {} already {}, ignoring confirmation of {}",
          payment.getPaymentNumber(),
          payment.getStatus(),
          gatewayRequestId);
      return Optional.of(PaymentResponse.from(payment));
    }

    var mismatch = captureMismatch(payment, capturedMinorUnits, capturedCurrency);
    if (mismatch != null) {
      return Optional.of(hold(payment, mismatch));
    }

    var context = LedgerContext.system(payment.getOrganizationId());
    var before = payment.toAuditSnapshot();
    payment.complete(feeSchedule.feeFor(payment.getAmount()), gatewayChargeId);
    payment = paymentRepository.save(payment);
    if (payment.getInvoiceId() != null) {
      // gross amount: the processor fee is our cost, not a discount for the customer
      invoiceLedgerService.applyPayment(context, payment.getInvoiceId(), payment.getAmount());
    }

    auditPayment("payment.completed", context, payment, before, "WEBHOOK");
    log.info(
        "Confirmed gateway payment {}: amount={}, fee={}, net={}",
        payment.getPaymentNumber(),
        payment.getAmount().toPlainString(),
        payment.getProcessorFee().toPlainString(),
        payment.getNetAmount().toPlainString());
    return Optional.of(PaymentResponse.from(payment));
  }

  private Optional<PaymentResponse> holdForReconciliation(
      String gatewayRequestId, String reason) {
    return paymentRepository
        .findByGatewayRequestIdForUpdate(gatewayRequestId)
        .map(
            payment ->
                payment.getStatus() == PaymentStatus.PENDING
                    ? hold(payment, reason)
                    : PaymentResponse.from(payment));
  }

  private PaymentResponse hold(Payment payment, String reason) {
    var before = payment.toAuditSnapshot();
    payment.holdForReconciliation(reason);
    payment = paymentRepository.save(payment);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("payment.reconciliation_required")
            .entityType("payment")
            .entityId(payment.getId())
            .context(LedgerContext.system(payment.getOrganizationId()))
            .source("WEBHOOK")
            .before(before)
            .after(payment.toAuditSnapshot())
            .detail("reason", reason)
            .build());
    log.warn(
        "Holding gateway payment {} for reconciliation: {}", payment.getPaymentNumber(), reason);
    return PaymentResponse.from(payment);
  }

  /** Null when the capture matches the payment or the gateway did not report the figure. */
  private static String captureMismatch(
      Payment payment, Long capturedMinorUnits, String capturedCurrency) {
    if (capturedCurrency != null && !capturedCurrency.equalsIgnoreCase(payment.getCurrency())) {
      return "Gateway captured "
          + capturedCurrency.toUpperCase()
          + " but the payment is in "
          + payment.getCurrency();
    }
    if (capturedMinorUnits != null) {
      var captured = Money.fromMinorUnits(capturedMinorUnits, payment.getCurrency());
      if (captured.compareTo(payment.getAmount()) != 0) {
        return "Gateway captured "
            + captured.toPlainString()
            + " but the payment is for "
            + payment.getAmount().toPlainString();
      }
    }
    return null;
  }

  @Transactional
  public Optional<PaymentResponse> failGatewayPayment(String gatewayRequestId, String reason) {
    var found = paymentRepository.findByGatewayRequestIdForUpdate(gatewayRequestId);
    if (found.isEmpty()) {
      log.warn("No payment found for gateway request {}, ignoring failure", gatewayRequestId);
      return Optional.empty();
    }
    var payment = found.get();
    if (payment.getStatus() != PaymentStatus.PENDING) {
      log.warn(
          "Payment {} is {}, ignoring gateway failure for {}",
          payment.getPaymentNumber(),
          payment.getStatus(),
          gatewayRequestId);
      return Optional.of(PaymentResponse.from(payment));
    }

    var context = LedgerContext.system(payment.getOrganizationId());
    var before = payment.toAuditSnapshot();
    payment.fail(reason);
    payment = paymentRepository.save(payment);
    auditPayment("payment.failed", context, payment, before, "WEBHOOK");
    log.info("Gateway payment {} failed: {}", payment.getPaymentNumber(), reason);
    return Optional.of(PaymentResponse.from(payment));
  }

  /** Administrative override for payments stuck in PENDING. */
  @Transactional
  public PaymentResponse updateStatus(
      LedgerContext context, UUID paymentId, PaymentStatus target, String reason) {
    var payment = lockPayment(context, paymentId);
    if (payment.getStatus() == target) {
      return PaymentResponse.from(payment);
    }
    var before = payment.toAuditSnapshot();
    switch (target) {
      case COMPLETED -> {
        payment.complete(feeSchedule.feeFor(payment.getAmount(), payment.getPaymentMethod()), null);
        if (payment.getInvoiceId() != null) {
          invoiceLedgerService.applyPayment(context, payment.getInvoiceId(), payment.getAmount());
        }
      }
      case FAILED -> payment.fail(reason);
      case CANCELLED -> payment.cancel(reason);
      default -> throw new InvalidStateException(
          "Invalid payment status", "Payments cannot be moved to " + target + " manually");
    }
    payment = paymentRepository.save(payment);
    auditPayment("payment.status_updated", context, payment, before);
    log.info(
        "Payment {} moved from {} to {}",
        payment.getPaymentNumber(),
        before.get("status"),
        payment.getStatus());
    return PaymentResponse.from(payment);
  }

  /**
   * Refunds part of a completed payment. The refund is reserved against the net amount first, so
   * concurrent refunds cannot jointly exceed it, then sent to the gateway outside any transaction
   * and finally applied to the invoice.
   */
  public RefundResponse refund(
      LedgerContext context, UUID paymentId, BigDecimal amount, String reason) {
    var reservation =
        transactionTemplate.execute(status -> reserveRefund(context, paymentId, amount, reason));

    String gatewayRefundId = null;
    if (reservation.gatewayReference() != null) {
      try {
        gatewayRefundId =
            paymentGateway
                .refund(
                    new GatewayRefundRequest(
                        reservation.gatewayReference(),
                        Money.toMinorUnits(reservation.amount(), reservation.currency())))
                .gatewayRefundId();
      } catch (RuntimeException e) {
        transactionTemplate.executeWithoutResult(
            status -> abandonRefund(context, reservation, e.getMessage()));
        throw e;
      }
    }

    var completedGatewayRefundId = gatewayRefundId;
    return transactionTemplate.execute(
        status -> completeRefund(context, reservation, completedGatewayRefundId));
  }

  /**
   * Splits a completed payment that was recorded without an invoice across invoices of the same
   * customer. The allocations must add up to the payment amount exactly and are applied in invoice
   * id order, so two allocations touching the same invoices lock them in the same order.
   */
  @Transactional
  public List<PaymentAllocationResponse> allocate(
      LedgerContext context, UUID paymentId, AllocatePaymentRequest request) {
    var payment = lockPayment(context, paymentId);
    if (payment.getStatus() != PaymentStatus.COMPLETED) {
      throw new InvalidStateException(
          "Invalid payment status",
          "Only completed payments can be allocated, not " + payment.getStatus());
    }
    if (payment.getInvoiceId() != null || allocationRepository.existsByPaymentId(paymentId)) {
      throw new InvalidStateException(
          "Payment already applied",
          "Payment " + payment.getPaymentNumber() + " is already applied to invoices");
    }
    if (payment.getRefundedAmount().signum() > 0) {
      throw new InvalidStateException(
          "Payment partially refunded",
          "Payment " + payment.getPaymentNumber() + " has refunds and cannot be allocated");
    }

    var allocations =
        request.allocations().stream()
            .sorted(Comparator.comparing(AllocatePaymentRequest.Allocation::invoiceId))
            .toList();
    var invoiceIds = new HashSet<UUID>();
    var allocated = Money.ZERO;
    for (var allocation : allocations) {
      if (!invoiceIds.add(allocation.invoiceId())) {
        throw new InvalidInputException(
            "Duplicate allocation",
            "Invoice " + allocation.invoiceId() + " appears more than once");
      }
      allocated =
          allocated.add(Money.requireChargeable(allocation.amount(), payment.getCurrency()));
    }
    if (allocated.compareTo(payment.getAmount()) != 0) {
      throw new InvalidInputException(
          "Allocation mismatch",
          "Allocations total "
              + allocated.toPlainString()
              + " but the payment amount is "
              + payment.getAmount().toPlainString());
    }

    var before = payment.toAuditSnapshot();
    var saved = new ArrayList<PaymentAllocation>(allocations.size());
    for (var allocation : allocations) {
      var invoice = invoiceLedgerService.requireInvoice(context, allocation.invoiceId());
      if (!invoice.getCustomerId().equals(payment.getCustomerId())) {
        throw new InvalidInputException(
            "Invoice customer mismatch",
            "Invoice " + invoice.getInvoiceNumber() + " belongs to a different customer");
      }
      if (!invoice.getCurrency().equals(payment.getCurrency())) {
        throw new InvalidInputException(
            "Currency mismatch",
            "Invoice " + invoice.getInvoiceNumber() + " is in " + invoice.getCurrency());
      }
      invoiceLedgerService.applyPayment(context, invoice.getId(), allocation.amount());
      saved.add(
          allocationRepository.save(
              new PaymentAllocation(
                  payment, invoice.getId(), Money.scale(allocation.amount()))));
    }

    payment.recordAllocation(
        saved.stream()
            .map(a -> a.getInvoiceId() + "=" + a.getAmount().toPlainString())
            .collect(Collectors.joining(", ")));
    payment = paymentRepository.save(payment);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("payment.allocated")
            .entityType("payment")
            .entityId(payment.getId())
            .context(context)
            .before(before)
            .after(payment.toAuditSnapshot())
            .detail("invoice_count", saved.size())
            .build());
    log.info(
        "Allocated payment {} of {} across {} invoices",
        payment.getPaymentNumber(),
        payment.getAmount().toPlainString(),
        saved.size());
    return saved.stream().map(PaymentAllocationResponse::from).toList();
  }

  @Transactional(readOnly = true)
  public List<PaymentAllocationResponse> allocations(LedgerContext context, UUID paymentId) {
    requirePayment(context, paymentId);
    return allocationRepository.findByPaymentIdOrderByCreatedAt(paymentId).stream()
        .map(PaymentAllocationResponse::from)
        .toList();
  }

  /**
   * Records several manual payments, each in its own transaction. A rejected item is reported by
   * its position and does not undo the items before or after it.
   */
  public BatchPaymentResponse processBatch(LedgerContext context, BatchPaymentRequest request) {
    var batchId = UUID.randomUUID();
    var succeeded = new ArrayList<PaymentResponse>();
    var failed = new ArrayList<BatchPaymentResponse.Failure>();
    var items = request.payments();
    for (int i = 0; i < items.size(); i++) {
      var item = items.get(i);
      try {
        succeeded.add(transactionTemplate.execute(status -> createManualPayment(context, item)));
      } catch (ErrorResponseException e) {
        failed.add(
            new BatchPaymentResponse.Failure(i, e.getBody().getTitle(), e.getBody().getDetail()));
        log.warn("Batch {} item {} rejected: {}", batchId, i, e.getBody().getDetail());
      } catch (DataAccessException e) {
        failed.add(
            new BatchPaymentResponse.Failure(
                i, "Conflict", e.getMostSpecificCause().getMessage()));
        log.warn("Batch {} item {} failed to persist", batchId, i, e);
      }
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("payment.batch_processed")
            .entityType("payment_batch")
            .entityId(batchId)
            .context(context)
            .detail("submitted", items.size())
            .detail("succeeded", succeeded.size())
            .detail("failed", failed.size())
            .build());
    log.info(
        "Processed payment batch {}: {} succeeded, {} failed",
        batchId,
        succeeded.size(),
        failed.size());
    return new BatchPaymentResponse(batchId, succeeded, failed);
  }

  @Transactional(readOnly = true)
  public PaymentStatsResponse stats(LedgerContext context) {
    var organizationId = context.organizationId();
    var byStatus = new EnumMap<PaymentStatus, Long>(PaymentStatus.class);
    var byMethod = new EnumMap<PaymentMethod, Long>(PaymentMethod.class);
    long paymentCount = 0;
    var completed = Money.ZERO;
    var pending = Money.ZERO;
    for (var totals : paymentRepository.summarize(organizationId)) {
      long count = totals.getPaymentCount();
      paymentCount += count;
      byStatus.merge(totals.getStatus(), count, Long::sum);
      byMethod.merge(totals.getPaymentMethod(), count, Long::sum);
      if (totals.getStatus() == PaymentStatus.COMPLETED) {
        completed = completed.add(totals.getAmount());
      } else if (totals.getStatus() == PaymentStatus.PENDING) {
        pending = pending.add(totals.getAmount());
      }
    }
    long recent =
        paymentRepository.countCreatedSince(organizationId, Instant.now().minus(RECENT_WINDOW));
    return new PaymentStatsResponse(
        paymentCount,
        Money.scale(completed),
        Money.scale(pending),
        byStatus,
        byMethod,
        recent);
  }

  @Transactional(readOnly = true)
  public PaymentResponse get(LedgerContext context, UUID paymentId) {
    return PaymentResponse.from(requirePayment(context, paymentId));
  }

  @Transactional(readOnly = true)
  public List<PaymentResponse> list(
      LedgerContext context, UUID customerId, UUID invoiceId, PaymentStatus status) {
    var spec =
        Specification.where(PaymentSpecifications.liveInOrganization(context.organizationId()))
            .and(PaymentSpecifications.forCustomer(customerId))
            .and(PaymentSpecifications.forInvoice(invoiceId))
            .and(PaymentSpecifications.withStatus(status));
    return paymentRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "createdAt")).stream()
        .map(PaymentResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<RefundResponse> refunds(LedgerContext context, UUID paymentId) {
    requirePayment(context, paymentId);
    return refundRepository.findByPaymentIdOrderByCreatedAt(paymentId).stream()
        .map(RefundResponse::from)
        .toList();
  }

  private RefundReservation reserveRefund(
      LedgerContext context, UUID paymentId, BigDecimal amount, String reason) {
    var payment = lockPayment(context, paymentId);
    if (allocationRepository.existsByPaymentId(paymentId)) {
      throw new InvalidStateException(
          "Payment allocated",
          "Payment " + payment.getPaymentNumber() + " is split across invoices; refund per invoice"
              + " is not supported");
    }
    payment.reserveRefund(amount);
    var refund = refundRepository.save(new Refund(payment, amount, reason));
    paymentRepository.save(payment);
    return new RefundReservation(
        refund.getId(),
        payment.getId(),
        refund.getAmount(),
        payment.getCurrency(),
        payment.getPaymentMethod().isGateway() ? payment.gatewayReference() : null);
  }

  private void abandonRefund(LedgerContext context, RefundReservation reservation, String error) {
    var payment = lockPayment(context, reservation.paymentId());
    var refund = requireRefund(reservation.refundId());
    refund.fail(error);
    payment.releaseRefund(reservation.amount());
    refundRepository.save(refund);
    paymentRepository.save(payment);
    log.warn(
        "Gateway refund of {} for payment {} failed: {}",
        reservation.amount().toPlainString(),
        payment.getPaymentNumber(),
        error);
  }

  private RefundResponse completeRefund(
      LedgerContext context, RefundReservation reservation, String gatewayRefundId) {
    var payment = lockPayment(context, reservation.paymentId());
    var before = payment.toAuditSnapshot();
    var refund = requireRefund(reservation.refundId());
    refund.complete(gatewayRefundId);
    refund = refundRepository.save(refund);

    payment.settleRefunds(
        refundRepository.sumAmountByPaymentIdAndStatus(payment.getId(), RefundStatus.COMPLETED));
    payment = paymentRepository.save(payment);
    if (payment.getInvoiceId() != null) {
      invoiceLedgerService.applyRefund(context, payment.getInvoiceId(), refund.getAmount());
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("payment.refunded")
            .entityType("payment")
            .entityId(payment.getId())
            .context(context)
            .before(before)
            .after(payment.toAuditSnapshot())
            .detail("refund_id", String.valueOf(refund.getId()))
            .detail("amount", refund.getAmount().toPlainString())
            .build());
    log.info(
        "Refunded {} of payment {} (gateway refund {})",
        refund.getAmount().toPlainString(),
        payment.getPaymentNumber(),
        gatewayRefundId);
    return RefundResponse.from(refund);
  }

  private static BigDecimal requirePayable(Invoice invoice, BigDecimal amount) {
    if (invoice.getStatus() == InvoiceStatus.CANCELLED) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot record a payment against cancelled invoice " + invoice.getInvoiceNumber());
    }
    if (!Money.isPositive(amount)) {
      throw new InvalidInputException("Invalid amount", "Payment amount must be positive");
    }
    var scaled = Money.requireChargeable(amount, invoice.getCurrency());
    if (scaled.compareTo(invoice.getBalance()) > 0) {
      throw new ExceedsBalanceException(scaled, invoice.getBalance());
    }
    return scaled;
  }

  private Payment requirePayment(LedgerContext context, UUID paymentId) {
    return paymentRepository
        .findByIdAndOrganizationIdAndDeletedAtIsNull(paymentId, context.organizationId())
        .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
  }

  private Payment lockPayment(LedgerContext context, UUID paymentId) {
    return paymentRepository
        .findByIdForUpdate(paymentId, context.organizationId())
        .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
  }

  private Refund requireRefund(UUID refundId) {
    return refundRepository
        .findById(refundId)
        .orElseThrow(() -> new ResourceNotFoundException("Refund", refundId));
  }

  private void auditPayment(
      String eventType, LedgerContext context, Payment payment, Map<String, Object> before) {
    auditPayment(eventType, context, payment, before, null);
  }

  private void auditPayment(
      String eventType,
      LedgerContext context,
      Payment payment,
      Map<String, Object> before,
      String source) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("payment")
            .entityId(payment.getId())
            .context(context)
            .source(source)
            .before(before)
            .after(payment.toAuditSnapshot())
            .build());
  }

  private record RefundReservation(
      UUID refundId,
      UUID paymentId,
      BigDecimal amount,
      String currency,
      String gatewayReference) {}
}
