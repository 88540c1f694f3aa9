package io.b2mash.ledger.payment;

import io.b2mash.ledger.exception.ExceedsRefundableException;
import io.b2mash.ledger.exception.InvalidInputException;
import io.b2mash.ledger.exception.InvalidStateException;
import io.b2mash.ledger.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A received or pending payment. Once completed, {@code netAmount = amount - processorFee}; the
 * refundable ceiling is the net amount, because processor fees are not recoverable.
 *
 * <p>{@code refundedAmount} counts both completed refunds and refunds still reserved while the
 * gateway call is in flight.
 */
@Entity
@Table(name = "payments")
public class Payment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "payment_number", nullable = false, updatable = false, length = 50)
  private String paymentNumber;

  @Column(name = "customer_id", nullable = false, updatable = false)
  private UUID customerId;

  @Column(name = "invoice_id", updatable = false)
  private UUID invoiceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "payment_method", nullable = false, updatable = false, length = 30)
  private PaymentMethod paymentMethod;

  @Column(name = "amount", nullable = false, updatable = false, precision = 14, scale = 2)
  private BigDecimal amount;

  @Column(name = "currency", nullable = false, updatable = false, length = 3)
  private String currency;

  @Column(name = "payment_date", nullable = false)
  private LocalDate paymentDate;

  @Column(name = "reference_number", length = 100)
  private String referenceNumber;

  @Column(name = "stripe_payment_intent_id", updatable = false, length = 255)
  private String stripePaymentIntentId;

  @Column(name = "stripe_charge_id", length = 255)
  private String stripeChargeId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private PaymentStatus status;

  @Column(name = "failure_reason", columnDefinition = "TEXT")
  private String failureReason;

  @Column(name = "processor_fee", precision = 14, scale = 2)
  private BigDecimal processorFee;

  @Column(name = "net_amount", precision = 14, scale = 2)
  private BigDecimal netAmount;

  @Column(name = "refunded_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal refundedAmount;

  @Column(name = "customer_notes", columnDefinition = "TEXT")
  private String customerNotes;

  @Column(name = "admin_notes", columnDefinition = "TEXT")
  private String adminNotes;

  @Column(name = "processed_at")
  private Instant processedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected Payment() {}

  private Payment(
      UUID organizationId,
      String paymentNumber,
      UUID customerId,
      UUID invoiceId,
      PaymentMethod paymentMethod,
      BigDecimal amount,
      String currency,
      LocalDate paymentDate) {
    if (!Money.isPositive(amount)) {
      throw new InvalidInputException("Invalid amount", "Payment amount must be positive");
    }
    this.organizationId = organizationId;
    this.paymentNumber = paymentNumber;
    this.customerId = customerId;
    this.invoiceId = invoiceId;
    this.paymentMethod = paymentMethod;
    this.currency = currency.toUpperCase();
    this.amount = Money.requireChargeable(amount, this.currency);
    this.paymentDate = paymentDate != null ? paymentDate : LocalDate.now();
    this.refundedAmount = Money.ZERO;
  }

  /** A payment settled outside the gateway; completed on creation with no processor fee. */
  public static Payment manual(
      UUID organizationId,
      String paymentNumber,
      UUID customerId,
      UUID invoiceId,
      PaymentMethod paymentMethod,
      BigDecimal amount,
      String currency,
      LocalDate paymentDate) {
    if (paymentMethod == null || paymentMethod.isGateway()) {
      throw new InvalidInputException(
          "Invalid payment method", "Manual payments cannot use method " + paymentMethod);
    }
    var payment =
        new Payment(
            organizationId,
            paymentNumber,
            customerId,
            invoiceId,
            paymentMethod,
            amount,
            currency,
            paymentDate);
    payment.status = PaymentStatus.COMPLETED;
    payment.processorFee = Money.ZERO;
    payment.netAmount = payment.amount;
    payment.processedAt = Instant.now();
    return payment;
  }

  /** A card payment awaiting gateway confirmation. */
  public static Payment pendingGateway(
      UUID organizationId,
      String paymentNumber,
      UUID customerId,
      UUID invoiceId,
      BigDecimal amount,
      String currency,
      String stripePaymentIntentId) {
    var payment =
        new Payment(
            organizationId,
            paymentNumber,
            customerId,
            invoiceId,
            PaymentMethod.STRIPE_CARD,
            amount,
            currency,
            null);
    payment.status = PaymentStatus.PENDING;
    payment.stripePaymentIntentId = stripePaymentIntentId;
    return payment;
  }

  @PrePersist
  void onCreate() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public void complete(BigDecimal fee, String chargeId) {
    requireTransition(PaymentStatus.COMPLETED);
    var scaledFee = Money.scale(fee, currency);
    if (scaledFee.signum() < 0) {
      throw new InvalidInputException("Invalid fee", "Processor fee cannot be negative");
    }
    this.processorFee = scaledFee.min(amount);
    this.netAmount = amount.subtract(processorFee);
    if (chargeId != null) {
      this.stripeChargeId = chargeId;
    }
    this.status = PaymentStatus.COMPLETED;
    this.processedAt = Instant.now();
  }

  public void fail(String reason) {
    requireTransition(PaymentStatus.FAILED);
    this.status = PaymentStatus.FAILED;
    this.failureReason = reason;
    this.processedAt = Instant.now();
  }

  public void cancel(String reason) {
    requireTransition(PaymentStatus.CANCELLED);
    this.status = PaymentStatus.CANCELLED;
    if (reason != null && !reason.isBlank()) {
      this.adminNotes = appendNote(adminNotes, "Cancelled: " + reason.trim());
    }
  }

  /**
   * Leaves a PENDING payment unconfirmed and records why on the payment, for a gateway capture
   * that the ledger could not accept as reported.
   */
  public void holdForReconciliation(String reason) {
    if (status != PaymentStatus.PENDING) {
      throw new InvalidStateException(
          "Invalid payment status", "Only pending payments can be held, not " + status);
    }
    this.adminNotes = appendNote(adminNotes, "Reconciliation required: " + reason);
  }

  /** Records how an unapplied payment was split across invoices. */
  public void recordAllocation(String summary) {
    this.adminNotes = appendNote(adminNotes, "Partial payment allocated: " + summary);
  }

  /** Net amount if known, otherwise the gross amount (non-gateway payments). */
  public BigDecimal refundCeiling() {
    return netAmount != null ? netAmount : amount;
  }

  public BigDecimal refundableRemaining() {
    return refundCeiling().subtract(refundedAmount);
  }

  /** Holds {@code refundAmount} against the ceiling until the refund completes or fails. */
  public void reserveRefund(BigDecimal refundAmount) {
    if (status != PaymentStatus.COMPLETED) {
      throw new InvalidStateException(
          "Invalid payment status", "Only completed payments can be refunded, not " + status);
    }
    if (!Money.isPositive(refundAmount)) {
      throw new InvalidInputException("Invalid amount", "Refund amount must be positive");
    }
    var scaled = Money.requireChargeable(refundAmount, currency);
    var remaining = refundableRemaining();
    if (scaled.compareTo(remaining) > 0) {
      throw new ExceedsRefundableException(scaled, remaining);
    }
    this.refundedAmount = refundedAmount.add(scaled);
  }

  public void releaseRefund(BigDecimal refundAmount) {
    this.refundedAmount = refundedAmount.subtract(Money.scale(refundAmount)).max(Money.ZERO);
  }

  /** Moves to REFUNDED once completed refunds have consumed the whole ceiling. */
  public void settleRefunds(BigDecimal completedRefunds) {
    if (status == PaymentStatus.COMPLETED
        && Money.scale(completedRefunds).compareTo(refundCeiling()) >= 0) {
      this.status = PaymentStatus.REFUNDED;
    }
  }

  public void setReferenceNumber(String referenceNumber) {
    this.referenceNumber = referenceNumber;
  }

  public void setCustomerNotes(String customerNotes) {
    this.customerNotes = customerNotes;
  }

  public void setAdminNotes(String adminNotes) {
    this.adminNotes = adminNotes;
  }

  /** Reference passed to the gateway for refunds: the charge id when known, else the intent. */
  public String gatewayReference() {
    return stripeChargeId != null ? stripeChargeId : stripePaymentIntentId;
  }

  private void requireTransition(PaymentStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid payment status", "Cannot move payment from " + status + " to " + target);
    }
  }

  private static String appendNote(String existing, String note) {
    return (existing == null || existing.isBlank()) ? note : existing + "\n" + note;
  }

  public Map<String, Object> toAuditSnapshot() {
    var snapshot = new LinkedHashMap<String, Object>();
    snapshot.put("payment_number", paymentNumber);
    snapshot.put("status", status.name());
    snapshot.put("payment_method", paymentMethod.name());
    snapshot.put("amount", amount.toPlainString());
    snapshot.put("currency", currency);
    if (processorFee != null) {
      snapshot.put("processor_fee", processorFee.toPlainString());
      snapshot.put("net_amount", netAmount.toPlainString());
    }
    snapshot.put("refunded_amount", refundedAmount.toPlainString());
    if (invoiceId != null) {
      snapshot.put("invoice_id", invoiceId.toString());
    }
    return snapshot;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getPaymentNumber() {
    return paymentNumber;
  }

  public UUID getCustomerId() {
    return customerId;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public PaymentMethod getPaymentMethod() {
    return paymentMethod;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public LocalDate getPaymentDate() {
    return paymentDate;
  }

  public String getReferenceNumber() {
    return referenceNumber;
  }

  public String getStripePaymentIntentId() {
    return stripePaymentIntentId;
  }

  public String getStripeChargeId() {
    return stripeChargeId;
  }

  public PaymentStatus getStatus() {
    return status;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public BigDecimal getProcessorFee() {
    return processorFee;
  }

  public BigDecimal getNetAmount() {
    return netAmount;
  }

  public BigDecimal getRefundedAmount() {
    return refundedAmount;
  }

  public String getCustomerNotes() {
    return customerNotes;
  }

  public String getAdminNotes() {
    return adminNotes;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }
}
