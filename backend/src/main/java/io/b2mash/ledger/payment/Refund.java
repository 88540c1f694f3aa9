package io.b2mash.ledger.payment;

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
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "refunds")
public class Refund {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "payment_id", nullable = false, updatable = false)
  private UUID paymentId;

  @Column(name = "invoice_id", updatable = false)
  private UUID invoiceId;

  @Column(name = "amount", nullable = false, updatable = false, precision = 14, scale = 2)
  private BigDecimal amount;

  @Column(name = "reason", columnDefinition = "TEXT")
  private String reason;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private RefundStatus status;

  @Column(name = "gateway_refund_id", length = 255)
  private String gatewayRefundId;

  @Column(name = "failure_reason", columnDefinition = "TEXT")
  private String failureReason;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  protected Refund() {}

  public Refund(Payment payment, BigDecimal amount, String reason) {
    this.organizationId = payment.getOrganizationId();
    this.paymentId = payment.getId();
    this.invoiceId = payment.getInvoiceId();
    this.amount = Money.scale(amount);
    this.reason = reason;
    this.status = RefundStatus.PENDING;
  }

  @PrePersist
  void onCreate() {
    this.createdAt = Instant.now();
  }

  public void complete(String gatewayRefundId) {
    requirePending();
    this.status = RefundStatus.COMPLETED;
    this.gatewayRefundId = gatewayRefundId;
    this.completedAt = Instant.now();
  }

  public void fail(String failureReason) {
    requirePending();
    this.status = RefundStatus.FAILED;
    this.failureReason = failureReason;
  }

  private void requirePending() {
    if (status != RefundStatus.PENDING) {
      throw new InvalidStateException(
          "Invalid refund status", "Refund " + id + " is already " + status);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public UUID getPaymentId() {
    return paymentId;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getReason() {
    return reason;
  }

  public RefundStatus getStatus() {
    return status;
  }

  public String getGatewayRefundId() {
    return gatewayRefundId;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }
}
