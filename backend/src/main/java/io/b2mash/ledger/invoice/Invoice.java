package io.b2mash.ledger.invoice;

import io.b2mash.ledger.exception.InvalidInputException;
import io.b2mash.ledger.exception.InvalidStateException;
import io.b2mash.ledger.exception.OverpaymentRejectedException;
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
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * An invoice and its running balance. {@code balance = total - amountPaid} after every mutation;
 * {@code amountPaid} only moves through {@link #applyPayment} and {@link #applyRefund}, which the
 * ledger calls while holding the row lock.
 */
@Entity
@Table(name = "invoices")
public class Invoice {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "invoice_number", nullable = false, updatable = false, length = 50)
  private String invoiceNumber;

  @Column(name = "customer_id", nullable = false, updatable = false)
  private UUID customerId;

  @Column(name = "quote_id", updatable = false)
  private UUID quoteId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status;

  @Column(name = "issue_date", nullable = false)
  private LocalDate issueDate;

  @Column(name = "due_date", nullable = false)
  private LocalDate dueDate;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "exchange_rate", nullable = false, precision = 12, scale = 6)
  private BigDecimal exchangeRate;

  @Column(name = "subtotal", nullable = false, precision = 14, scale = 2)
  private BigDecimal subtotal;

  @Column(name = "tax_total", nullable = false, precision = 14, scale = 2)
  private BigDecimal taxTotal;

  @Column(name = "total", nullable = false, precision = 14, scale = 2)
  private BigDecimal total;

  @Column(name = "deposit_required", nullable = false, precision = 14, scale = 2)
  private BigDecimal depositRequired;

  @Column(name = "amount_paid", nullable = false, precision = 14, scale = 2)
  private BigDecimal amountPaid;

  @Column(name = "balance", nullable = false, precision = 14, scale = 2)
  private BigDecimal balance;

  @Column(name = "terms", columnDefinition = "TEXT")
  private String terms;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "line_revision", nullable = false)
  private int lineRevision;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "viewed_at")
  private Instant viewedAt;

  @Column(name = "paid_at")
  private Instant paidAt;

  @Column(name = "cancelled_at")
  private Instant cancelledAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected Invoice() {}

  public Invoice(
      UUID organizationId,
      String invoiceNumber,
      UUID customerId,
      UUID quoteId,
      String currency,
      BigDecimal exchangeRate,
      LocalDate issueDate,
      LocalDate dueDate) {
    if (exchangeRate == null || exchangeRate.signum() <= 0) {
      throw new InvalidInputException("Invalid exchange rate", "Exchange rate must be positive");
    }
    this.organizationId = organizationId;
    this.invoiceNumber = invoiceNumber;
    this.customerId = customerId;
    this.quoteId = quoteId;
    this.currency = currency.toUpperCase();
    this.exchangeRate = exchangeRate;
    this.status = InvoiceStatus.DRAFT;
    this.subtotal = Money.ZERO;
    this.taxTotal = Money.ZERO;
    this.total = Money.ZERO;
    this.depositRequired = Money.ZERO;
    this.amountPaid = Money.ZERO;
    this.balance = Money.ZERO;
    this.lineRevision = 0;
    reschedule(issueDate, dueDate);
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

  /**
   * Recomputes totals from the latest line versions and re-validates the deposit. The amount
   * already paid is preserved.
   */
  public void applyTotals(List<InvoiceLineItem> latestLines, BigDecimal depositRequired) {
    requireEditable();
    var newSubtotal = Money.ZERO;
    var newTaxTotal = Money.ZERO;
    for (var line : latestLines) {
      newSubtotal = newSubtotal.add(line.getSubtotal());
      newTaxTotal = newTaxTotal.add(line.getTaxAmount());
    }
    var newTotal = newSubtotal.add(newTaxTotal);
    var deposit = Money.scale(depositRequired, currency);
    if (deposit.signum() < 0 || deposit.compareTo(newTotal) > 0) {
      throw new InvalidInputException(
          "Invalid deposit",
          "Deposit required must be between 0 and the invoice total of "
              + newTotal.toPlainString());
    }
    if (amountPaid.compareTo(newTotal) > 0) {
      throw new InvalidInputException(
          "Invalid total",
          "Invoice total cannot drop below the amount already paid of "
              + amountPaid.toPlainString());
    }
    this.subtotal = newSubtotal;
    this.taxTotal = newTaxTotal;
    this.total = newTotal;
    this.depositRequired = deposit;
    this.balance = total.subtract(amountPaid);
  }

  /** Advances the line revision counter and returns the new revision number. */
  public int nextLineRevision() {
    requireEditable();
    this.lineRevision++;
    return lineRevision;
  }

  public void reschedule(LocalDate issueDate, LocalDate dueDate) {
    var effectiveIssueDate = issueDate != null ? issueDate : LocalDate.now();
    if (dueDate == null) {
      throw new InvalidInputException("Invalid due date", "Due date is required");
    }
    if (dueDate.isBefore(effectiveIssueDate)) {
      throw new InvalidInputException(
          "Invalid due date",
          "Due date " + dueDate + " is before issue date " + effectiveIssueDate);
    }
    this.issueDate = effectiveIssueDate;
    this.dueDate = dueDate;
  }

  public void markSent() {
    if (status != InvoiceStatus.DRAFT) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot send invoice in status " + status + ". Must be DRAFT.");
    }
    this.status = InvoiceStatus.SENT;
    this.sentAt = Instant.now();
  }

  /**
   * Records the first customer view. Only a SENT invoice changes; in any other state this is a
   * no-op.
   *
   * @return whether the status changed
   */
  public boolean markViewed() {
    if (status != InvoiceStatus.SENT) {
      return false;
    }
    this.status = InvoiceStatus.VIEWED;
    this.viewedAt = Instant.now();
    return true;
  }

  /**
   * Cancels the invoice. Idempotent for an already cancelled invoice.
   *
   * @return whether the status changed
   */
  public boolean cancel(String reason) {
    if (status == InvoiceStatus.CANCELLED) {
      return false;
    }
    if (status == InvoiceStatus.PAID) {
      throw new InvalidStateException("Invalid invoice status", "Cannot cancel a paid invoice");
    }
    if (amountPaid.signum() > 0) {
      throw new InvalidStateException(
          "Invoice has payments",
          "Cannot cancel an invoice with "
              + amountPaid.toPlainString()
              + " applied. Please process a refund instead.");
    }
    this.status = InvoiceStatus.CANCELLED;
    this.cancelledAt = Instant.now();
    if (reason != null && !reason.isBlank()) {
      var line = "Cancellation reason: " + reason.trim();
      this.notes = (notes == null || notes.isBlank()) ? line : notes + "\n\n" + line;
    }
    return true;
  }

  public void applyPayment(BigDecimal amount) {
    if (status == InvoiceStatus.CANCELLED) {
      throw new InvalidStateException(
          "Invalid invoice status", "Cannot apply a payment to a cancelled invoice");
    }
    if (!Money.isPositive(amount)) {
      throw new InvalidInputException("Invalid amount", "Payment amount must be positive");
    }
    var scaled = Money.requireChargeable(amount, currency);
    var newAmountPaid = amountPaid.add(scaled);
    if (newAmountPaid.compareTo(total) > 0) {
      throw new OverpaymentRejectedException(scaled, balance);
    }
    this.amountPaid = newAmountPaid;
    this.balance = total.subtract(amountPaid);
    if (balance.signum() == 0) {
      this.status = InvoiceStatus.PAID;
      this.paidAt = Instant.now();
    } else {
      this.status = InvoiceStatus.PARTIALLY_PAID;
    }
  }

  public void applyRefund(BigDecimal amount) {
    if (!Money.isPositive(amount)) {
      throw new InvalidInputException("Invalid amount", "Refund amount must be positive");
    }
    var scaled = Money.requireChargeable(amount, currency);
    if (scaled.compareTo(amountPaid) > 0) {
      throw new InvalidInputException(
          "Invalid refund",
          "Refund of "
              + scaled.toPlainString()
              + " exceeds the amount paid of "
              + amountPaid.toPlainString());
    }
    var target =
        amountPaid.compareTo(scaled) == 0 ? InvoiceStatus.REFUNDED : InvoiceStatus.PARTIALLY_PAID;
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid invoice status", "Cannot apply a refund to an invoice in status " + status);
    }
    this.amountPaid = amountPaid.subtract(scaled);
    this.balance = total.subtract(amountPaid);
    this.status = target;
    this.paidAt = null;
  }

  public void softDelete() {
    if (amountPaid.signum() > 0) {
      throw new InvalidStateException(
          "Invoice has payments", "Cannot delete an invoice with payments applied");
    }
    this.deletedAt = Instant.now();
  }

  public void setTerms(String terms) {
    requireEditable();
    this.terms = terms;
  }

  public void setNotes(String notes) {
    requireEditable();
    this.notes = notes;
  }

  private void requireEditable() {
    if (!status.isEditable()) {
      throw new InvalidStateException(
          "Invoice not editable", "Invoice can only be edited in DRAFT status, not " + status);
    }
  }

  public Map<String, Object> toAuditSnapshot() {
    var snapshot = new LinkedHashMap<String, Object>();
    snapshot.put("invoice_number", invoiceNumber);
    snapshot.put("status", status.name());
    snapshot.put("subtotal", subtotal.toPlainString());
    snapshot.put("tax_total", taxTotal.toPlainString());
    snapshot.put("total", total.toPlainString());
    snapshot.put("deposit_required", depositRequired.toPlainString());
    snapshot.put("amount_paid", amountPaid.toPlainString());
    snapshot.put("balance", balance.toPlainString());
    snapshot.put("due_date", dueDate.toString());
    return snapshot;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public UUID getCustomerId() {
    return customerId;
  }

  public UUID getQuoteId() {
    return quoteId;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public LocalDate getIssueDate() {
    return issueDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getExchangeRate() {
    return exchangeRate;
  }

  public BigDecimal getSubtotal() {
    return subtotal;
  }

  public BigDecimal getTaxTotal() {
    return taxTotal;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public BigDecimal getDepositRequired() {
    return depositRequired;
  }

  public BigDecimal getAmountPaid() {
    return amountPaid;
  }

  public BigDecimal getBalance() {
    return balance;
  }

  public String getTerms() {
    return terms;
  }

  public String getNotes() {
    return notes;
  }

  public int getLineRevision() {
    return lineRevision;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getViewedAt() {
    return viewedAt;
  }

  public Instant getPaidAt() {
    return paidAt;
  }

  public Instant getCancelledAt() {
    return cancelledAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }
}
