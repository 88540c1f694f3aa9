package io.b2mash.ledger.invoice;

import io.b2mash.ledger.exception.InvalidInputException;
import io.b2mash.ledger.exception.InvalidStateException;
import io.b2mash.ledger.money.LineItemCalculator;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One version of an invoice line. Rows are append-only: an edit inserts a new version and marks
 * this one superseded with a forward link; nothing is ever deleted or recalculated in place.
 */
@Entity
@Table(name = "invoice_line_items")
public class InvoiceLineItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "invoice_id", nullable = false, updatable = false)
  private UUID invoiceId;

  @Column(name = "product_id", updatable = false)
  private UUID productId;

  @Column(name = "service_id", updatable = false)
  private UUID serviceId;

  @Column(name = "description", nullable = false, updatable = false, length = 1000)
  private String description;

  @Column(name = "quantity", nullable = false, updatable = false, precision = 12, scale = 4)
  private BigDecimal quantity;

  @Column(name = "unit_price", nullable = false, updatable = false, precision = 14, scale = 2)
  private BigDecimal unitPrice;

  @Column(name = "discount_percent", nullable = false, updatable = false, precision = 5, scale = 2)
  private BigDecimal discountPercent;

  @Column(name = "tax_rate", nullable = false, updatable = false, precision = 5, scale = 2)
  private BigDecimal taxRate;

  @Column(name = "discount_amount", nullable = false, updatable = false, precision = 14, scale = 2)
  private BigDecimal discountAmount;

  @Column(name = "subtotal", nullable = false, updatable = false, precision = 14, scale = 2)
  private BigDecimal subtotal;

  @Column(name = "tax_amount", nullable = false, updatable = false, precision = 14, scale = 2)
  private BigDecimal taxAmount;

  @Column(name = "total", nullable = false, updatable = false, precision = 14, scale = 2)
  private BigDecimal total;

  @Column(name = "sort_order", nullable = false, updatable = false)
  private int sortOrder;

  @Column(name = "version", nullable = false, updatable = false)
  private int version;

  @Column(name = "is_latest_version", nullable = false)
  private boolean latestVersion;

  @Column(name = "superseded_at")
  private Instant supersededAt;

  @Column(name = "superseded_by_id")
  private UUID supersededById;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected InvoiceLineItem() {}

  public InvoiceLineItem(
      UUID invoiceId, String currency, LineItemInput input, int sortOrder, int version) {
    if (input.description() == null || input.description().isBlank()) {
      throw new InvalidInputException("Invalid line item", "Line item description is required");
    }
    var amounts =
        LineItemCalculator.calculate(
            input.quantity(),
            input.unitPrice(),
            input.discountPercent(),
            input.taxRate(),
            currency);
    this.invoiceId = invoiceId;
    this.productId = input.productId();
    this.serviceId = input.serviceId();
    this.description = input.description().trim();
    this.quantity = input.quantity();
    this.unitPrice = input.unitPrice();
    this.discountPercent =
        input.discountPercent() != null ? input.discountPercent() : BigDecimal.ZERO;
    this.taxRate = input.taxRate() != null ? input.taxRate() : BigDecimal.ZERO;
    this.discountAmount = amounts.discountAmount();
    this.subtotal = amounts.subtotal();
    this.taxAmount = amounts.taxAmount();
    this.total = amounts.total();
    this.sortOrder = sortOrder;
    this.version = version;
    this.latestVersion = true;
  }

  @PrePersist
  void onCreate() {
    this.createdAt = Instant.now();
  }

  /** Retires this version. {@code replacementId} is null when the line was removed. */
  public void supersede(UUID replacementId, Instant at) {
    if (!latestVersion) {
      throw new InvalidStateException(
          "Line item already superseded", "Line item " + id + " is not the latest version");
    }
    this.latestVersion = false;
    this.supersededAt = at;
    this.supersededById = replacementId;
  }

  public UUID getId() {
    return id;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public UUID getProductId() {
    return productId;
  }

  public UUID getServiceId() {
    return serviceId;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getQuantity() {
    return quantity;
  }

  public BigDecimal getUnitPrice() {
    return unitPrice;
  }

  public BigDecimal getDiscountPercent() {
    return discountPercent;
  }

  public BigDecimal getTaxRate() {
    return taxRate;
  }

  public BigDecimal getDiscountAmount() {
    return discountAmount;
  }

  public BigDecimal getSubtotal() {
    return subtotal;
  }

  public BigDecimal getTaxAmount() {
    return taxAmount;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public int getVersion() {
    return version;
  }

  public boolean isLatestVersion() {
    return latestVersion;
  }

  public Instant getSupersededAt() {
    return supersededAt;
  }

  public UUID getSupersededById() {
    return supersededById;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
