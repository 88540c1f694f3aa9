package io.b2mash.ledger.quote;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "quote_items")
public class QuoteItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "quote_id", nullable = false, updatable = false)
  private UUID quoteId;

  @Column(name = "product_id")
  private UUID productId;

  @Column(name = "service_id")
  private UUID serviceId;

  @Column(name = "description", nullable = false, length = 1000)
  private String description;

  @Column(name = "quantity", nullable = false, precision = 12, scale = 4)
  private BigDecimal quantity;

  @Column(name = "unit_price", nullable = false, precision = 14, scale = 2)
  private BigDecimal unitPrice;

  @Column(name = "discount_percent", nullable = false, precision = 5, scale = 2)
  private BigDecimal discountPercent;

  @Column(name = "tax_rate", nullable = false, precision = 5, scale = 2)
  private BigDecimal taxRate;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  protected QuoteItem() {}

  public QuoteItem(
      UUID quoteId,
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal discountPercent,
      BigDecimal taxRate,
      int sortOrder) {
    this.quoteId = quoteId;
    this.description = description;
    this.quantity = quantity;
    this.unitPrice = unitPrice;
    this.discountPercent = discountPercent;
    this.taxRate = taxRate;
    this.sortOrder = sortOrder;
  }

  public UUID getId() {
    return id;
  }

  public UUID getQuoteId() {
    return quoteId;
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

  public int getSortOrder() {
    return sortOrder;
  }
}
