package io.b2mash.ledger.invoice.dto;

import io.b2mash.ledger.invoice.InvoiceLineItem;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record LineItemResponse(
    UUID id,
    String description,
    BigDecimal quantity,
    BigDecimal unitPrice,
    BigDecimal discountPercent,
    BigDecimal taxRate,
    BigDecimal discountAmount,
    BigDecimal subtotal,
    BigDecimal taxAmount,
    BigDecimal total,
    int sortOrder,
    int version,
    boolean latestVersion,
    Instant supersededAt,
    UUID supersededById) {

  public static LineItemResponse from(InvoiceLineItem item) {
    return new LineItemResponse(
        item.getId(),
        item.getDescription(),
        item.getQuantity(),
        item.getUnitPrice(),
        item.getDiscountPercent(),
        item.getTaxRate(),
        item.getDiscountAmount(),
        item.getSubtotal(),
        item.getTaxAmount(),
        item.getTotal(),
        item.getSortOrder(),
        item.getVersion(),
        item.isLatestVersion(),
        item.getSupersededAt(),
        item.getSupersededById());
  }
}
