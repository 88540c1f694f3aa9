package io.b2mash.ledger.invoice;

import java.math.BigDecimal;
import java.util.UUID;

/** Caller-supplied values of one line; derived amounts are computed, never accepted. */
public record LineItemInput(
    String description,
    BigDecimal quantity,
    BigDecimal unitPrice,
    BigDecimal discountPercent,
    BigDecimal taxRate,
    UUID productId,
    UUID serviceId) {

  public static LineItemInput of(
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal discountPercent,
      BigDecimal taxRate) {
    return new LineItemInput(
        description, quantity, unitPrice, discountPercent, taxRate, null, null);
  }
}
