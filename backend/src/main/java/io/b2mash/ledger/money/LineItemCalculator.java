package io.b2mash.ledger.money;

import io.b2mash.ledger.exception.InvalidInputException;
import io.b2mash.ledger.exception.NegativeResultException;
import java.math.BigDecimal;

/**
 * Computes the amounts of a single line item. Every step stays in {@link BigDecimal}; each derived
 * amount is rounded half up to the currency's minor unit in the order discount, subtotal, tax so
 * that {@code total = subtotal + taxAmount} holds exactly and invoice totals can be summed from the
 * lines. Zero-decimal currencies such as JPY therefore never carry fractional line amounts.
 */
public final class LineItemCalculator {

  private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

  private LineItemCalculator() {}

  public static LineItemAmounts calculate(
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal discountPercent,
      BigDecimal taxRate,
      String currency) {
    var discount = discountPercent != null ? discountPercent : BigDecimal.ZERO;
    var tax = taxRate != null ? taxRate : BigDecimal.ZERO;
    validate(quantity, unitPrice, discount, tax);

    var exactLineTotal = quantity.multiply(unitPrice);
    var lineTotal = Money.scale(exactLineTotal, currency);
    var discountAmount = Money.scale(Money.percentOf(exactLineTotal, discount), currency);
    var subtotal = lineTotal.subtract(discountAmount);
    if (subtotal.signum() < 0) {
      throw new NegativeResultException(
          "Line subtotal is negative: " + subtotal.toPlainString());
    }
    var taxAmount = Money.scale(Money.percentOf(subtotal, tax), currency);
    return new LineItemAmounts(
        lineTotal, discountAmount, subtotal, taxAmount, subtotal.add(taxAmount));
  }

  private static void validate(
      BigDecimal quantity, BigDecimal unitPrice, BigDecimal discountPercent, BigDecimal taxRate) {
    if (quantity == null || quantity.signum() < 0) {
      throw new InvalidInputException("Invalid quantity", "Quantity must be zero or greater");
    }
    if (unitPrice == null || unitPrice.signum() < 0) {
      throw new InvalidInputException("Invalid unit price", "Unit price must be zero or greater");
    }
    if (!isPercentage(discountPercent)) {
      throw new InvalidInputException(
          "Invalid discount", "Discount percent must be between 0 and 100");
    }
    if (!isPercentage(taxRate)) {
      throw new InvalidInputException("Invalid tax rate", "Tax rate must be between 0 and 100");
    }
  }

  private static boolean isPercentage(BigDecimal value) {
    return value.signum() >= 0 && value.compareTo(ONE_HUNDRED) <= 0;
  }
}
