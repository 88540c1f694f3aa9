package io.b2mash.ledger.money;

import io.b2mash.ledger.exception.InvalidInputException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;

/**
 * Helpers for monetary {@link BigDecimal} values. Amounts are kept at cent scale inside the ledger
 * and only become integer minor units at the payment gateway boundary.
 */
public final class Money {

  public static final int SCALE = 2;
  public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
  public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

  private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

  /**
   * Zero-decimal currencies where the amount is already in the smallest unit. See
   * https://docs.stripe.com/currencies#zero-decimal
   */
  private static final Set<String> ZERO_DECIMAL_CURRENCIES =
      Set.of(
          "BIF", "CLP", "DJF", "GNF", "JPY", "KMF", "KRW", "MGA", "PYG", "RWF", "UGX", "VND", "VUV",
          "XAF", "XOF", "XPF");

  private Money() {}

  /** Rounds to cents, half up. A null amount is treated as zero. */
  public static BigDecimal scale(BigDecimal amount) {
    if (amount == null) {
      return ZERO;
    }
    return amount.setScale(SCALE, ROUNDING);
  }

  /**
   * Rounds half up to the smallest unit of {@code currency} while keeping cent scale, so a JPY
   * amount of 100.50 becomes 101.00. Unknown or null currencies round to cents.
   */
  public static BigDecimal scale(BigDecimal amount, String currency) {
    if (amount == null) {
      return ZERO;
    }
    return amount.setScale(fractionDigits(currency), ROUNDING).setScale(SCALE);
  }

  /** Number of digits after the decimal point in the currency's minor unit. */
  public static int fractionDigits(String currency) {
    return isZeroDecimal(currency) ? 0 : SCALE;
  }

  /**
   * Rejects an amount that cannot be charged as entered because it is finer than the currency's
   * minor unit, e.g. JPY 100.50. Cent-level rounding of two-decimal currencies is still accepted.
   */
  public static BigDecimal requireChargeable(BigDecimal amount, String currency) {
    var scaled = scale(amount);
    if (scaled.compareTo(scale(amount, currency)) != 0) {
      throw new InvalidInputException(
          "Invalid amount",
          "Amount "
              + amount.toPlainString()
              + " has more decimal places than "
              + currency
              + " allows");
    }
    return scaled;
  }

  /** Applies {@code percent} (0-100) to {@code amount} without leaving decimal space. */
  public static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
    return amount.multiply(percent).movePointLeft(2);
  }

  public static boolean isPositive(BigDecimal amount) {
    return amount != null && amount.signum() > 0;
  }

  public static boolean isNegative(BigDecimal amount) {
    return amount != null && amount.signum() < 0;
  }

  /**
   * Converts an amount to the smallest currency unit (e.g., cents), rounding half up. For
   * zero-decimal currencies like JPY the amount is rounded to a whole unit.
   */
  public static long toMinorUnits(BigDecimal amount, String currency) {
    if (isZeroDecimal(currency)) {
      return amount.setScale(0, ROUNDING).longValueExact();
    }
    return amount.multiply(ONE_HUNDRED).setScale(0, ROUNDING).longValueExact();
  }

  public static BigDecimal fromMinorUnits(long minorUnits, String currency) {
    if (isZeroDecimal(currency)) {
      return BigDecimal.valueOf(minorUnits).setScale(SCALE);
    }
    return BigDecimal.valueOf(minorUnits, SCALE);
  }

  static boolean isZeroDecimal(String currency) {
    return currency != null && ZERO_DECIMAL_CURRENCIES.contains(currency.toUpperCase());
  }
}
