package io.b2mash.ledger.sequence;

import java.util.OptionalLong;

/**
 * Shape of a sequential document number: a fixed prefix followed by a zero-padded counter, e.g.
 * {@code INV-000042}. Counters wider than {@code width} are printed in full.
 */
public record DocumentNumberFormat(String documentType, String prefix, int width) {

  public DocumentNumberFormat {
    if (documentType == null || documentType.isBlank()) {
      throw new IllegalArgumentException("documentType is required");
    }
    if (prefix == null) {
      throw new IllegalArgumentException("prefix is required");
    }
    if (width < 1) {
      throw new IllegalArgumentException("width must be positive");
    }
  }

  public String format(long counter) {
    return prefix + String.format("%0" + width + "d", counter);
  }

  /** Numeric suffix of a number issued in this format, or empty when it does not match. */
  public OptionalLong parse(String number) {
    if (number == null || !number.startsWith(prefix)) {
      return OptionalLong.empty();
    }
    var suffix = number.substring(prefix.length());
    if (suffix.isEmpty() || !suffix.chars().allMatch(Character::isDigit)) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(suffix));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }

  String fallback(long epochMillis) {
    return prefix + "T" + epochMillis;
  }
}
