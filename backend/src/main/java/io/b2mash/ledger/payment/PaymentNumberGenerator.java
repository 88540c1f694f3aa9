package io.b2mash.ledger.payment;

import java.security.SecureRandom;

/**
 * Payment numbers are unique but deliberately not sequential: {@code PAY-<epoch millis>-<6
 * random characters>}. The unique index on {@code payment_number} backs the odd collision.
 */
final class PaymentNumberGenerator {

  private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
  private static final int RANDOM_LENGTH = 6;
  private static final SecureRandom RANDOM = new SecureRandom();

  private PaymentNumberGenerator() {}

  static String next() {
    var suffix = new StringBuilder(RANDOM_LENGTH);
    for (int i = 0; i < RANDOM_LENGTH; i++) {
      suffix.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
    }
    return "PAY-" + System.currentTimeMillis() + "-" + suffix;
  }
}
