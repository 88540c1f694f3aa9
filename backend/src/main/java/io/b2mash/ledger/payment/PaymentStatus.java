package io.b2mash.ledger.payment;

/**
 * Payment lifecycle status.
 *
 * <ul>
 *   <li>PENDING → COMPLETED, FAILED or CANCELLED (webhook or manual override)
 *   <li>COMPLETED → REFUNDED once refunds reach the refundable ceiling
 *   <li>FAILED, CANCELLED and REFUNDED are terminal
 * </ul>
 */
public enum PaymentStatus {
  PENDING,
  COMPLETED,
  FAILED,
  CANCELLED,
  REFUNDED;

  public boolean canTransitionTo(PaymentStatus target) {
    return switch (this) {
      case PENDING -> target == COMPLETED || target == FAILED || target == CANCELLED;
      case COMPLETED -> target == REFUNDED;
      case FAILED, CANCELLED, REFUNDED -> false;
    };
  }
}
