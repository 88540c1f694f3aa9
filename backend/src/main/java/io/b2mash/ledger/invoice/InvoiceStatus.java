package io.b2mash.ledger.invoice;

/**
 * Invoice lifecycle status. Enforces valid state transitions.
 *
 * <p>Valid transitions:
 *
 * <ul>
 *   <li>DRAFT → SENT (sent to customer)
 *   <li>SENT → VIEWED (customer opened it)
 *   <li>DRAFT, SENT, VIEWED, PARTIALLY_PAID, REFUNDED → PARTIALLY_PAID or PAID (payment applied)
 *   <li>PARTIALLY_PAID, PAID → PARTIALLY_PAID or REFUNDED (refund applied)
 *   <li>anything but PAID → CANCELLED
 *   <li>CANCELLED is terminal
 * </ul>
 */
public enum InvoiceStatus {
  DRAFT,
  SENT,
  VIEWED,
  PARTIALLY_PAID,
  PAID,
  CANCELLED,
  /** Every applied payment has been refunded. */
  REFUNDED;

  public boolean canTransitionTo(InvoiceStatus target) {
    return switch (this) {
      case DRAFT -> target == SENT
          || target == PARTIALLY_PAID
          || target == PAID
          || target == CANCELLED;
      case SENT -> target == VIEWED
          || target == PARTIALLY_PAID
          || target == PAID
          || target == CANCELLED;
      case VIEWED, REFUNDED -> target == PARTIALLY_PAID || target == PAID || target == CANCELLED;
      case PARTIALLY_PAID -> target == PARTIALLY_PAID
          || target == PAID
          || target == REFUNDED
          || target == CANCELLED;
      case PAID -> target == PARTIALLY_PAID || target == REFUNDED;
      case CANCELLED -> false;
    };
  }

  /** Whether line items and totals may still change. */
  public boolean isEditable() {
    return this == DRAFT;
  }
}
