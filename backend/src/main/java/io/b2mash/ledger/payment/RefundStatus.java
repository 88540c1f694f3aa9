package io.b2mash.ledger.payment;

public enum RefundStatus {
  /** Reserved against the payment; the gateway call has not finished. */
  PENDING,
  COMPLETED,
  FAILED
}
