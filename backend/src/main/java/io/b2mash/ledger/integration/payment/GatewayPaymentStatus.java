package io.b2mash.ledger.integration.payment;

/** Charge status as reported by a provider webhook. */
public enum GatewayPaymentStatus {
  PENDING,
  COMPLETED,
  FAILED
}
