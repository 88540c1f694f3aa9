package io.b2mash.ledger.payment;

public enum PaymentMethod {
  STRIPE_CARD,
  INTERAC_ETRANSFER,
  CASH,
  BANK_TRANSFER,
  CHEQUE,
  OTHER;

  /** Whether the method settles through the payment gateway and carries processor fees. */
  public boolean isGateway() {
    return this == STRIPE_CARD;
  }
}
