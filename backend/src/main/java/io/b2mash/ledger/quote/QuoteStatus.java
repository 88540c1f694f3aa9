package io.b2mash.ledger.quote;

public enum QuoteStatus {
  DRAFT,
  SENT,
  VIEWED,
  ACCEPTED,
  REJECTED,
  EXPIRED,
  REVISED
}
