package io.b2mash.ledger.integration.payment;

import java.util.Map;

public record ChargeRequest(long amountMinorUnits, String currency, Map<String, String> metadata) {

  public ChargeRequest {
    metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
  }
}
