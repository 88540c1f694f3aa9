package io.b2mash.ledger.payment.dto;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a batch of manual payments. Each item commits or rolls back on its own; {@code
 * failed} carries the position of every rejected item in the request.
 */
public record BatchPaymentResponse(
    UUID batchId, List<PaymentResponse> succeeded, List<Failure> failed) {

  public record Failure(int index, String title, String detail) {}
}
