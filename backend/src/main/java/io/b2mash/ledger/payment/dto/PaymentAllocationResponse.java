package io.b2mash.ledger.payment.dto;

import io.b2mash.ledger.payment.PaymentAllocation;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record PaymentAllocationResponse(
    UUID id, UUID paymentId, UUID invoiceId, BigDecimal amount, Instant createdAt) {

  public static PaymentAllocationResponse from(PaymentAllocation allocation) {
    return new PaymentAllocationResponse(
        allocation.getId(),
        allocation.getPaymentId(),
        allocation.getInvoiceId(),
        allocation.getAmount(),
        allocation.getCreatedAt());
  }
}
