package io.b2mash.ledger.payment.dto;

import io.b2mash.ledger.payment.Refund;
import io.b2mash.ledger.payment.RefundStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record RefundResponse(
    UUID id,
    UUID paymentId,
    UUID invoiceId,
    BigDecimal amount,
    String reason,
    RefundStatus status,
    String gatewayRefundId,
    String failureReason,
    Instant createdAt,
    Instant completedAt) {

  public static RefundResponse from(Refund refund) {
    return new RefundResponse(
        refund.getId(),
        refund.getPaymentId(),
        refund.getInvoiceId(),
        refund.getAmount(),
        refund.getReason(),
        refund.getStatus(),
        refund.getGatewayRefundId(),
        refund.getFailureReason(),
        refund.getCreatedAt(),
        refund.getCompletedAt());
  }
}
