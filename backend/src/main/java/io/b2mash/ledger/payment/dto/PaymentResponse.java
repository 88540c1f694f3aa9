package io.b2mash.ledger.payment.dto;

import io.b2mash.ledger.payment.Payment;
import io.b2mash.ledger.payment.PaymentMethod;
import io.b2mash.ledger.payment.PaymentStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record PaymentResponse(
    UUID id,
    String paymentNumber,
    UUID customerId,
    UUID invoiceId,
    PaymentMethod paymentMethod,
    PaymentStatus status,
    BigDecimal amount,
    String currency,
    BigDecimal processorFee,
    BigDecimal netAmount,
    BigDecimal refundedAmount,
    LocalDate paymentDate,
    String referenceNumber,
    String stripePaymentIntentId,
    String failureReason,
    String adminNotes,
    Instant processedAt,
    Instant createdAt) {

  public static PaymentResponse from(Payment payment) {
    return new PaymentResponse(
        payment.getId(),
        payment.getPaymentNumber(),
        payment.getCustomerId(),
        payment.getInvoiceId(),
        payment.getPaymentMethod(),
        payment.getStatus(),
        payment.getAmount(),
        payment.getCurrency(),
        payment.getProcessorFee(),
        payment.getNetAmount(),
        payment.getRefundedAmount(),
        payment.getPaymentDate(),
        payment.getReferenceNumber(),
        payment.getStripePaymentIntentId(),
        payment.getFailureReason(),
        payment.getAdminNotes(),
        payment.getProcessedAt(),
        payment.getCreatedAt());
  }
}
