package io.b2mash.ledger.payment.dto;

import io.b2mash.ledger.payment.PaymentMethod;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record CreateManualPaymentRequest(
    @NotNull UUID customerId,
    UUID invoiceId,
    @NotNull @Positive BigDecimal amount,
    @NotNull PaymentMethod paymentMethod,
    @Size(min = 3, max = 3) String currency,
    LocalDate paymentDate,
    @Size(max = 100) String referenceNumber,
    String customerNotes,
    String adminNotes) {}
