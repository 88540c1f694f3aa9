package io.b2mash.ledger.payment.dto;

import io.b2mash.ledger.payment.PaymentStatus;
import jakarta.validation.constraints.NotNull;

public record UpdatePaymentStatusRequest(@NotNull PaymentStatus status, String reason) {}
