package io.b2mash.ledger.payment.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.util.UUID;

public record CreateGatewayPaymentRequest(
    @NotNull UUID invoiceId, @NotNull @Positive BigDecimal amount) {}
