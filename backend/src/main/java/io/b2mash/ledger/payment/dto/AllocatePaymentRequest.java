package io.b2mash.ledger.payment.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/** Splits one unapplied payment across invoices; the amounts must add up to the payment. */
public record AllocatePaymentRequest(
    @NotEmpty @Size(max = 50) List<@Valid @NotNull Allocation> allocations) {

  public record Allocation(@NotNull UUID invoiceId, @NotNull @Positive BigDecimal amount) {}
}
