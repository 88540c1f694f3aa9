package io.b2mash.ledger.payment.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record BatchPaymentRequest(
    @NotEmpty @Size(max = 100) List<@Valid @NotNull CreateManualPaymentRequest> payments) {}
