package io.b2mash.ledger.invoice.dto;

import jakarta.validation.constraints.Size;

public record CancelInvoiceRequest(@Size(max = 1000) String reason) {}
