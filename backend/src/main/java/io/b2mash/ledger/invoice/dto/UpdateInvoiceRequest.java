package io.b2mash.ledger.invoice.dto;

import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Partial update of a DRAFT invoice; null fields are left unchanged. */
public record UpdateInvoiceRequest(
    @Valid List<LineItemRequest> lineItems,
    BigDecimal depositRequired,
    LocalDate issueDate,
    LocalDate dueDate,
    String terms,
    String notes) {}
