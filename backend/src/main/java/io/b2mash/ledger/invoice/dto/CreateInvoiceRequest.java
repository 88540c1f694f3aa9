package io.b2mash.ledger.invoice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Request to create a DRAFT invoice. When {@code quoteId} is set and {@code lineItems} is empty,
 * the accepted quote's lines are copied.
 */
public record CreateInvoiceRequest(
    @NotNull UUID customerId,
    UUID quoteId,
    @Valid List<LineItemRequest> lineItems,
    BigDecimal depositRequired,
    LocalDate issueDate,
    @NotNull LocalDate dueDate,
    @Size(min = 3, max = 3) String currency,
    BigDecimal exchangeRate,
    String terms,
    String notes) {}
