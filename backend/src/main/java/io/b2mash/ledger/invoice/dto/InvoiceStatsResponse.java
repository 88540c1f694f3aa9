package io.b2mash.ledger.invoice.dto;

import io.b2mash.ledger.invoice.InvoiceStatus;
import java.math.BigDecimal;
import java.util.Map;

/** Totals exclude cancelled invoices; counts include them. */
public record InvoiceStatsResponse(
    long invoiceCount,
    Map<InvoiceStatus, Long> countByStatus,
    BigDecimal totalValue,
    BigDecimal paidValue,
    BigDecimal outstandingValue,
    long overdueCount,
    BigDecimal overdueValue) {}
