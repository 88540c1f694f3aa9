package io.b2mash.ledger.invoice.dto;

import io.b2mash.ledger.invoice.Invoice;
import io.b2mash.ledger.invoice.InvoiceLineItem;
import io.b2mash.ledger.invoice.InvoiceStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record InvoiceResponse(
    UUID id,
    String invoiceNumber,
    UUID customerId,
    UUID quoteId,
    InvoiceStatus status,
    LocalDate issueDate,
    LocalDate dueDate,
    String currency,
    BigDecimal exchangeRate,
    BigDecimal subtotal,
    BigDecimal taxTotal,
    BigDecimal total,
    BigDecimal depositRequired,
    BigDecimal amountPaid,
    BigDecimal balance,
    String terms,
    String notes,
    Instant sentAt,
    Instant viewedAt,
    Instant paidAt,
    Instant cancelledAt,
    Instant createdAt,
    List<LineItemResponse> lineItems) {

  public static InvoiceResponse from(Invoice invoice, List<InvoiceLineItem> lines) {
    return new InvoiceResponse(
        invoice.getId(),
        invoice.getInvoiceNumber(),
        invoice.getCustomerId(),
        invoice.getQuoteId(),
        invoice.getStatus(),
        invoice.getIssueDate(),
        invoice.getDueDate(),
        invoice.getCurrency(),
        invoice.getExchangeRate(),
        invoice.getSubtotal(),
        invoice.getTaxTotal(),
        invoice.getTotal(),
        invoice.getDepositRequired(),
        invoice.getAmountPaid(),
        invoice.getBalance(),
        invoice.getTerms(),
        invoice.getNotes(),
        invoice.getSentAt(),
        invoice.getViewedAt(),
        invoice.getPaidAt(),
        invoice.getCancelledAt(),
        invoice.getCreatedAt(),
        lines.stream().map(LineItemResponse::from).toList());
  }
}
