package io.b2mash.ledger.invoice;

import io.b2mash.ledger.invoice.dto.CancelInvoiceRequest;
import io.b2mash.ledger.invoice.dto.CreateInvoiceRequest;
import io.b2mash.ledger.invoice.dto.InvoiceResponse;
import io.b2mash.ledger.invoice.dto.InvoiceStatsResponse;
import io.b2mash.ledger.invoice.dto.LineItemResponse;
import io.b2mash.ledger.invoice.dto.UpdateInvoiceRequest;
import io.b2mash.ledger.multitenancy.LedgerContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for invoices. The organization comes from the {@code X-Organization-Id} header;
 * authentication happens upstream of this service.
 */
@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

  private final InvoiceLedgerService invoiceLedgerService;

  public InvoiceController(InvoiceLedgerService invoiceLedgerService) {
    this.invoiceLedgerService = invoiceLedgerService;
  }

  /**
   * Creates a DRAFT invoice from explicit line items or from an accepted quote.
   *
   * @return 201 Created with the invoice response
   */
  @PostMapping
  public ResponseEntity<InvoiceResponse> createInvoice(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @Valid @RequestBody CreateInvoiceRequest request,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    var response = invoiceLedgerService.create(context, request);
    return ResponseEntity.created(URI.create("/api/invoices/" + response.id())).body(response);
  }

  @GetMapping
  public ResponseEntity<List<InvoiceResponse>> listInvoices(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestParam(required = false) UUID customerId,
      @RequestParam(required = false) InvoiceStatus status) {
    var context = LedgerContext.system(organizationId);
    return ResponseEntity.ok(invoiceLedgerService.list(context, customerId, status));
  }

  /** Counts and totals for the dashboard; {@code asOf} defaults to today for overdue checks. */
  @GetMapping("/stats")
  public ResponseEntity<InvoiceStatsResponse> invoiceStats(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate asOf) {
    var context = LedgerContext.system(organizationId);
    return ResponseEntity.ok(
        invoiceLedgerService.stats(context, asOf != null ? asOf : LocalDate.now()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<InvoiceResponse> getInvoice(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @PathVariable UUID id) {
    return ResponseEntity.ok(invoiceLedgerService.get(LedgerContext.system(organizationId), id));
  }

  /** Updates a DRAFT invoice. Line items, when present, replace the current latest versions. */
  @PutMapping("/{id}")
  public ResponseEntity<InvoiceResponse> updateInvoice(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @PathVariable UUID id,
      @Valid @RequestBody UpdateInvoiceRequest request,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    return ResponseEntity.ok(invoiceLedgerService.update(context, id, request));
  }

  @PostMapping("/{id}/send")
  public ResponseEntity<InvoiceResponse> sendInvoice(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @PathVariable UUID id,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    return ResponseEntity.ok(invoiceLedgerService.send(context, id));
  }

  @PostMapping("/{id}/viewed")
  public ResponseEntity<InvoiceResponse> markViewed(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @PathVariable UUID id,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    return ResponseEntity.ok(invoiceLedgerService.markViewed(context, id));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<InvoiceResponse> cancelInvoice(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) CancelInvoiceRequest request,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    String reason = request != null ? request.reason() : null;
    return ResponseEntity.ok(invoiceLedgerService.cancel(context, id, reason));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteInvoice(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @PathVariable UUID id,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    invoiceLedgerService.delete(context, id);
    return ResponseEntity.noContent().build();
  }

  /** Every version of every line item, superseded rows included. */
  @GetMapping("/{id}/line-items/history")
  public ResponseEntity<List<LineItemResponse>> lineItemHistory(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @PathVariable UUID id) {
    var context = LedgerContext.system(organizationId);
    return ResponseEntity.ok(invoiceLedgerService.lineItemHistory(context, id));
  }
}
