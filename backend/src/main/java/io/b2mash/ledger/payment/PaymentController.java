package io.b2mash.ledger.payment;

import io.b2mash.ledger.multitenancy.LedgerContext;
import io.b2mash.ledger.payment.dto.AllocatePaymentRequest;
import io.b2mash.ledger.payment.dto.BatchPaymentRequest;
import io.b2mash.ledger.payment.dto.BatchPaymentResponse;
import io.b2mash.ledger.payment.dto.CreateGatewayPaymentRequest;
import io.b2mash.ledger.payment.dto.CreateManualPaymentRequest;
import io.b2mash.ledger.payment.dto.GatewayPaymentResponse;
import io.b2mash.ledger.payment.dto.PaymentAllocationResponse;
import io.b2mash.ledger.payment.dto.PaymentResponse;
import io.b2mash.ledger.payment.dto.PaymentStatsResponse;
import io.b2mash.ledger.payment.dto.RefundRequest;
import io.b2mash.ledger.payment.dto.RefundResponse;
import io.b2mash.ledger.payment.dto.UpdatePaymentStatusRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/payments")
public class PaymentController {

  private final PaymentLedgerService paymentLedgerService;

  public PaymentController(PaymentLedgerService paymentLedgerService) {
    this.paymentLedgerService = paymentLedgerService;
  }

  /** Records a cash, cheque or bank-transfer payment and applies it to its invoice. */
  @PostMapping("/manual")
  public ResponseEntity<PaymentResponse> createManualPayment(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @Valid @RequestBody CreateManualPaymentRequest request,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    var response = paymentLedgerService.createManualPayment(context, request);
    return ResponseEntity.created(URI.create("/api/payments/" + response.id())).body(response);
  }

  /**
   * Starts a card payment. The response carries the gateway client secret; the invoice balance
   * changes only when the gateway webhook confirms the charge.
   */
  @PostMapping("/gateway")
  public ResponseEntity<GatewayPaymentResponse> createGatewayPayment(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @Valid @RequestBody CreateGatewayPaymentRequest request,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    var response = paymentLedgerService.createGatewayPayment(context, request);
    return ResponseEntity.created(URI.create("/api/payments/" + response.payment().id()))
        .body(response);
  }

  /**
   * Records up to 100 manual payments. Always 200: rejected items are listed by position in the
   * response while the others are kept.
   */
  @PostMapping("/batch")
  public ResponseEntity<BatchPaymentResponse> processBatch(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @Valid @RequestBody BatchPaymentRequest request,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    return ResponseEntity.ok(paymentLedgerService.processBatch(context, request));
  }

  @GetMapping("/stats")
  public ResponseEntity<PaymentStatsResponse> paymentStats(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId) {
    return ResponseEntity.ok(paymentLedgerService.stats(LedgerContext.system(organizationId)));
  }

  @GetMapping
  public ResponseEntity<List<PaymentResponse>> listPayments(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestParam(required = false) UUID customerId,
      @RequestParam(required = false) UUID invoiceId,
      @RequestParam(required = false) PaymentStatus status) {
    var context = LedgerContext.system(organizationId);
    return ResponseEntity.ok(paymentLedgerService.list(context, customerId, invoiceId, status));
  }

  @GetMapping("/{id}")
  public ResponseEntity<PaymentResponse> getPayment(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @PathVariable UUID id) {
    return ResponseEntity.ok(paymentLedgerService.get(LedgerContext.system(organizationId), id));
  }

  @PutMapping("/{id}/status")
  public ResponseEntity<PaymentResponse> updateStatus(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @PathVariable UUID id,
      @Valid @RequestBody UpdatePaymentStatusRequest request,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    return ResponseEntity.ok(
        paymentLedgerService.updateStatus(context, id, request.status(), request.reason()));
  }

  @PostMapping("/{id}/refunds")
  public ResponseEntity<RefundResponse> refundPayment(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @PathVariable UUID id,
      @Valid @RequestBody RefundRequest request,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    var response = paymentLedgerService.refund(context, id, request.amount(), request.reason());
    return ResponseEntity.status(201).body(response);
  }

  /** Splits a completed payment recorded without an invoice across the customer's invoices. */
  @PostMapping("/{id}/allocations")
  public ResponseEntity<List<PaymentAllocationResponse>> allocatePayment(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @RequestHeader(value = LedgerContext.USER_HEADER, required = false) UUID userId,
      @PathVariable UUID id,
      @Valid @RequestBody AllocatePaymentRequest request,
      HttpServletRequest httpRequest) {
    var context = LedgerContext.fromRequest(organizationId, userId, httpRequest);
    return ResponseEntity.status(201).body(paymentLedgerService.allocate(context, id, request));
  }

  @GetMapping("/{id}/allocations")
  public ResponseEntity<List<PaymentAllocationResponse>> listAllocations(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @PathVariable UUID id) {
    var context = LedgerContext.system(organizationId);
    return ResponseEntity.ok(paymentLedgerService.allocations(context, id));
  }

  @GetMapping("/{id}/refunds")
  public ResponseEntity<List<RefundResponse>> listRefunds(
      @RequestHeader(LedgerContext.ORGANIZATION_HEADER) UUID organizationId,
      @PathVariable UUID id) {
    var context = LedgerContext.system(organizationId);
    return ResponseEntity.ok(paymentLedgerService.refunds(context, id));
  }
}
