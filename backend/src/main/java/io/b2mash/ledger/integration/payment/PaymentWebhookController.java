package io.b2mash.ledger.integration.payment;

import io.b2mash.ledger.payment.PaymentLedgerService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives gateway webhooks. Always answers 200 so the provider stops redelivering; anything the
 * ledger cannot use is logged and dropped.
 */
@RestController
@RequestMapping("/api/webhooks/payment")
public class PaymentWebhookController {

  private static final Logger log = LoggerFactory.getLogger(PaymentWebhookController.class);

  private final PaymentGateway paymentGateway;
  private final PaymentLedgerService paymentLedgerService;

  public PaymentWebhookController(
      PaymentGateway paymentGateway, PaymentLedgerService paymentLedgerService) {
    this.paymentGateway = paymentGateway;
    this.paymentLedgerService = paymentLedgerService;
  }

  @PostMapping("/{provider}")
  public ResponseEntity<Void> handleWebhook(
      @PathVariable String provider,
      @RequestBody String payload,
      @RequestHeader Map<String, String> headers) {

    if (!paymentGateway.providerId().equals(provider)) {
      log.warn(
          "Received payment webhook for inactive provider {} (active: {})",
          provider,
          paymentGateway.providerId());
      return ResponseEntity.ok().build();
    }

    try {
      var result = paymentGateway.parseWebhook(payload, headers);
      if (!result.verified()) {
        log.warn("Dropping unverified {} webhook: eventType={}", provider, result.eventType());
        return ResponseEntity.ok().build();
      }
      if (result.gatewayRequestId() == null || result.status() == null) {
        log.debug(
            "Ignoring {} webhook without payment reference: {}", provider, result.eventType());
        return ResponseEntity.ok().build();
      }

      switch (result.status()) {
        case COMPLETED -> paymentLedgerService.confirmGatewayPayment(
            result.gatewayRequestId(),
            result.gatewayChargeId(),
            result.amountMinorUnits(),
            result.currency());
        case FAILED -> paymentLedgerService.failGatewayPayment(
            result.gatewayRequestId(), result.failureReason());
        case PENDING -> log.debug(
            "Payment {} still pending at {}", result.gatewayRequestId(), provider);
      }
    } catch (Exception e) {
      log.error("Error processing {} webhook", provider, e);
    }

    return ResponseEntity.ok().build();
  }
}
