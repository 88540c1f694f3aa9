package io.b2mash.ledger.integration.payment;

import java.util.Map;

/**
 * Port for online card payments. All amounts crossing this interface are integers in the
 * currency's minor unit; conversion from ledger money happens in the caller.
 */
public interface PaymentGateway {

  /** Unique provider identifier (e.g., "stripe", "noop"); also the webhook path segment. */
  String providerId();

  /** Creates a charge request on the provider. Does not settle; settlement arrives by webhook. */
  ChargeResult createCharge(ChargeRequest request);

  /** Refunds part or all of a settled charge. */
  GatewayRefundResult refund(GatewayRefundRequest request);

  /**
   * Verifies the signature of an incoming webhook and parses it. Unverifiable or unsupported
   * payloads come back with {@code verified = false}; this method does not throw for them.
   */
  WebhookResult parseWebhook(String payload, Map<String, String> headers);
}
