package io.b2mash.ledger.integration.payment;

/**
 * Parsed result of a {@link PaymentGateway#parseWebhook} call. {@code verified} must be {@code
 * true} before any ledger operation is invoked; controllers must drop unverified webhooks.
 */
public record WebhookResult(
    boolean verified,
    String eventType,
    String gatewayRequestId,
    Long amountMinorUnits,
    String currency,
    GatewayPaymentStatus status,
    String gatewayChargeId,
    String failureReason) {

  public static WebhookResult unverified(String eventType) {
    return new WebhookResult(false, eventType, null, null, null, null, null, null);
  }
}
