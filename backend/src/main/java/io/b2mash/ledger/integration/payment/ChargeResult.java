package io.b2mash.ledger.integration.payment;

/**
 * @param gatewayRequestId provider id of the pending charge (a Stripe PaymentIntent id)
 * @param clientSecret secret the client uses to confirm the charge
 */
public record ChargeResult(String gatewayRequestId, String clientSecret) {}
