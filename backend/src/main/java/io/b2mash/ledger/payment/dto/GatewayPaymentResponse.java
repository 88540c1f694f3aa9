package io.b2mash.ledger.payment.dto;

/** A pending gateway payment plus the secret the client needs to confirm the charge. */
public record GatewayPaymentResponse(PaymentResponse payment, String clientSecret) {}
