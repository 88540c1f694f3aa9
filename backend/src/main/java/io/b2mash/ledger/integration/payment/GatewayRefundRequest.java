package io.b2mash.ledger.integration.payment;

/**
 * @param gatewayChargeId charge (or payment intent) to refund against
 * @param amountMinorUnits amount to refund in minor units
 */
public record GatewayRefundRequest(String gatewayChargeId, long amountMinorUnits) {}
