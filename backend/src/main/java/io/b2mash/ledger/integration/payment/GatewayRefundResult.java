package io.b2mash.ledger.integration.payment;

public record GatewayRefundResult(String gatewayRefundId) {}
