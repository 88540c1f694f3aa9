package io.b2mash.ledger.integration.payment;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Stripe credentials, used only when {@code ledger.payment.provider=stripe}.
 *
 * @param apiKey secret API key sent per request; the global {@code Stripe.apiKey} is never set
 * @param webhookSecret endpoint secret used to verify {@code Stripe-Signature} headers
 */
@ConfigurationProperties(prefix = "ledger.stripe")
public record StripeProperties(String apiKey, String webhookSecret) {}
