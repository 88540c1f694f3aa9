package io.b2mash.ledger.integration.payment;

import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Charge;
import com.stripe.model.Event;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import io.b2mash.ledger.exception.PaymentGatewayException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stripe adapter built on PaymentIntents. Uses per-request API keys and never sets the global
 * {@code Stripe.apiKey}.
 */
@Component
@ConditionalOnProperty(name = "ledger.payment.provider", havingValue = "stripe")
public class StripePaymentGateway implements PaymentGateway {

  private static final Logger log = LoggerFactory.getLogger(StripePaymentGateway.class);

  static final String SIGNATURE_HEADER = "stripe-signature";

  private final StripeProperties stripeProperties;

  public StripePaymentGateway(StripeProperties stripeProperties) {
    this.stripeProperties = stripeProperties;
  }

  @Override
  public String providerId() {
    return "stripe";
  }

  @Override
  public ChargeResult createCharge(ChargeRequest request) {
    try {
      var params =
          PaymentIntentCreateParams.builder()
              .setAmount(request.amountMinorUnits())
              .setCurrency(request.currency().toLowerCase())
              .putAllMetadata(request.metadata())
              .setAutomaticPaymentMethods(
                  PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                      .setEnabled(true)
                      .build())
              .build();
      var intent = PaymentIntent.create(params, requestOptions());
      log.info(
          "Created Stripe payment intent {} for {} {}",
          intent.getId(),
          request.amountMinorUnits(),
          request.currency());
      return new ChargeResult(intent.getId(), intent.getClientSecret());
    } catch (StripeException e) {
      log.error("Stripe payment intent creation failed: {}", e.getMessage(), e);
      throw new PaymentGatewayException(providerId(), e.getMessage(), e);
    }
  }

  @Override
  public GatewayRefundResult refund(GatewayRefundRequest request) {
    try {
      var builder = RefundCreateParams.builder().setAmount(request.amountMinorUnits());
      if (request.gatewayChargeId().startsWith("pi_")) {
        builder.setPaymentIntent(request.gatewayChargeId());
      } else {
        builder.setCharge(request.gatewayChargeId());
      }
      var refund = Refund.create(builder.build(), requestOptions());
      log.info(
          "Created Stripe refund {} of {} against {}",
          refund.getId(),
          request.amountMinorUnits(),
          request.gatewayChargeId());
      return new GatewayRefundResult(refund.getId());
    } catch (StripeException e) {
      log.error(
          "Stripe refund against {} failed: {}", request.gatewayChargeId(), e.getMessage(), e);
      throw new PaymentGatewayException(providerId(), e.getMessage(), e);
    }
  }

  @Override
  public WebhookResult parseWebhook(String payload, Map<String, String> headers) {
    var signature = signatureHeader(headers);
    if (signature == null) {
      log.warn("Stripe webhook missing Stripe-Signature header");
      return WebhookResult.unverified(null);
    }
    Event event;
    try {
      event = Webhook.constructEvent(payload, signature, stripeProperties.webhookSecret());
    } catch (SignatureVerificationException e) {
      log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
      return WebhookResult.unverified(null);
    }

    var eventType = event.getType();
    var object = event.getDataObjectDeserializer().getObject().orElse(null);
    if (object == null) {
      log.warn("Stripe webhook: could not deserialize data object of {}", eventType);
      return WebhookResult.unverified(eventType);
    }

    return switch (eventType) {
      case "payment_intent.succeeded" -> {
        var intent = (PaymentIntent) object;
        yield new WebhookResult(
            true,
            eventType,
            intent.getId(),
            intent.getAmount(),
            intent.getCurrency(),
            GatewayPaymentStatus.COMPLETED,
            intent.getLatestCharge(),
            null);
      }
      case "payment_intent.payment_failed" -> {
        var intent = (PaymentIntent) object;
        var error = intent.getLastPaymentError();
        yield new WebhookResult(
            true,
            eventType,
            intent.getId(),
            intent.getAmount(),
            intent.getCurrency(),
            GatewayPaymentStatus.FAILED,
            null,
            error != null ? error.getMessage() : "Payment failed");
      }
      case "charge.succeeded" -> {
        var charge = (Charge) object;
        yield new WebhookResult(
            true,
            eventType,
            charge.getPaymentIntent(),
            charge.getAmount(),
            charge.getCurrency(),
            GatewayPaymentStatus.COMPLETED,
            charge.getId(),
            null);
      }
      default -> {
        log.debug("Stripe webhook: unhandled event type '{}'", eventType);
        yield WebhookResult.unverified(eventType);
      }
    };
  }

  private RequestOptions requestOptions() {
    return RequestOptions.builder().setApiKey(stripeProperties.apiKey()).build();
  }

  private static String signatureHeader(Map<String, String> headers) {
    for (var entry : headers.entrySet()) {
      if (SIGNATURE_HEADER.equalsIgnoreCase(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }
}
