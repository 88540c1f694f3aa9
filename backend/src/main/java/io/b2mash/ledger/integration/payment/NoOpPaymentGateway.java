package io.b2mash.ledger.integration.payment;

import io.b2mash.ledger.exception.PaymentGatewayException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Payment gateway used when no provider is configured. Manual payments still work; online charges
 * and gateway refunds are rejected and webhooks are never trusted.
 */
@Component
@ConditionalOnProperty(
    name = "ledger.payment.provider",
    havingValue = "noop",
    matchIfMissing = true)
public class NoOpPaymentGateway implements PaymentGateway {

  private static final Logger log = LoggerFactory.getLogger(NoOpPaymentGateway.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public ChargeResult createCharge(ChargeRequest request) {
    throw new PaymentGatewayException(
        providerId(), "Online payments are not configured for this installation", null);
  }

  @Override
  public GatewayRefundResult refund(GatewayRefundRequest request) {
    throw new PaymentGatewayException(
        providerId(), "Gateway refunds are not configured for this installation", null);
  }

  @Override
  public WebhookResult parseWebhook(String payload, Map<String, String> headers) {
    log.warn("NoOp gateway received a webhook; ignoring it");
    return WebhookResult.unverified(null);
  }
}
