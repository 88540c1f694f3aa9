package io.b2mash.ledger.integration.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.ledger.payment.PaymentLedgerService;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PaymentWebhookControllerTest {

  @Mock private PaymentGateway paymentGateway;
  @Mock private PaymentLedgerService paymentLedgerService;

  private PaymentWebhookController controller;

  @BeforeEach
  void setUp() {
    controller = new PaymentWebhookController(paymentGateway, paymentLedgerService);
    when(paymentGateway.providerId()).thenReturn("stripe");
  }

  @Test
  void completedWebhookConfirmsPayment() {
    when(paymentGateway.parseWebhook(anyString(), anyMap()))
        .thenReturn(
            new WebhookResult(
                true,
                "payment_intent.succeeded",
                "pi_123",
                10000L,
                "cad",
                GatewayPaymentStatus.COMPLETED,
                "ch_456",
                null));

    var response = controller.handleWebhook("stripe", "{}", Map.of());

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    verify(paymentLedgerService).confirmGatewayPayment("pi_123", "ch_456", 10000L, "cad");
  }

  @Test
  void failedWebhookFailsPayment() {
    when(paymentGateway.parseWebhook(anyString(), anyMap()))
        .thenReturn(
            new WebhookResult(
                true,
                "payment_intent.payment_failed",
                "pi_123",
                10000L,
                "cad",
                GatewayPaymentStatus.FAILED,
                null,
                "card_declined"));

    controller.handleWebhook("stripe", "{}", Map.of());

    verify(paymentLedgerService).failGatewayPayment("pi_123", "card_declined");
  }

  @Test
  void unverifiedWebhookIsDropped() {
    when(paymentGateway.parseWebhook(anyString(), anyMap()))
        .thenReturn(WebhookResult.unverified("payment_intent.succeeded"));

    var response = controller.handleWebhook("stripe", "{}", Map.of());

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    verifyNoInteractions(paymentLedgerService);
  }

  @Test
  void webhookForInactiveProviderIsIgnored() {
    var response = controller.handleWebhook("payfast", "{}", Map.of());

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    verify(paymentGateway, never()).parseWebhook(anyString(), anyMap());
    verifyNoInteractions(paymentLedgerService);
  }

  @Test
  void ledgerFailureStillAcknowledgesWebhook() {
    when(paymentGateway.parseWebhook(anyString(), anyMap()))
        .thenReturn(
            new WebhookResult(
                true,
                "payment_intent.succeeded",
                "pi_123",
                10000L,
                "cad",
                GatewayPaymentStatus.COMPLETED,
                null,
                null));
    when(paymentLedgerService.confirmGatewayPayment(any(), any(), any(), any()))
        .thenThrow(new IllegalStateException("database unavailable"));

    var response = controller.handleWebhook("stripe", "{}", Map.of());

    assertThat(response.getStatusCode().value()).isEqualTo(200);
  }
}
