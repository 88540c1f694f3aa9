package io.b2mash.ledger.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.ledger.exception.InvalidInputException;
import io.b2mash.ledger.exception.InvalidStateException;
import io.b2mash.ledger.exception.OverpaymentRejectedException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class InvoiceTest {

  private static final UUID ORG_ID = UUID.randomUUID();
  private static final UUID CUSTOMER_ID = UUID.randomUUID();
  private static final LocalDate ISSUE_DATE = LocalDate.of(2024, 3, 1);

  private Invoice draftInvoice() {
    return new Invoice(
        ORG_ID,
        "INV-000001",
        CUSTOMER_ID,
        null,
        "cad",
        BigDecimal.ONE,
        ISSUE_DATE,
        ISSUE_DATE.plusDays(30));
  }

  /** Draft with one 2 x 125.00 line at 10% discount and 13% tax: total 254.25. */
  private Invoice invoiceTotalling25425() {
    var invoice = draftInvoice();
    var line =
        new InvoiceLineItem(
            invoice.getId(),
            invoice.getCurrency(),
            LineItemInput.of(
                "Consulting",
                new BigDecimal("2"),
                new BigDecimal("125.00"),
                new BigDecimal("10"),
                new BigDecimal("13")),
            0,
            invoice.nextLineRevision());
    invoice.applyTotals(List.of(line), null);
    return invoice;
  }

  @Test
  void newInvoiceIsEmptyDraft() {
    var invoice = draftInvoice();

    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.DRAFT);
    assertThat(invoice.getCurrency()).isEqualTo("CAD");
    assertThat(invoice.getTotal()).isEqualByComparingTo("0.00");
    assertThat(invoice.getAmountPaid()).isEqualByComparingTo("0.00");
    assertThat(invoice.getBalance()).isEqualByComparingTo("0.00");
  }

  @Test
  void rejectsDueDateBeforeIssueDate() {
    assertThatThrownBy(
            () ->
                new Invoice(
                    ORG_ID,
                    "INV-000001",
                    CUSTOMER_ID,
                    null,
                    "CAD",
                    BigDecimal.ONE,
                    ISSUE_DATE,
                    ISSUE_DATE.minusDays(1)))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void rejectsNonPositiveExchangeRate() {
    assertThatThrownBy(
            () ->
                new Invoice(
                    ORG_ID,
                    "INV-000001",
                    CUSTOMER_ID,
                    null,
                    "CAD",
                    BigDecimal.ZERO,
                    ISSUE_DATE,
                    ISSUE_DATE))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void applyTotals_sumsLatestLines() {
    var invoice = invoiceTotalling25425();

    assertThat(invoice.getSubtotal()).isEqualByComparingTo("225.00");
    assertThat(invoice.getTaxTotal()).isEqualByComparingTo("29.25");
    assertThat(invoice.getTotal()).isEqualByComparingTo("254.25");
    assertThat(invoice.getBalance()).isEqualByComparingTo("254.25");
  }

  @Test
  void applyTotals_rejectsDepositAboveTotal() {
    var invoice = draftInvoice();
    var line =
        new InvoiceLineItem(
            invoice.getId(),
            invoice.getCurrency(),
            LineItemInput.of("Setup", BigDecimal.ONE, new BigDecimal("50.00"), null, null),
            0,
            invoice.nextLineRevision());

    assertThatThrownBy(() -> invoice.applyTotals(List.of(line), new BigDecimal("50.01")))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void applyPayment_fullAmountMarksPaid() {
    var invoice = invoiceTotalling25425();

    invoice.applyPayment(new BigDecimal("254.25"));

    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PAID);
    assertThat(invoice.getBalance()).isEqualByComparingTo("0.00");
    assertThat(invoice.getPaidAt()).isNotNull();
  }

  @Test
  void applyPayment_partialAmountMarksPartiallyPaid() {
    var invoice = invoiceTotalling25425();

    invoice.applyPayment(new BigDecimal("100.00"));

    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PARTIALLY_PAID);
    assertThat(invoice.getAmountPaid()).isEqualByComparingTo("100.00");
    assertThat(invoice.getBalance()).isEqualByComparingTo("154.25");
  }

  @Test
  void applyPayment_rejectsOneCentOverpayment() {
    var invoice = invoiceTotalling25425();
    invoice.applyPayment(new BigDecimal("254.25"));

    assertThatThrownBy(() -> invoice.applyPayment(new BigDecimal("0.01")))
        .isInstanceOf(OverpaymentRejectedException.class);
    assertThat(invoice.getAmountPaid()).isEqualByComparingTo("254.25");
    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PAID);
  }

  @Test
  void applyPayment_rejectsCancelledInvoice() {
    var invoice = invoiceTotalling25425();
    invoice.cancel(null);

    assertThatThrownBy(() -> invoice.applyPayment(BigDecimal.TEN))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void applyPayment_rejectsNonPositiveAmount() {
    var invoice = invoiceTotalling25425();

    assertThatThrownBy(() -> invoice.applyPayment(BigDecimal.ZERO))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void applyRefund_partialRefundReopensBalance() {
    var invoice = invoiceTotalling25425();
    invoice.applyPayment(new BigDecimal("254.25"));

    invoice.applyRefund(new BigDecimal("54.25"));

    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PARTIALLY_PAID);
    assertThat(invoice.getAmountPaid()).isEqualByComparingTo("200.00");
    assertThat(invoice.getBalance()).isEqualByComparingTo("54.25");
    assertThat(invoice.getPaidAt()).isNull();
  }

  @Test
  void applyRefund_fullRefundMarksRefunded() {
    var invoice = invoiceTotalling25425();
    invoice.applyPayment(new BigDecimal("100.00"));

    invoice.applyRefund(new BigDecimal("100.00"));

    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.REFUNDED);
    assertThat(invoice.getAmountPaid()).isEqualByComparingTo("0.00");
    assertThat(invoice.getBalance()).isEqualByComparingTo("254.25");
  }

  @Test
  void applyRefund_rejectsMoreThanPaid() {
    var invoice = invoiceTotalling25425();
    invoice.applyPayment(new BigDecimal("100.00"));

    assertThatThrownBy(() -> invoice.applyRefund(new BigDecimal("100.01")))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void markSent_onlyFromDraft() {
    var invoice = invoiceTotalling25425();
    invoice.markSent();

    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.SENT);
    assertThat(invoice.getSentAt()).isNotNull();
    assertThatThrownBy(invoice::markSent).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void markViewed_isNoOpOutsideSent() {
    var invoice = invoiceTotalling25425();

    assertThat(invoice.markViewed()).isFalse();
    invoice.markSent();
    assertThat(invoice.markViewed()).isTrue();
    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.VIEWED);
    assertThat(invoice.markViewed()).isFalse();
  }

  @Test
  void sentInvoiceIsNoLongerEditable() {
    var invoice = invoiceTotalling25425();
    invoice.markSent();

    assertThatThrownBy(() -> invoice.setNotes("late edit"))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> invoice.applyTotals(List.of(), null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void cancel_appendsReasonAndIsIdempotent() {
    var invoice = invoiceTotalling25425();
    invoice.setNotes("Net 30");

    assertThat(invoice.cancel("customer went elsewhere")).isTrue();
    assertThat(invoice.cancel("again")).isFalse();

    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.CANCELLED);
    assertThat(invoice.getNotes())
        .isEqualTo("Net 30\n\nCancellation reason: customer went elsewhere");
  }

  @Test
  void cancel_rejectsInvoiceWithPayments() {
    var invoice = invoiceTotalling25425();
    invoice.applyPayment(new BigDecimal("10.00"));

    assertThatThrownBy(() -> invoice.cancel(null))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("refund");
  }

  @Test
  void cancel_rejectsPaidInvoice() {
    var invoice = invoiceTotalling25425();
    invoice.applyPayment(new BigDecimal("254.25"));

    assertThatThrownBy(() -> invoice.cancel(null)).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void softDelete_rejectsInvoiceWithPayments() {
    var invoice = invoiceTotalling25425();
    invoice.applyPayment(new BigDecimal("10.00"));

    assertThatThrownBy(invoice::softDelete).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void statusTransitions() {
    assertThat(InvoiceStatus.DRAFT.canTransitionTo(InvoiceStatus.SENT)).isTrue();
    assertThat(InvoiceStatus.SENT.canTransitionTo(InvoiceStatus.VIEWED)).isTrue();
    assertThat(InvoiceStatus.PAID.canTransitionTo(InvoiceStatus.CANCELLED)).isFalse();
    assertThat(InvoiceStatus.PAID.canTransitionTo(InvoiceStatus.REFUNDED)).isTrue();
    assertThat(InvoiceStatus.CANCELLED.canTransitionTo(InvoiceStatus.PAID)).isFalse();
    assertThat(InvoiceStatus.VIEWED.canTransitionTo(InvoiceStatus.SENT)).isFalse();
  }
}
