package io.b2mash.ledger.payment.dto;

import io.b2mash.ledger.payment.PaymentMethod;
import io.b2mash.ledger.payment.PaymentStatus;
import java.math.BigDecimal;
import java.util.Map;

/** Organization-wide payment figures. Amounts are summed as stored, across currencies. */
public record PaymentStatsResponse(
    long paymentCount,
    BigDecimal completedAmount,
    BigDecimal pendingAmount,
    Map<PaymentStatus, Long> countByStatus,
    Map<PaymentMethod, Long> countByMethod,
    long recentCount) {}
