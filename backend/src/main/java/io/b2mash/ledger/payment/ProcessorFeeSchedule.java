package io.b2mash.ledger.payment;

import io.b2mash.ledger.config.LedgerProperties;
import io.b2mash.ledger.money.Money;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/** Card processor fee: a percentage of the gross amount plus a fixed amount per charge. */
@Component
public class ProcessorFeeSchedule {

  private final BigDecimal percent;
  private final BigDecimal fixed;

  public ProcessorFeeSchedule(LedgerProperties ledgerProperties) {
    this(ledgerProperties.processorFee().percent(), ledgerProperties.processorFee().fixed());
  }

  ProcessorFeeSchedule(BigDecimal percent, BigDecimal fixed) {
    this.percent = percent;
    this.fixed = fixed;
  }

  public BigDecimal feeFor(BigDecimal amount) {
    return Money.scale(Money.percentOf(amount, percent).add(fixed));
  }

  /** Fee for a payment settled through {@code method}; non-gateway methods cost nothing. */
  public BigDecimal feeFor(BigDecimal amount, PaymentMethod method) {
    return method.isGateway() ? feeFor(amount) : Money.ZERO;
  }
}
