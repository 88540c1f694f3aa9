package io.b2mash.ledger.exception;

import java.math.BigDecimal;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Applying the payment would push the invoice's amount paid past its total. Raised under the
 * invoice row lock, so it reflects every payment committed before this one.
 */
public class OverpaymentRejectedException extends ErrorResponseException {

  private final BigDecimal requested;
  private final BigDecimal allowed;

  public OverpaymentRejectedException(BigDecimal requested, BigDecimal allowed) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(
            "Overpayment rejected",
            "Payment of "
                + requested.toPlainString()
                + " exceeds the remaining balance of "
                + allowed.toPlainString()),
        null);
    this.requested = requested;
    this.allowed = allowed;
  }

  public BigDecimal getRequested() {
    return requested;
  }

  public BigDecimal getAllowed() {
    return allowed;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
