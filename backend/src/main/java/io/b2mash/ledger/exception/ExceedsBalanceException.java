package io.b2mash.ledger.exception;

import java.math.BigDecimal;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ExceedsBalanceException extends ErrorResponseException {

  private final BigDecimal requested;
  private final BigDecimal allowed;

  public ExceedsBalanceException(BigDecimal requested, BigDecimal allowed) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(
            "Payment exceeds balance",
            "Payment of "
                + requested.toPlainString()
                + " exceeds the invoice balance of "
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
