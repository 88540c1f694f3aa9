package io.b2mash.ledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class PaymentGatewayException extends ErrorResponseException {

  public PaymentGatewayException(String providerId, String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(providerId, detail), cause);
  }

  private static ProblemDetail createProblem(String providerId, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Payment gateway error");
    problem.setDetail(providerId + ": " + detail);
    return problem;
  }
}
