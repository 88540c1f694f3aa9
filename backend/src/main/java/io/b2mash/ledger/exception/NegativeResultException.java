package io.b2mash.ledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class NegativeResultException extends ErrorResponseException {

  public NegativeResultException(String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Negative amount");
    problem.setDetail(detail);
    return problem;
  }
}
