package io.b2mash.ledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** No document number could be reserved, not even the timestamp fallback. */
public class SequencerExhaustedException extends ErrorResponseException {

  public SequencerExhaustedException(String documentType, int attempts) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(documentType, attempts), null);
  }

  private static ProblemDetail createProblem(String documentType, int attempts) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Document numbering failed");
    problem.setDetail(
        "Could not allocate a "
            + documentType.toLowerCase()
            + " number after "
            + attempts
            + " attempts and the fallback");
    return problem;
  }
}
