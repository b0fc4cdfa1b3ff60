package io.shopfloor.mes.scheduling.exception;

import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class PersistenceTimeoutException extends ErrorResponseException {

  public PersistenceTimeoutException(Duration timeout, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(timeout), cause);
  }

  private static ProblemDetail createProblem(Duration timeout) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Persistence timeout");
    problem.setDetail("Persistence call did not complete within " + timeout);
    return problem;
  }
}
