package io.shopfloor.mes.scheduling.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Malformed input, rejected before anything is persisted. */
public class InvalidRequestException extends ErrorResponseException {

  public InvalidRequestException(String detail) {
    this("Invalid request", detail);
  }

  public InvalidRequestException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
