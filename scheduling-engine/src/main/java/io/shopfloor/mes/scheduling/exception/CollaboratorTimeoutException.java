package io.shopfloor.mes.scheduling.exception;

import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class CollaboratorTimeoutException extends ErrorResponseException {

  private final String collaborator;

  public CollaboratorTimeoutException(String collaborator, Duration timeout, Throwable cause) {
    super(HttpStatus.GATEWAY_TIMEOUT, createProblem(collaborator, timeout), cause);
    this.collaborator = collaborator;
  }

  public String getCollaborator() {
    return collaborator;
  }

  private static ProblemDetail createProblem(String collaborator, Duration timeout) {
    var problem = ProblemDetail.forStatus(HttpStatus.GATEWAY_TIMEOUT);
    problem.setTitle("Collaborator timeout");
    problem.setDetail(collaborator + " did not answer within " + timeout);
    return problem;
  }
}
