package io.shopfloor.mes.scheduling.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The work order creator rejected or failed the request. Retryable. */
public class WorkOrderCreationFailedException extends ErrorResponseException {

  private final UUID entryId;

  public WorkOrderCreationFailedException(UUID entryId, String reason, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(entryId, reason), cause);
    this.entryId = entryId;
  }

  public UUID getEntryId() {
    return entryId;
  }

  private static ProblemDetail createProblem(UUID entryId, String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Work order creation failed");
    problem.setDetail("Work order for entry " + entryId + " was not created: " + reason);
    return problem;
  }
}
