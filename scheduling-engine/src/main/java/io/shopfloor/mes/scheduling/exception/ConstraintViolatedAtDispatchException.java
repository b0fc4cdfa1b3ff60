package io.shopfloor.mes.scheduling.exception;

import io.shopfloor.mes.scheduling.constraint.Violation;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Dispatch found unresolved critical violations; the entry keeps its pre-dispatch state. */
public class ConstraintViolatedAtDispatchException extends ErrorResponseException {

  private final UUID entryId;
  private final List<Violation> violations;

  public ConstraintViolatedAtDispatchException(UUID entryId, List<Violation> violations) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(entryId, violations), null);
    this.entryId = entryId;
    this.violations = List.copyOf(violations);
  }

  public UUID getEntryId() {
    return entryId;
  }

  public List<Violation> getViolations() {
    return violations;
  }

  private static ProblemDetail createProblem(UUID entryId, List<Violation> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Constraint violated at dispatch");
    problem.setDetail(
        "Entry " + entryId + " has " + violations.size() + " unresolved critical violation(s)");
    return problem;
  }
}
