package io.shopfloor.mes.scheduling.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A requested transition is not an edge of the schedule or entry state graph. */
public class IllegalStateTransitionException extends ErrorResponseException {

  private final Enum<?> from;
  private final Enum<?> to;

  public IllegalStateTransitionException(String entityType, Enum<?> from, Enum<?> to) {
    super(HttpStatus.CONFLICT, createProblem(entityType, from, to), null);
    this.from = from;
    this.to = to;
  }

  public Enum<?> getFrom() {
    return from;
  }

  public Enum<?> getTo() {
    return to;
  }

  private static ProblemDetail createProblem(String entityType, Enum<?> from, Enum<?> to) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Illegal state transition");
    problem.setDetail("Cannot move " + entityType + " from " + from + " to " + to);
    problem.setProperty("from", from.name());
    problem.setProperty("to", to.name());
    return problem;
  }
}
