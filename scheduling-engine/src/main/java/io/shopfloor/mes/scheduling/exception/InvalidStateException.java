package io.shopfloor.mes.scheduling.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A precondition on the current state of a schedule or entry is not met. When the blocking state
 * is known it is exposed as the {@code state} problem property.
 */
public class InvalidStateException extends ErrorResponseException {

  private final Enum<?> state;

  public InvalidStateException(String title, String detail) {
    this(title, detail, null);
  }

  public InvalidStateException(String title, String detail, Enum<?> state) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, state), null);
    this.state = state;
  }

  /** The state that blocked the operation, or {@code null} when the check was not state-based. */
  public Enum<?> getState() {
    return state;
  }

  private static ProblemDetail createProblem(String title, String detail, Enum<?> state) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (state != null) {
      problem.setProperty("state", state.name());
    }
    return problem;
  }
}
