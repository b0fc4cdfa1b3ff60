package io.shopfloor.mes.scheduling.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Schedule numbers are unique across sites; a second schedule cannot reuse one. */
public class DuplicateScheduleNumberException extends ErrorResponseException {

  private final String scheduleNumber;

  public DuplicateScheduleNumberException(String scheduleNumber) {
    super(HttpStatus.CONFLICT, createProblem(scheduleNumber), null);
    this.scheduleNumber = scheduleNumber;
  }

  public String getScheduleNumber() {
    return scheduleNumber;
  }

  private static ProblemDetail createProblem(String scheduleNumber) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Duplicate schedule number");
    problem.setDetail("Schedule number " + scheduleNumber + " is already in use");
    problem.setProperty("scheduleNumber", scheduleNumber);
    return problem;
  }
}
