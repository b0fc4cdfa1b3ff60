package io.shopfloor.mes.scheduling.exception;

import io.shopfloor.mes.scheduling.constraint.FeasibilityReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ScheduleNotFeasibleException extends ErrorResponseException {

  private final FeasibilityReport report;

  public ScheduleNotFeasibleException(FeasibilityReport report) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(report), null);
    this.report = report;
  }

  public FeasibilityReport getReport() {
    return report;
  }

  private static ProblemDetail createProblem(FeasibilityReport report) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Schedule not feasible");
    problem.setDetail(
        report.blockingViolations().size()
            + " unresolved critical violation(s) on schedule "
            + report.scheduleId());
    return problem;
  }
}
