package io.shopfloor.mes.scheduling.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Optimistic-concurrency conflict on a schedule aggregate. The caller is expected to reload the
 * schedule and retry; the engine never retries on its own.
 */
public class VersionConflictException extends ErrorResponseException {

  private final UUID scheduleId;

  public VersionConflictException(UUID scheduleId, long expectedVersion, long actualVersion) {
    super(
        HttpStatus.CONFLICT,
        createProblem(
            "Schedule "
                + scheduleId
                + " is at version "
                + actualVersion
                + ", expected "
                + expectedVersion),
        null);
    this.scheduleId = scheduleId;
  }

  public VersionConflictException(UUID scheduleId, Throwable cause) {
    super(
        HttpStatus.CONFLICT,
        createProblem(
            (scheduleId != null ? "Schedule " + scheduleId : "Schedule")
                + " was modified concurrently"),
        cause);
    this.scheduleId = scheduleId;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Schedule version conflict");
    problem.setDetail(detail);
    return problem;
  }
}
