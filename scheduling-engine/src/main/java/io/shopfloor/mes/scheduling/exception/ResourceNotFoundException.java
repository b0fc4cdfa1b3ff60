package io.shopfloor.mes.scheduling.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A schedule, entry or constraint looked up by id (or a schedule by number) does not exist. */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;
  private final Object key;

  public ResourceNotFoundException(String resourceType, Object id) {
    this(resourceType, id, "No " + resourceType + " with id " + id);
  }

  public static ResourceNotFoundException forScheduleNumber(String scheduleNumber) {
    return new ResourceNotFoundException(
        "Schedule", scheduleNumber, "No schedule with number " + scheduleNumber);
  }

  private ResourceNotFoundException(String resourceType, Object key, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, key, detail), null);
    this.resourceType = resourceType;
    this.key = key;
  }

  public String getResourceType() {
    return resourceType;
  }

  public Object getKey() {
    return key;
  }

  private static ProblemDetail createProblem(String resourceType, Object key, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail(detail);
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("key", String.valueOf(key));
    return problem;
  }
}
