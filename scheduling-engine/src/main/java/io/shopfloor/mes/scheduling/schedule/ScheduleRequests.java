package io.shopfloor.mes.scheduling.schedule;

import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/** Input records for schedule and entry edits. Each validates itself on construction. */
public final class ScheduleRequests {

  private ScheduleRequests() {}

  public record CreateSchedule(
      String scheduleNumber, String name, String description, UUID siteId, TimeWindow horizon) {

    public CreateSchedule {
      requireText(scheduleNumber, "Schedule number");
      requireText(name, "Schedule name");
      if (siteId == null) {
        throw new InvalidRequestException("Site id is required");
      }
      if (horizon == null) {
        throw new InvalidRequestException("Schedule horizon is required");
      }
    }
  }

  public record UpdateSchedule(String name, String description, TimeWindow horizon) {

    public UpdateSchedule {
      requireText(name, "Schedule name");
      if (horizon == null) {
        throw new InvalidRequestException("Schedule horizon is required");
      }
    }
  }

  public record AddEntry(
      String partRef,
      String operationRef,
      String description,
      BigDecimal plannedQuantity,
      String unitOfMeasure,
      int priority,
      LocalDate dueDate,
      TimeWindow plannedWindow) {

    public AddEntry {
      requireText(partRef, "Part reference");
      requireText(operationRef, "Operation reference");
      requirePlanning(plannedQuantity, dueDate, plannedWindow);
    }
  }

  public record UpdateEntry(
      String description,
      BigDecimal plannedQuantity,
      int priority,
      LocalDate dueDate,
      TimeWindow plannedWindow) {

    public UpdateEntry {
      requirePlanning(plannedQuantity, dueDate, plannedWindow);
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidRequestException(field + " is required");
    }
  }

  private static void requirePlanning(
      BigDecimal plannedQuantity, LocalDate dueDate, TimeWindow plannedWindow) {
    if (plannedQuantity == null || plannedQuantity.signum() <= 0) {
      throw new InvalidRequestException("Planned quantity must be positive");
    }
    if (dueDate == null) {
      throw new InvalidRequestException("Due date is required");
    }
    if (plannedWindow == null) {
      throw new InvalidRequestException("Planned window is required");
    }
  }
}
