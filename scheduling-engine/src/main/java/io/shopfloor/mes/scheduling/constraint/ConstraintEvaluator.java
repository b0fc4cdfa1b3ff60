package io.shopfloor.mes.scheduling.constraint;

import io.shopfloor.mes.scheduling.config.SchedulingProperties;
import io.shopfloor.mes.scheduling.integration.CollaboratorInvoker;
import io.shopfloor.mes.scheduling.integration.availability.AvailabilityResult;
import io.shopfloor.mes.scheduling.integration.availability.AvailabilitySource;
import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import io.shopfloor.mes.scheduling.schedule.TimeWindow;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

/**
 * Evaluates CAPACITY and MATERIAL constraints against the {@link AvailabilitySource}.
 *
 * <p>Committed material demand is read on the calling thread, inside the caller's transaction.
 * Availability requests for all constraints are then issued concurrently on the collaborator
 * executor and awaited against one shared deadline.
 */
@Component
public class ConstraintEvaluator {

  static final String AVAILABILITY = "AvailabilitySource";

  private final AvailabilitySource availabilitySource;
  private final CollaboratorInvoker invoker;
  private final ScheduleConstraintRepository constraintRepository;
  private final BigDecimal capacitySoftThreshold;
  private final BigDecimal materialSafetyMargin;

  public ConstraintEvaluator(
      AvailabilitySource availabilitySource,
      CollaboratorInvoker invoker,
      ScheduleConstraintRepository constraintRepository,
      SchedulingProperties properties) {
    this.availabilitySource = availabilitySource;
    this.invoker = invoker;
    this.constraintRepository = constraintRepository;
    this.capacitySoftThreshold = properties.constraints().capacitySoftThreshold();
    this.materialSafetyMargin = properties.constraints().materialSafetyMargin();
  }

  public List<Violation> evaluate(
      ProductionSchedule schedule,
      ScheduleEntry entry,
      List<ScheduleConstraint> constraints,
      Duration timeout) {
    return evaluateAll(schedule, Map.of(entry, constraints), timeout)
        .getOrDefault(entry.getId(), List.of());
  }

  /**
   * Evaluates several entries at once. The result has one key per input entry, in input order, each
   * with the violations of that entry (possibly empty).
   */
  public Map<UUID, List<Violation>> evaluateAll(
      ProductionSchedule schedule,
      Map<ScheduleEntry, List<ScheduleConstraint>> constraintsByEntry,
      Duration timeout) {
    var deadline = Instant.now().plus(timeout);
    var pending = new ArrayList<PendingCheck>();
    for (var item : constraintsByEntry.entrySet()) {
      var entry = item.getKey();
      for (var constraint : item.getValue()) {
        var committed =
            constraint.getType() == ConstraintType.MATERIAL
                ? committedDemand(schedule, entry, constraint)
                : BigDecimal.ZERO;
        var window = windowFor(schedule, entry, constraint);
        var future =
            invoker.submit(
                () ->
                    availabilitySource.available(
                        constraint.getTargetId(), window, constraint.getRequiredQuantity()));
        pending.add(new PendingCheck(entry, constraint, committed, future));
      }
    }

    var result = new LinkedHashMap<UUID, List<Violation>>();
    constraintsByEntry.keySet().forEach(entry -> result.put(entry.getId(), new ArrayList<>()));
    try {
      for (var check : pending) {
        var availability = invoker.await(AVAILABILITY, check.future(), deadline, timeout);
        var violation = assess(check.entry(), check.constraint(), availability, check.committed());
        if (violation != null) {
          result.get(check.entry().getId()).add(violation);
        }
      }
    } finally {
      // A failed or late check abandons the rest; no-op for checks already answered.
      pending.forEach(check -> check.future().cancel(true));
    }
    return result;
  }

  /** Pure rule application; {@code null} when the constraint is satisfied. */
  Violation assess(
      ScheduleEntry entry,
      ScheduleConstraint constraint,
      AvailabilityResult availability,
      BigDecimal committedDemand) {
    if (availability == null || availability.unconstrained()) {
      return null;
    }
    return switch (constraint.getType()) {
      case CAPACITY -> assessCapacity(entry, constraint, availability);
      case MATERIAL -> assessMaterial(entry, constraint, availability, committedDemand);
    };
  }

  private Violation assessCapacity(
      ScheduleEntry entry, ScheduleConstraint constraint, AvailabilityResult availability) {
    var required = constraint.getRequiredQuantity();
    var available = availability.available();
    if (required.compareTo(available) > 0) {
      return violation(
          entry,
          constraint,
          ConstraintSeverity.CRITICAL,
          "Capacity shortfall on "
              + constraint.getTargetId()
              + ": required "
              + required.toPlainString()
              + ", available "
              + available.toPlainString());
    }
    var capacity = availability.capacity();
    if (capacity != null && capacity.signum() > 0) {
      var utilization =
          capacity.subtract(available).add(required).divide(capacity, 4, RoundingMode.HALF_UP);
      if (utilization.compareTo(capacitySoftThreshold) > 0) {
        return violation(
            entry,
            constraint,
            ConstraintSeverity.WARNING,
            "Projected utilization of "
                + constraint.getTargetId()
                + " is "
                + utilization.movePointRight(2).stripTrailingZeros().toPlainString()
                + "%");
      }
    }
    return null;
  }

  private Violation assessMaterial(
      ScheduleEntry entry,
      ScheduleConstraint constraint,
      AvailabilityResult availability,
      BigDecimal committedDemand) {
    var required = constraint.getRequiredQuantity();
    var net = availability.available().subtract(committedDemand);
    if (required.compareTo(net) > 0) {
      return violation(
          entry,
          constraint,
          ConstraintSeverity.CRITICAL,
          "Material shortfall on "
              + constraint.getTargetId()
              + ": required "
              + required.toPlainString()
              + ", net available "
              + net.toPlainString()
              + " after "
              + committedDemand.toPlainString()
              + " committed");
    }
    var headroom = net.subtract(required);
    if (headroom.compareTo(required.multiply(materialSafetyMargin)) < 0) {
      return violation(
          entry,
          constraint,
          ConstraintSeverity.WARNING,
          "Material "
              + constraint.getTargetId()
              + " leaves only "
              + headroom.toPlainString()
              + " headroom");
    }
    return null;
  }

  private BigDecimal committedDemand(
      ProductionSchedule schedule, ScheduleEntry entry, ScheduleConstraint constraint) {
    var sum =
        constraintRepository.sumCommittedMaterialDemand(
            constraint.getTargetId(),
            schedule.getSiteId(),
            entry.getId(),
            EntryState.COMMITTED,
            entry.getDueDate());
    return sum != null ? sum : BigDecimal.ZERO;
  }

  /** Capacity uses the explicit or planned window; material runs from horizon start to due date. */
  static TimeWindow windowFor(
      ProductionSchedule schedule, ScheduleEntry entry, ScheduleConstraint constraint) {
    var explicit = constraint.explicitWindow();
    if (explicit != null) {
      return explicit;
    }
    if (constraint.getType() == ConstraintType.CAPACITY) {
      return entry.plannedWindow();
    }
    var start = schedule.getHorizonStart();
    var dueEnd = entry.getDueDate().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    if (!dueEnd.isAfter(start)) {
      dueEnd = entry.getPlannedEnd().isAfter(start) ? entry.getPlannedEnd() : start.plusSeconds(1);
    }
    return new TimeWindow(start, dueEnd);
  }

  private static Violation violation(
      ScheduleEntry entry,
      ScheduleConstraint constraint,
      ConstraintSeverity severity,
      String message) {
    return new Violation(
        constraint.getId(),
        entry.getId(),
        constraint.getType(),
        severity,
        constraint.getTargetId(),
        message,
        constraint.isOverridden());
  }

  private record PendingCheck(
      ScheduleEntry entry,
      ScheduleConstraint constraint,
      BigDecimal committed,
      CompletableFuture<AvailabilityResult> future) {}
}
