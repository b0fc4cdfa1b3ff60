package io.shopfloor.mes.scheduling.constraint;

import io.shopfloor.mes.scheduling.engine.CallContext;
import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntryRepository;
import io.shopfloor.mes.scheduling.schedule.ScheduleStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Feasibility of whole schedules: read-only projection and persisted refresh. */
@Service
public class FeasibilityService {

  private static final Logger log = LoggerFactory.getLogger(FeasibilityService.class);

  private final ScheduleStore store;
  private final ScheduleEntryRepository entryRepository;
  private final ScheduleConstraintRepository constraintRepository;
  private final ConstraintEvaluator evaluator;

  public FeasibilityService(
      ScheduleStore store,
      ScheduleEntryRepository entryRepository,
      ScheduleConstraintRepository constraintRepository,
      ConstraintEvaluator evaluator) {
    this.store = store;
    this.entryRepository = entryRepository;
    this.constraintRepository = constraintRepository;
    this.evaluator = evaluator;
  }

  /** Evaluates every pending entry without changing anything. */
  public FeasibilityReport checkFeasibility(UUID scheduleId, Duration timeout) {
    return store.read(timeout, () -> evaluate(store.load(scheduleId), timeout));
  }

  /**
   * Evaluates and stores the outcome on each constraint of a pending entry and on the schedule's
   * feasibility summary.
   */
  public FeasibilityReport refreshConstraints(
      UUID scheduleId, long expectedVersion, CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var schedule = store.loadForUpdate(scheduleId, expectedVersion);
          var entries = pendingEntries(scheduleId);
          var constraints = constraintsByEntry(scheduleId, entries);
          var report =
              FeasibilityReport.of(
                  scheduleId, evaluator.evaluateAll(schedule, constraints, ctx.timeout()));

          Map<UUID, Violation> byConstraint = new HashMap<>();
          report.violations().forEach(v -> byConstraint.put(v.constraintId(), v));
          constraints.values().stream()
              .flatMap(List::stream)
              .forEach(c -> c.recordEvaluation(byConstraint.get(c.getId())));

          schedule.recordFeasibility(report.feasible(), report.summary());
          store.save(schedule);
          log.info(
              "Refreshed constraints of schedule {}: feasible={}, {}",
              schedule.getScheduleNumber(),
              report.feasible(),
              report.summary());
          return report;
        });
  }

  /** Runs inside the caller's unit of work. */
  public FeasibilityReport evaluate(ProductionSchedule schedule, Duration timeout) {
    var entries = pendingEntries(schedule.getId());
    var constraints = constraintsByEntry(schedule.getId(), entries);
    return FeasibilityReport.of(
        schedule.getId(), evaluator.evaluateAll(schedule, constraints, timeout));
  }

  /** Live violations of one entry, inside the caller's unit of work. */
  public List<Violation> evaluateEntry(
      ProductionSchedule schedule, ScheduleEntry entry, Duration timeout) {
    var constraints = constraintRepository.findByEntryIdOrderByCreatedAtAsc(entry.getId());
    if (constraints.isEmpty()) {
      return List.of();
    }
    return evaluator.evaluate(schedule, entry, constraints, timeout);
  }

  private List<ScheduleEntry> pendingEntries(UUID scheduleId) {
    return entryRepository.findByScheduleIdAndStates(scheduleId, EntryState.PENDING);
  }

  private Map<ScheduleEntry, List<ScheduleConstraint>> constraintsByEntry(
      UUID scheduleId, List<ScheduleEntry> entries) {
    var grouped =
        constraintRepository.findByScheduleIdOrderByCreatedAtAsc(scheduleId).stream()
            .collect(Collectors.groupingBy(ScheduleConstraint::getEntryId));
    var result = new LinkedHashMap<ScheduleEntry, List<ScheduleConstraint>>();
    for (var entry : entries) {
      result.put(entry, new ArrayList<>(grouped.getOrDefault(entry.getId(), List.of())));
    }
    return result;
  }
}
