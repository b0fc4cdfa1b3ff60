package io.shopfloor.mes.scheduling.engine;

import io.shopfloor.mes.scheduling.audit.AuditEvent;
import io.shopfloor.mes.scheduling.audit.AuditService;
import io.shopfloor.mes.scheduling.constraint.ConstraintService;
import io.shopfloor.mes.scheduling.constraint.ConstraintType;
import io.shopfloor.mes.scheduling.constraint.EntryReadiness;
import io.shopfloor.mes.scheduling.constraint.FeasibilityReport;
import io.shopfloor.mes.scheduling.constraint.FeasibilityService;
import io.shopfloor.mes.scheduling.constraint.ScheduleConstraint;
import io.shopfloor.mes.scheduling.dispatch.DispatchBatchResult;
import io.shopfloor.mes.scheduling.dispatch.DispatchRecord;
import io.shopfloor.mes.scheduling.dispatch.DispatchService;
import io.shopfloor.mes.scheduling.lifecycle.PromotionResult;
import io.shopfloor.mes.scheduling.lifecycle.ScheduleLifecycleService;
import io.shopfloor.mes.scheduling.lifecycle.StateTransitionRecord;
import io.shopfloor.mes.scheduling.schedule.EntryFilter;
import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.AddEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.CreateSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.UpdateEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.UpdateSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleService;
import io.shopfloor.mes.scheduling.schedule.ScheduleState;
import io.shopfloor.mes.scheduling.schedule.TimeWindow;
import io.shopfloor.mes.scheduling.sequencing.SequencePreview;
import io.shopfloor.mes.scheduling.sequencing.SequencingResult;
import io.shopfloor.mes.scheduling.sequencing.SequencingService;
import io.shopfloor.mes.scheduling.sequencing.SequencingStrategy;
import io.shopfloor.mes.scheduling.statistics.ScheduleStatistics;
import io.shopfloor.mes.scheduling.statistics.ScheduleStatisticsService;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;

/**
 * Public entry point of the scheduling engine. Holds no state between calls; every operation
 * delegates to the owning service with the caller's {@link CallContext}.
 *
 * <p>Mutating operations take the schedule version the caller last saw and fail with {@link
 * io.shopfloor.mes.scheduling.exception.VersionConflictException} if it has moved on. Dispatch is
 * the exception: it is idempotent per entry and does not need a version.
 */
@Component
public class ScheduleEngine {

  private final ScheduleService scheduleService;
  private final ConstraintService constraintService;
  private final FeasibilityService feasibilityService;
  private final SequencingService sequencingService;
  private final ScheduleLifecycleService lifecycleService;
  private final DispatchService dispatchService;
  private final ScheduleStatisticsService statisticsService;
  private final AuditService auditService;

  public ScheduleEngine(
      ScheduleService scheduleService,
      ConstraintService constraintService,
      FeasibilityService feasibilityService,
      SequencingService sequencingService,
      ScheduleLifecycleService lifecycleService,
      DispatchService dispatchService,
      ScheduleStatisticsService statisticsService,
      AuditService auditService) {
    this.scheduleService = scheduleService;
    this.constraintService = constraintService;
    this.feasibilityService = feasibilityService;
    this.sequencingService = sequencingService;
    this.lifecycleService = lifecycleService;
    this.dispatchService = dispatchService;
    this.statisticsService = statisticsService;
    this.auditService = auditService;
  }

  // --- Schedules ---

  public ProductionSchedule createSchedule(CreateSchedule request, CallContext ctx) {
    return scheduleService.createSchedule(request, ctx);
  }

  public ProductionSchedule updateSchedule(
      UUID scheduleId, UpdateSchedule request, long expectedVersion, CallContext ctx) {
    return scheduleService.updateSchedule(scheduleId, request, expectedVersion, ctx);
  }

  public ProductionSchedule lockSchedule(UUID scheduleId, long expectedVersion, CallContext ctx) {
    return scheduleService.lockSchedule(scheduleId, expectedVersion, ctx);
  }

  public void deleteSchedule(UUID scheduleId, long expectedVersion, CallContext ctx) {
    scheduleService.deleteSchedule(scheduleId, expectedVersion, ctx);
  }

  public ProductionSchedule getSchedule(UUID scheduleId, CallContext ctx) {
    return scheduleService.getSchedule(scheduleId, ctx.timeout());
  }

  public ProductionSchedule getScheduleByNumber(String scheduleNumber, CallContext ctx) {
    return scheduleService.getScheduleByNumber(scheduleNumber, ctx.timeout());
  }

  /** Both filters are optional. */
  public List<ProductionSchedule> listSchedules(
      ScheduleState state, UUID siteId, CallContext ctx) {
    return scheduleService.listSchedules(state, siteId, ctx.timeout());
  }

  // --- Entries ---

  public ScheduleEntry addEntry(
      UUID scheduleId, AddEntry request, long expectedVersion, CallContext ctx) {
    return scheduleService.addEntry(scheduleId, request, expectedVersion, ctx);
  }

  public ScheduleEntry updateEntry(
      UUID entryId, UpdateEntry request, long expectedVersion, CallContext ctx) {
    return scheduleService.updateEntry(entryId, request, expectedVersion, ctx);
  }

  public ScheduleEntry removeEntry(
      UUID entryId, String reason, long expectedVersion, CallContext ctx) {
    return scheduleService.removeEntry(entryId, reason, expectedVersion, ctx);
  }

  public ScheduleEntry getEntry(UUID entryId, CallContext ctx) {
    return scheduleService.getEntry(entryId, ctx.timeout());
  }

  public List<ScheduleEntry> queryEntries(EntryFilter filter, CallContext ctx) {
    return scheduleService.queryEntries(filter, ctx.timeout());
  }

  /** READY entries of RELEASED, DISPATCHED or RUNNING schedules; {@code siteId} is optional. */
  public List<ScheduleEntry> entriesReadyForDispatch(UUID siteId, CallContext ctx) {
    return scheduleService.entriesReadyForDispatch(siteId, ctx.timeout());
  }

  // --- Constraints and feasibility ---

  public ScheduleConstraint addConstraint(
      UUID entryId,
      ConstraintType type,
      String targetId,
      BigDecimal requiredQuantity,
      TimeWindow explicitWindow,
      long expectedVersion,
      CallContext ctx) {
    return constraintService.addConstraint(
        entryId, type, targetId, requiredQuantity, explicitWindow, expectedVersion, ctx);
  }

  public ScheduleConstraint updateConstraint(
      UUID constraintId,
      BigDecimal requiredQuantity,
      TimeWindow explicitWindow,
      long expectedVersion,
      CallContext ctx) {
    return constraintService.updateConstraint(
        constraintId, requiredQuantity, explicitWindow, expectedVersion, ctx);
  }

  public List<ScheduleConstraint> listConstraints(UUID entryId, CallContext ctx) {
    return constraintService.listConstraints(entryId, ctx.timeout());
  }

  public ScheduleConstraint overrideConstraint(
      UUID constraintId, String reason, long expectedVersion, CallContext ctx) {
    return constraintService.overrideConstraint(constraintId, reason, expectedVersion, ctx);
  }

  public FeasibilityReport checkFeasibility(UUID scheduleId, CallContext ctx) {
    return feasibilityService.checkFeasibility(scheduleId, ctx.timeout());
  }

  public FeasibilityReport refreshConstraints(
      UUID scheduleId, long expectedVersion, CallContext ctx) {
    return feasibilityService.refreshConstraints(scheduleId, expectedVersion, ctx);
  }

  public EntryReadiness computeReadiness(UUID entryId, CallContext ctx) {
    return lifecycleService.computeReadiness(entryId, ctx.timeout());
  }

  // --- Sequencing ---

  public SequencePreview previewSequence(
      UUID scheduleId, SequencingStrategy strategy, CallContext ctx) {
    return sequencingService.previewSequence(scheduleId, strategy, ctx.timeout());
  }

  public SequencingResult resequence(
      UUID scheduleId, SequencingStrategy strategy, long expectedVersion, CallContext ctx) {
    return sequencingService.resequence(scheduleId, strategy, expectedVersion, ctx);
  }

  // --- Lifecycle ---

  public ProductionSchedule transitionSchedule(
      UUID scheduleId,
      ScheduleState target,
      long expectedVersion,
      String reason,
      CallContext ctx) {
    return lifecycleService.transitionSchedule(scheduleId, target, expectedVersion, reason, ctx);
  }

  public ScheduleEntry transitionEntry(
      UUID entryId, EntryState target, long expectedVersion, String reason, CallContext ctx) {
    return lifecycleService.transitionEntry(entryId, target, expectedVersion, reason, ctx);
  }

  public PromotionResult promoteReadyEntries(
      UUID scheduleId, long expectedVersion, CallContext ctx) {
    return lifecycleService.promoteReadyEntries(scheduleId, expectedVersion, ctx);
  }

  public List<StateTransitionRecord> transitionHistory(UUID scheduleId, CallContext ctx) {
    return lifecycleService.history(scheduleId, ctx.timeout());
  }

  // --- Dispatch ---

  public DispatchRecord dispatch(UUID entryId, CallContext ctx) {
    return dispatchService.dispatch(entryId, ctx);
  }

  public DispatchBatchResult dispatchAll(UUID scheduleId, CallContext ctx) {
    return dispatchService.dispatchAll(scheduleId, ctx, () -> false);
  }

  public DispatchBatchResult dispatchAll(
      UUID scheduleId, CallContext ctx, BooleanSupplier cancelled) {
    return dispatchService.dispatchAll(scheduleId, ctx, cancelled);
  }

  public List<DispatchRecord> dispatchRecords(UUID scheduleId, CallContext ctx) {
    return dispatchService.dispatchRecords(scheduleId, ctx.timeout());
  }

  // --- Reporting ---

  public ScheduleStatistics statistics(CallContext ctx) {
    return statisticsService.statistics(ctx.timeout());
  }

  public Page<AuditEvent> auditTrail(UUID scheduleId, Pageable pageable) {
    return auditService.findBySchedule(scheduleId, pageable);
  }
}
