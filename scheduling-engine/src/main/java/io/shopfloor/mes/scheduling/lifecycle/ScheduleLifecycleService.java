package io.shopfloor.mes.scheduling.lifecycle;

import io.shopfloor.mes.scheduling.audit.AuditEventBuilder;
import io.shopfloor.mes.scheduling.audit.AuditService;
import io.shopfloor.mes.scheduling.constraint.EntryReadiness;
import io.shopfloor.mes.scheduling.constraint.FeasibilityService;
import io.shopfloor.mes.scheduling.constraint.ReadinessEvaluator;
import io.shopfloor.mes.scheduling.constraint.Violation;
import io.shopfloor.mes.scheduling.engine.CallContext;
import io.shopfloor.mes.scheduling.exception.IllegalStateTransitionException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import io.shopfloor.mes.scheduling.exception.ScheduleNotFeasibleException;
import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntryRepository;
import io.shopfloor.mes.scheduling.schedule.ScheduleState;
import io.shopfloor.mes.scheduling.schedule.ScheduleStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates and applies client-requested state changes of schedules and entries.
 *
 * <p>Every accepted change writes exactly one {@link StateTransitionRecord} in the same unit of
 * work. Rejected changes leave state untouched and are audited in their own transaction.
 */
@Service
public class ScheduleLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(ScheduleLifecycleService.class);

  private final ScheduleStore store;
  private final ScheduleEntryRepository entryRepository;
  private final FeasibilityService feasibilityService;
  private final TransitionRecorder recorder;
  private final StateTransitionRecordRepository transitionRepository;
  private final AuditService auditService;

  public ScheduleLifecycleService(
      ScheduleStore store,
      ScheduleEntryRepository entryRepository,
      FeasibilityService feasibilityService,
      TransitionRecorder recorder,
      StateTransitionRecordRepository transitionRepository,
      AuditService auditService) {
    this.store = store;
    this.entryRepository = entryRepository;
    this.feasibilityService = feasibilityService;
    this.recorder = recorder;
    this.transitionRepository = transitionRepository;
    this.auditService = auditService;
  }

  public ProductionSchedule transitionSchedule(
      UUID scheduleId,
      ScheduleState target,
      long expectedVersion,
      String reason,
      CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var schedule = store.loadForUpdate(scheduleId, expectedVersion);
          var from = schedule.getState();
          if (!from.canBeRequestedByClient(target)) {
            throw rejected(EntityKind.SCHEDULE, scheduleId, scheduleId, from, target, ctx);
          }
          if (target == ScheduleState.RELEASED) {
            requireReleasable(schedule, ctx);
          }
          if (target == ScheduleState.CANCELLED) {
            cancelPendingEntries(schedule, reason, ctx);
          }

          schedule.transitionTo(target, ctx.actorId());
          store.save(schedule);
          recorder.scheduleChanged(schedule, from, ctx.actorId(), reason);
          auditService.log(
              AuditEventBuilder.builder()
                  .eventType("schedule.state_changed")
                  .entityType("schedule")
                  .entityId(scheduleId)
                  .scheduleId(scheduleId)
                  .actorId(ctx.actorId())
                  .details(details("from", from.name(), "to", target.name(), "reason", reason))
                  .build());
          return schedule;
        });
  }

  public ScheduleEntry transitionEntry(
      UUID entryId, EntryState target, long expectedVersion, String reason, CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var entry = store.loadEntry(entryId);
          var schedule = store.loadForUpdate(entry.getScheduleId(), expectedVersion);
          var from = entry.getState();
          // Work orders are only opened by the dispatcher.
          if (target == EntryState.DISPATCHED || !from.canTransitionTo(target)) {
            throw rejected(EntityKind.ENTRY, schedule.getId(), entryId, from, target, ctx);
          }
          if (schedule.getState().isTerminal()) {
            throw new InvalidStateException(
                "Schedule closed",
                "Entries of schedule in state " + schedule.getState() + " cannot change");
          }
          if (target == EntryState.READY) {
            var readiness = readinessOf(schedule, entry, ctx.timeout());
            if (!readiness.isReady()) {
              throw new InvalidStateException(
                  "Entry not ready", String.join("; ", readiness.reasons()));
            }
          }

          if (target == EntryState.CANCELLED) {
            entry.cancel(reason);
          } else {
            entry.transitionTo(target);
          }
          store.saveEntry(entry);
          if (target == EntryState.CANCELLED) {
            store.compactSequence(schedule.getId());
          }
          schedule.touch();
          store.save(schedule);
          recorder.entryChanged(entry, from, ctx.actorId(), reason);
          return entry;
        });
  }

  /** Moves every PLANNED entry whose readiness is READY to READY. */
  public PromotionResult promoteReadyEntries(
      UUID scheduleId, long expectedVersion, CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var schedule = store.loadForUpdate(scheduleId, expectedVersion);
          if (schedule.getState().isTerminal()) {
            throw new InvalidStateException(
                "Schedule closed",
                "Cannot promote entries of schedule in state " + schedule.getState());
          }
          var report = feasibilityService.evaluate(schedule, ctx.timeout());
          var promoted = new ArrayList<UUID>();
          var blocked = new ArrayList<EntryReadiness>();
          for (var entry :
              entryRepository.findByScheduleIdAndStates(scheduleId, List.of(EntryState.PLANNED))) {
            var readiness =
                ReadinessEvaluator.computeReadiness(entry, report.violationsFor(entry.getId()));
            if (readiness.isReady()) {
              var from = entry.transitionTo(EntryState.READY);
              store.saveEntry(entry);
              recorder.entryChanged(entry, from, ctx.actorId(), "promoted");
              promoted.add(entry.getId());
            } else {
              blocked.add(readiness);
            }
          }
          if (!promoted.isEmpty()) {
            schedule.touch();
            store.save(schedule);
          }
          log.info(
              "Promoted {} entries of schedule {} to READY, {} blocked",
              promoted.size(),
              schedule.getScheduleNumber(),
              blocked.size());
          return new PromotionResult(scheduleId, promoted, blocked);
        });
  }

  public EntryReadiness computeReadiness(UUID entryId, Duration timeout) {
    return store.read(
        timeout,
        () -> {
          var entry = store.loadEntry(entryId);
          var schedule = store.load(entry.getScheduleId());
          return readinessOf(schedule, entry, timeout);
        });
  }

  /** Transition records of a schedule and its entries, newest first. */
  public List<StateTransitionRecord> history(UUID scheduleId, Duration timeout) {
    return store.read(
        timeout,
        () -> {
          store.load(scheduleId);
          return transitionRepository.findByScheduleIdOrderByOccurredAtDesc(scheduleId);
        });
  }

  private EntryReadiness readinessOf(
      ProductionSchedule schedule, ScheduleEntry entry, Duration timeout) {
    var violations =
        entry.getState().isPending()
            ? feasibilityService.evaluateEntry(schedule, entry, timeout)
            : List.<Violation>of();
    return ReadinessEvaluator.computeReadiness(entry, violations);
  }

  private void requireReleasable(ProductionSchedule schedule, CallContext ctx) {
    long active =
        entryRepository.countByScheduleIdAndStateNot(schedule.getId(), EntryState.CANCELLED);
    if (active == 0) {
      auditReleaseBlocked(schedule, ctx, Map.of("reason", "no entries"));
      throw new InvalidStateException(
          "Schedule has no entries",
          "Schedule " + schedule.getScheduleNumber() + " needs at least one entry to be released");
    }
    var report = feasibilityService.evaluate(schedule, ctx.timeout());
    if (!report.feasible()) {
      auditReleaseBlocked(
          schedule,
          ctx,
          details(
              "reason", "unresolved critical violations",
              "critical_count", report.blockingViolations().size(),
              "summary", report.summary()));
      throw new ScheduleNotFeasibleException(report);
    }
  }

  private void cancelPendingEntries(ProductionSchedule schedule, String reason, CallContext ctx) {
    var cancelReason = reason != null ? reason : "schedule cancelled";
    var pending = entryRepository.findByScheduleIdAndStates(schedule.getId(), EntryState.PENDING);
    for (var entry : pending) {
      var from = entry.cancel(cancelReason);
      store.saveEntry(entry);
      recorder.entryChanged(entry, from, ctx.actorId(), cancelReason);
    }
    if (!pending.isEmpty()) {
      store.compactSequence(schedule.getId());
    }
  }

  private IllegalStateTransitionException rejected(
      EntityKind kind, UUID scheduleId, UUID entityId, Enum<?> from, Enum<?> to, CallContext ctx) {
    var entityType = kind == EntityKind.SCHEDULE ? "schedule" : "entry";
    log.warn("Rejected {} transition of {}: {} -> {}", entityType, entityId, from, to);
    auditService.logIndependently(
        AuditEventBuilder.builder()
            .eventType(entityType + ".transition_rejected")
            .entityType(entityType)
            .entityId(entityId)
            .scheduleId(scheduleId)
            .actorId(ctx.actorId())
            .details(details("from", from.name(), "to", to.name()))
            .build());
    return new IllegalStateTransitionException(entityType, from, to);
  }

  private void auditReleaseBlocked(
      ProductionSchedule schedule, CallContext ctx, Map<String, Object> details) {
    log.warn("Release of schedule {} blocked: {}", schedule.getScheduleNumber(), details);
    auditService.logIndependently(
        AuditEventBuilder.builder()
            .eventType("schedule.release_blocked")
            .entityType("schedule")
            .entityId(schedule.getId())
            .scheduleId(schedule.getId())
            .actorId(ctx.actorId())
            .details(details)
            .build());
  }

  /** Key/value pairs to a details map, skipping null values. */
  private static Map<String, Object> details(Object... keyValues) {
    var map = new LinkedHashMap<String, Object>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      if (keyValues[i + 1] != null) {
        map.put((String) keyValues[i], keyValues[i + 1]);
      }
    }
    return map;
  }
}
