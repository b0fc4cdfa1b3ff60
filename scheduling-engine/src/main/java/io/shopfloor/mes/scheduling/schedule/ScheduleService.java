package io.shopfloor.mes.scheduling.schedule;

import io.shopfloor.mes.scheduling.audit.AuditEventBuilder;
import io.shopfloor.mes.scheduling.audit.AuditService;
import io.shopfloor.mes.scheduling.constraint.ScheduleConstraintRepository;
import io.shopfloor.mes.scheduling.engine.CallContext;
import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import io.shopfloor.mes.scheduling.exception.DuplicateScheduleNumberException;
import io.shopfloor.mes.scheduling.exception.ResourceNotFoundException;
import io.shopfloor.mes.scheduling.lifecycle.StateTransitionRecordRepository;
import io.shopfloor.mes.scheduling.lifecycle.TransitionRecorder;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.AddEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.CreateSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.UpdateEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.UpdateSchedule;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Schedule header and entry maintenance. State changes go through the lifecycle service. */
@Service
public class ScheduleService {

  private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

  private final ScheduleStore store;
  private final ProductionScheduleRepository scheduleRepository;
  private final ScheduleEntryRepository entryRepository;
  private final ScheduleConstraintRepository constraintRepository;
  private final StateTransitionRecordRepository transitionRepository;
  private final TransitionRecorder recorder;
  private final AuditService auditService;

  public ScheduleService(
      ScheduleStore store,
      ProductionScheduleRepository scheduleRepository,
      ScheduleEntryRepository entryRepository,
      ScheduleConstraintRepository constraintRepository,
      StateTransitionRecordRepository transitionRepository,
      TransitionRecorder recorder,
      AuditService auditService) {
    this.store = store;
    this.scheduleRepository = scheduleRepository;
    this.entryRepository = entryRepository;
    this.constraintRepository = constraintRepository;
    this.transitionRepository = transitionRepository;
    this.recorder = recorder;
    this.auditService = auditService;
  }

  public ProductionSchedule createSchedule(CreateSchedule request, CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var number = request.scheduleNumber().trim();
          if (scheduleRepository.existsByScheduleNumber(number)) {
            throw new DuplicateScheduleNumberException(number);
          }
          var schedule =
              scheduleRepository.saveAndFlush(
                  new ProductionSchedule(
                      number,
                      request.name().trim(),
                      request.description(),
                      request.siteId(),
                      request.horizon(),
                      ctx.actorId()));
          auditService.log(
              AuditEventBuilder.builder()
                  .eventType("schedule.created")
                  .entityType("schedule")
                  .entityId(schedule.getId())
                  .scheduleId(schedule.getId())
                  .actorId(ctx.actorId())
                  .details(
                      Map.of("schedule_number", number, "site_id", request.siteId().toString()))
                  .build());
          log.info("Created schedule {} ({})", number, schedule.getId());
          return schedule;
        });
  }

  public ProductionSchedule updateSchedule(
      UUID scheduleId, UpdateSchedule request, long expectedVersion, CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var schedule = store.loadForUpdate(scheduleId, expectedVersion);
          schedule.update(request.name().trim(), request.description(), request.horizon());
          var activeStates = EnumSet.complementOf(EnumSet.of(EntryState.CANCELLED));
          for (var entry : entryRepository.findByScheduleIdAndStates(scheduleId, activeStates)) {
            if (!request.horizon().contains(entry.plannedWindow())) {
              throw new InvalidRequestException(
                  "Entry outside horizon",
                  "Entry "
                      + entry.getEntryNumber()
                      + " is planned outside the new horizon ["
                      + request.horizon().start()
                      + ", "
                      + request.horizon().end()
                      + ")");
            }
          }
          return store.save(schedule);
        });
  }

  /** Soft delete: the schedule remains readable but rejects further edits. */
  public ProductionSchedule lockSchedule(UUID scheduleId, long expectedVersion, CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var schedule = store.loadForUpdate(scheduleId, expectedVersion);
          if (schedule.isLocked()) {
            return schedule;
          }
          schedule.lock();
          store.save(schedule);
          auditService.log(
              AuditEventBuilder.builder()
                  .eventType("schedule.locked")
                  .entityType("schedule")
                  .entityId(scheduleId)
                  .scheduleId(scheduleId)
                  .actorId(ctx.actorId())
                  .build());
          return schedule;
        });
  }

  /**
   * Removes a schedule with its entries, constraints and transition records. Refused once any
   * entry has been dispatched; use cancellation instead.
   */
  public void deleteSchedule(UUID scheduleId, long expectedVersion, CallContext ctx) {
    store.write(
        ctx.timeout(),
        () -> {
          var schedule = store.loadForUpdate(scheduleId, expectedVersion);
          if (entryRepository.existsByScheduleIdAndWorkOrderIdIsNotNull(scheduleId)) {
            throw new InvalidStateException(
                "Schedule has dispatched work",
                "Schedule " + schedule.getScheduleNumber() + " has dispatched entries; cancel it");
          }
          constraintRepository.deleteByScheduleId(scheduleId);
          transitionRepository.deleteByScheduleId(scheduleId);
          entryRepository.deleteByScheduleId(scheduleId);
          scheduleRepository.delete(schedule);
          scheduleRepository.flush();
          auditService.log(
              AuditEventBuilder.builder()
                  .eventType("schedule.deleted")
                  .entityType("schedule")
                  .entityId(scheduleId)
                  .scheduleId(scheduleId)
                  .actorId(ctx.actorId())
                  .details(Map.of("schedule_number", schedule.getScheduleNumber()))
                  .build());
          log.info("Deleted schedule {}", schedule.getScheduleNumber());
          return null;
        });
  }

  public ProductionSchedule getSchedule(UUID scheduleId, Duration timeout) {
    return store.read(timeout, () -> store.load(scheduleId));
  }

  public ProductionSchedule getScheduleByNumber(String scheduleNumber, Duration timeout) {
    return store.read(
        timeout,
        () ->
            scheduleRepository
                .findByScheduleNumber(scheduleNumber)
                .orElseThrow(() -> ResourceNotFoundException.forScheduleNumber(scheduleNumber)));
  }

  public List<ProductionSchedule> listSchedules(
      ScheduleState state, UUID siteId, Duration timeout) {
    return store.read(timeout, () -> scheduleRepository.findWithFilters(state, siteId));
  }

  public ScheduleEntry addEntry(
      UUID scheduleId, AddEntry request, long expectedVersion, CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var schedule = store.loadForUpdate(scheduleId, expectedVersion);
          requireWithinHorizon(schedule, request.plannedWindow());
          var entry =
              new ScheduleEntry(
                  scheduleId,
                  schedule.allocateEntryNumber(),
                  request.partRef().trim(),
                  request.operationRef().trim(),
                  request.description(),
                  request.plannedQuantity(),
                  request.unitOfMeasure(),
                  request.priority(),
                  request.dueDate(),
                  request.plannedWindow());
          entry.assignSequencePosition(store.nextSequencePosition(scheduleId));
          var saved = store.saveEntry(entry);
          store.save(schedule);
          log.info(
              "Added entry {} ({}) to schedule {}",
              saved.getEntryNumber(),
              saved.getPartRef(),
              schedule.getScheduleNumber());
          return saved;
        });
  }

  public ScheduleEntry updateEntry(
      UUID entryId, UpdateEntry request, long expectedVersion, CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var entry = store.loadEntry(entryId);
          var schedule = store.loadForUpdate(entry.getScheduleId(), expectedVersion);
          schedule.requireAcceptsEntries();
          requireWithinHorizon(schedule, request.plannedWindow());
          entry.update(
              request.description(),
              request.plannedQuantity(),
              request.priority(),
              request.dueDate(),
              request.plannedWindow());
          store.saveEntry(entry);
          schedule.touch();
          store.save(schedule);
          return entry;
        });
  }

  /** Cancels the entry with a reason. The entry and its constraints stay on record. */
  public ScheduleEntry removeEntry(
      UUID entryId, String reason, long expectedVersion, CallContext ctx) {
    if (reason == null || reason.isBlank()) {
      throw new InvalidRequestException("A reason is required to remove an entry");
    }
    return store.write(
        ctx.timeout(),
        () -> {
          var entry = store.loadEntry(entryId);
          var schedule = store.loadForUpdate(entry.getScheduleId(), expectedVersion);
          schedule.requireAcceptsEntries();
          var from = entry.cancel(reason.trim());
          store.saveEntry(entry);
          store.compactSequence(schedule.getId());
          schedule.touch();
          store.save(schedule);
          recorder.entryChanged(entry, from, ctx.actorId(), reason.trim());
          return entry;
        });
  }

  public ScheduleEntry getEntry(UUID entryId, Duration timeout) {
    return store.read(timeout, () -> store.loadEntry(entryId));
  }

  /** Materializes an entry query inside one read transaction. */
  public List<ScheduleEntry> queryEntries(EntryFilter filter, Duration timeout) {
    return store.read(
        timeout,
        () -> {
          var result = new ArrayList<ScheduleEntry>();
          store.queryEntries(filter).forEach(result::add);
          return result;
        });
  }

  public List<ScheduleEntry> entriesReadyForDispatch(UUID siteId, Duration timeout) {
    return store.read(timeout, () -> entryRepository.findReadyForDispatch(siteId));
  }

  private static void requireWithinHorizon(ProductionSchedule schedule, TimeWindow window) {
    if (!schedule.horizon().contains(window)) {
      throw new InvalidRequestException(
          "Entry outside horizon",
          "Planned window ["
              + window.start()
              + ", "
              + window.end()
              + ") is outside the schedule horizon");
    }
  }
}
