package io.shopfloor.mes.scheduling.dispatch;

import io.shopfloor.mes.scheduling.audit.AuditEventBuilder;
import io.shopfloor.mes.scheduling.audit.AuditService;
import io.shopfloor.mes.scheduling.config.SchedulingProperties;
import io.shopfloor.mes.scheduling.constraint.FeasibilityService;
import io.shopfloor.mes.scheduling.constraint.Violation;
import io.shopfloor.mes.scheduling.engine.CallContext;
import io.shopfloor.mes.scheduling.exception.CollaboratorTimeoutException;
import io.shopfloor.mes.scheduling.exception.ConstraintViolatedAtDispatchException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import io.shopfloor.mes.scheduling.exception.VersionConflictException;
import io.shopfloor.mes.scheduling.exception.WorkOrderCreationFailedException;
import io.shopfloor.mes.scheduling.integration.CollaboratorInvoker;
import io.shopfloor.mes.scheduling.integration.workorder.WorkOrderCreator;
import io.shopfloor.mes.scheduling.integration.workorder.WorkOrderRequest;
import io.shopfloor.mes.scheduling.integration.workorder.WorkOrderResult;
import io.shopfloor.mes.scheduling.lifecycle.TransitionRecorder;
import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionScheduleRepository;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntryRepository;
import io.shopfloor.mes.scheduling.schedule.ScheduleState;
import io.shopfloor.mes.scheduling.schedule.ScheduleStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.web.ErrorResponseException;

/**
 * Turns READY entries into work orders.
 *
 * <p>A dispatch runs in three steps: a read-only check (existing record, preconditions, live
 * constraint evaluation), the work order call outside any transaction, and a commit that inserts
 * the {@link DispatchRecord}, moves the entry to DISPATCHED and, if the schedule is still RELEASED,
 * moves it to DISPATCHED by compare-and-swap. The unique index on the record's entry id decides
 * concurrent dispatches of the same entry; the loser returns the winner's record.
 */
@Service
public class DispatchService {

  private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

  static final String WORK_ORDER_CREATOR = "WorkOrderCreator";

  private final ScheduleStore store;
  private final ProductionScheduleRepository scheduleRepository;
  private final ScheduleEntryRepository entryRepository;
  private final DispatchRecordRepository dispatchRecordRepository;
  private final FeasibilityService feasibilityService;
  private final TransitionRecorder recorder;
  private final WorkOrderCreator workOrderCreator;
  private final CollaboratorInvoker invoker;
  private final AuditService auditService;
  private final Executor dispatchExecutor;
  private final int workOrderAttempts;
  private final Duration retryBackoff;
  private final int batchParallelism;

  public DispatchService(
      ScheduleStore store,
      ProductionScheduleRepository scheduleRepository,
      ScheduleEntryRepository entryRepository,
      DispatchRecordRepository dispatchRecordRepository,
      FeasibilityService feasibilityService,
      TransitionRecorder recorder,
      WorkOrderCreator workOrderCreator,
      CollaboratorInvoker invoker,
      AuditService auditService,
      @Qualifier("dispatchExecutor") Executor dispatchExecutor,
      SchedulingProperties properties) {
    this.store = store;
    this.scheduleRepository = scheduleRepository;
    this.entryRepository = entryRepository;
    this.dispatchRecordRepository = dispatchRecordRepository;
    this.feasibilityService = feasibilityService;
    this.recorder = recorder;
    this.workOrderCreator = workOrderCreator;
    this.invoker = invoker;
    this.auditService = auditService;
    this.dispatchExecutor = dispatchExecutor;
    this.workOrderAttempts = properties.dispatch().workOrderAttempts();
    this.retryBackoff = properties.dispatch().retryBackoff();
    this.batchParallelism = properties.dispatch().batchParallelism();
  }

  /**
   * Dispatches one entry. Idempotent: an entry that already has a dispatch record returns that
   * record and the work order creator is not called again.
   */
  public DispatchRecord dispatch(UUID entryId, CallContext ctx) {
    return attempt(entryId, ctx, true).record();
  }

  /**
   * Dispatches the READY entries of a schedule in sequence order, {@code batch-parallelism}
   * entries per wave. Failures are reported per entry and never abort the batch; records already
   * committed stay committed. {@code cancelled} is polled between waves and skips what is left.
   */
  public DispatchBatchResult dispatchAll(
      UUID scheduleId, CallContext ctx, BooleanSupplier cancelled) {
    var ready =
        store.read(
            ctx.timeout(),
            () -> {
              var schedule = store.load(scheduleId);
              requireAcceptsDispatch(schedule.getState(), scheduleId);
              return entryRepository
                  .findByScheduleIdAndStates(scheduleId, List.of(EntryState.READY))
                  .stream()
                  .map(ScheduleEntry::getId)
                  .toList();
            });

    var outcomes = new LinkedHashMap<UUID, DispatchOutcome>();
    for (int start = 0; start < ready.size(); start += batchParallelism) {
      if (cancelled != null && cancelled.getAsBoolean()) {
        log.info(
            "Dispatch of schedule {} cancelled after {} of {} entries",
            scheduleId,
            start,
            ready.size());
        for (var skipped : ready.subList(start, ready.size())) {
          outcomes.put(skipped, DispatchOutcome.skipped(skipped));
        }
        break;
      }
      var wave = ready.subList(start, Math.min(start + batchParallelism, ready.size()));
      if (wave.size() == 1) {
        var entryId = wave.get(0);
        outcomes.put(entryId, outcomeOf(entryId, ctx));
      } else {
        var futures = new ArrayList<CompletableFuture<DispatchOutcome>>();
        for (var entryId : wave) {
          futures.add(
              CompletableFuture.supplyAsync(() -> outcomeOf(entryId, ctx), dispatchExecutor));
        }
        for (int i = 0; i < wave.size(); i++) {
          outcomes.put(wave.get(i), futures.get(i).join());
        }
      }
    }

    var result = new DispatchBatchResult(scheduleId, new ArrayList<>(outcomes.values()));
    if (result.count(DispatchOutcome.Status.DISPATCHED) > 0) {
      compactAfterBatch(scheduleId, ctx);
    }
    log.info(
        "Dispatch of schedule {} completed: {} dispatched, {} already dispatched, {} failed, {}"
            + " skipped",
        scheduleId,
        result.count(DispatchOutcome.Status.DISPATCHED),
        result.count(DispatchOutcome.Status.ALREADY_DISPATCHED),
        result.count(DispatchOutcome.Status.FAILED),
        result.count(DispatchOutcome.Status.SKIPPED));
    return result;
  }

  public List<DispatchRecord> dispatchRecords(UUID scheduleId, Duration timeout) {
    return store.read(
        timeout, () -> dispatchRecordRepository.findByScheduleIdOrderByDispatchedAtAsc(scheduleId));
  }

  private DispatchOutcome outcomeOf(UUID entryId, CallContext ctx) {
    try {
      var attempt = attempt(entryId, ctx, false);
      return attempt.created()
          ? DispatchOutcome.dispatched(entryId, attempt.record().getWorkOrderId())
          : DispatchOutcome.alreadyDispatched(entryId, attempt.record().getWorkOrderId());
    } catch (ErrorResponseException e) {
      log.warn("Dispatch of entry {} failed: {}", entryId, e.getBody().getDetail());
      return DispatchOutcome.failed(entryId, e.getBody().getDetail());
    } catch (RuntimeException e) {
      log.error("Dispatch of entry {} failed unexpectedly", entryId, e);
      return DispatchOutcome.failed(entryId, e.getMessage());
    }
  }

  /**
   * @param compact whether the commit also renumbers the pending entries left behind; a batch
   *     does that once at the end instead, so parallel dispatches do not bump each other's entries
   */
  private DispatchAttempt attempt(UUID entryId, CallContext ctx, boolean compact) {
    var prepared = prepare(entryId, ctx);
    if (prepared.existing() != null) {
      log.debug(
          "Entry {} already dispatched as {}", entryId, prepared.existing().getWorkOrderId());
      return new DispatchAttempt(prepared.existing(), false);
    }

    var workOrderId = createWorkOrder(prepared.request(), ctx);
    try {
      var record = commit(prepared.request(), workOrderId, ctx, compact);
      log.info("Dispatched entry {} as work order {}", entryId, workOrderId);
      return new DispatchAttempt(record, true);
    } catch (DataIntegrityViolationException e) {
      var winner =
          store.read(ctx.timeout(), () -> dispatchRecordRepository.findByEntryId(entryId));
      if (winner.isEmpty()) {
        throw e;
      }
      log.info(
          "Entry {} was dispatched concurrently as {}; discarding work order {}",
          entryId,
          winner.get().getWorkOrderId(),
          workOrderId);
      return new DispatchAttempt(winner.get(), false);
    }
  }

  private Prepared prepare(UUID entryId, CallContext ctx) {
    return store.read(
        ctx.timeout(),
        () -> {
          var existing = dispatchRecordRepository.findByEntryId(entryId);
          if (existing.isPresent()) {
            return new Prepared(existing.get(), null);
          }
          var entry = store.loadEntry(entryId);
          var schedule = store.load(entry.getScheduleId());
          requirePending(entry);
          requireAcceptsDispatch(schedule.getState(), schedule.getId());

          var blocking =
              feasibilityService.evaluateEntry(schedule, entry, ctx.timeout()).stream()
                  .filter(Violation::blocking)
                  .toList();
          if (!blocking.isEmpty()) {
            auditDispatchFailure(entry, ctx, "unresolved critical violations");
            throw new ConstraintViolatedAtDispatchException(entryId, blocking);
          }
          return new Prepared(
              null,
              new WorkOrderRequest(
                  entryId,
                  schedule.getId(),
                  entry.getPartRef(),
                  entry.getOperationRef(),
                  entry.getPlannedQuantity(),
                  entry.getUnitOfMeasure(),
                  entry.getDueDate()));
        });
  }

  /**
   * Calls the creator, retrying thrown errors up to the configured attempt count. A failure result
   * is a rejection and is not retried. All attempts share the caller's time budget.
   */
  private String createWorkOrder(WorkOrderRequest request, CallContext ctx) {
    var deadline = Instant.now().plus(ctx.timeout());
    RuntimeException lastError = null;
    for (int attempt = 1; attempt <= workOrderAttempts; attempt++) {
      var remaining = Duration.between(Instant.now(), deadline);
      if (remaining.isNegative() || remaining.isZero()) {
        throw new CollaboratorTimeoutException(WORK_ORDER_CREATOR, ctx.timeout(), lastError);
      }
      WorkOrderResult result;
      try {
        result =
            invoker.call(WORK_ORDER_CREATOR, remaining, () -> workOrderCreator.create(request));
      } catch (CollaboratorTimeoutException e) {
        throw e;
      } catch (RuntimeException e) {
        lastError = e;
        log.warn(
            "Work order attempt {}/{} for entry {} failed: {}",
            attempt,
            workOrderAttempts,
            request.entryId(),
            e.getMessage());
        if (attempt < workOrderAttempts) {
          pause();
        }
        continue;
      }
      if (result == null
          || !result.success()
          || result.workOrderId() == null
          || result.workOrderId().isBlank()) {
        var reason =
            result != null && result.errorMessage() != null ? result.errorMessage() : "rejected";
        auditDispatchFailure(request.entryId(), request.scheduleId(), ctx, reason);
        throw new WorkOrderCreationFailedException(request.entryId(), reason, null);
      }
      return result.workOrderId();
    }
    var reason = lastError != null ? lastError.getMessage() : "no attempt made";
    auditDispatchFailure(request.entryId(), request.scheduleId(), ctx, reason);
    throw new WorkOrderCreationFailedException(request.entryId(), reason, lastError);
  }

  private DispatchRecord commit(
      WorkOrderRequest request, String workOrderId, CallContext ctx, boolean compact) {
    return store.write(
        ctx.timeout(),
        () -> {
          var record =
              dispatchRecordRepository.saveAndFlush(
                  new DispatchRecord(
                      request.entryId(), request.scheduleId(), workOrderId, ctx.actorId()));

          var entry = store.loadEntry(request.entryId());
          var schedule = store.load(entry.getScheduleId());
          requirePending(entry);
          requireAcceptsDispatch(schedule.getState(), schedule.getId());

          if (entry.getState() == EntryState.PLANNED) {
            var from = entry.transitionTo(EntryState.READY);
            recorder.entryChanged(entry, from, ctx.actorId(), "dispatch");
          }
          entry.markDispatched(workOrderId, ctx.actorId(), record.getDispatchedAt());
          store.saveEntry(entry);
          recorder.entryChanged(entry, EntryState.READY, ctx.actorId(), "dispatch");
          if (compact) {
            store.compactSequence(schedule.getId());
          }

          int swapped =
              scheduleRepository.compareAndSetState(
                  schedule.getId(),
                  ScheduleState.RELEASED,
                  ScheduleState.DISPATCHED,
                  ctx.actorId(),
                  Instant.now());
          if (swapped == 1) {
            recorder.scheduleChanged(
                schedule.getId(),
                ScheduleState.RELEASED,
                ScheduleState.DISPATCHED,
                ctx.actorId(),
                "first dispatch");
          }
          return record;
        });
  }

  /**
   * Entries dispatched out of sequence order keep their positions as anchors, so the pending
   * entries ahead of them move behind. A concurrent resequence already leaves the positions
   * dense, so losing to it is only logged.
   */
  private void compactAfterBatch(UUID scheduleId, CallContext ctx) {
    try {
      store.write(ctx.timeout(), () -> store.compactSequence(scheduleId));
    } catch (VersionConflictException e) {
      log.warn(
          "Positions of schedule {} were rewritten concurrently; keeping the other writer's order",
          scheduleId);
    }
  }

  private static void requirePending(ScheduleEntry entry) {
    if (!entry.getState().isPending()) {
      throw new InvalidStateException(
          "Entry not dispatchable",
          "Entry " + entry.getId() + " is " + entry.getState() + " and cannot be dispatched",
          entry.getState());
    }
  }

  private static void requireAcceptsDispatch(ScheduleState state, UUID scheduleId) {
    if (!state.acceptsDispatch()) {
      throw new InvalidStateException(
          "Schedule not dispatchable",
          "Schedule " + scheduleId + " is " + state + "; only RELEASED, DISPATCHED or RUNNING"
              + " schedules dispatch work",
          state);
    }
  }

  private void pause() {
    try {
      Thread.sleep(retryBackoff.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting to retry work order", e);
    }
  }

  private void auditDispatchFailure(ScheduleEntry entry, CallContext ctx, String reason) {
    auditDispatchFailure(entry.getId(), entry.getScheduleId(), ctx, reason);
  }

  private void auditDispatchFailure(
      UUID entryId, UUID scheduleId, CallContext ctx, String reason) {
    log.warn("Dispatch of entry {} failed: {}", entryId, reason);
    auditService.logIndependently(
        AuditEventBuilder.builder()
            .eventType("entry.dispatch_failed")
            .entityType("entry")
            .entityId(entryId)
            .scheduleId(scheduleId)
            .actorId(ctx.actorId())
            .details(Map.of("reason", reason))
            .build());
  }

  private record Prepared(DispatchRecord existing, WorkOrderRequest request) {}

  private record DispatchAttempt(DispatchRecord record, boolean created) {}
}
