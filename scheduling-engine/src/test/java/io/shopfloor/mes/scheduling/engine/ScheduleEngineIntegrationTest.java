package io.shopfloor.mes.scheduling.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shopfloor.mes.scheduling.TestcontainersConfiguration;
import io.shopfloor.mes.scheduling.audit.AuditEvent;
import io.shopfloor.mes.scheduling.constraint.ConstraintType;
import io.shopfloor.mes.scheduling.dispatch.DispatchOutcome;
import io.shopfloor.mes.scheduling.exception.IllegalStateTransitionException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import io.shopfloor.mes.scheduling.exception.VersionConflictException;
import io.shopfloor.mes.scheduling.lifecycle.StateTransitionRecord;
import io.shopfloor.mes.scheduling.schedule.EntryFilter;
import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.AddEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleRequests.CreateSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleState;
import io.shopfloor.mes.scheduling.schedule.TimeWindow;
import io.shopfloor.mes.scheduling.sequencing.SequencingStrategy;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
class ScheduleEngineIntegrationTest {

  private static final String PLANNER = "0b7f5a52-8a8e-4c55-9d1e-3f2a6c1d9e01";
  private static final UUID SITE = UUID.fromString("5d0c9a3e-1f0b-4e0e-9a57-4d2e8c6b7a10");
  private static final Instant HORIZON_START = Instant.parse("2026-03-02T00:00:00Z");
  private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);

  @Autowired private ScheduleEngine engine;
  @Autowired private CallContextFactory contexts;

  private CallContext ctx;

  @BeforeEach
  void setUp() {
    ctx = contexts.forPrincipal(PLANNER);
  }

  @Test
  void plansReleasesAndDispatchesSchedule() {
    var schedule = createSchedule();
    var late = addEntry(schedule.getId(), 1, MONDAY.plusDays(4));
    var early = addEntry(schedule.getId(), 1, MONDAY.plusDays(1));
    var urgent = addEntry(schedule.getId(), 9, MONDAY.plusDays(2));
    engine.addConstraint(
        early.getId(),
        ConstraintType.CAPACITY,
        "WC-LATHE-1",
        new BigDecimal("4"),
        null,
        version(schedule.getId()),
        ctx);
    engine.addConstraint(
        urgent.getId(),
        ConstraintType.MATERIAL,
        "MAT-STEEL-40",
        new BigDecimal("120"),
        null,
        version(schedule.getId()),
        ctx);

    var sequence =
        engine.resequence(schedule.getId(), SequencingStrategy.EDD, version(schedule.getId()), ctx);
    assertThat(sequence.orderedEntryIds())
        .containsExactly(early.getId(), urgent.getId(), late.getId());

    var feasibility = engine.checkFeasibility(schedule.getId(), ctx);
    assertThat(feasibility.feasible()).isTrue();

    var released =
        engine.transitionSchedule(
            schedule.getId(), ScheduleState.RELEASED, version(schedule.getId()), "week 10", ctx);
    assertThat(released.getState()).isEqualTo(ScheduleState.RELEASED);

    var promotion = engine.promoteReadyEntries(schedule.getId(), version(schedule.getId()), ctx);
    assertThat(promotion.promoted()).hasSize(3);
    assertThat(engine.entriesReadyForDispatch(SITE, ctx))
        .extracting(ScheduleEntry::getId)
        .contains(early.getId(), urgent.getId(), late.getId());

    var batch = engine.dispatchAll(schedule.getId(), ctx);
    assertThat(batch.count(DispatchOutcome.Status.DISPATCHED)).isEqualTo(3);
    assertThat(batch.outcomes())
        .extracting(DispatchOutcome::entryId)
        .containsExactly(early.getId(), urgent.getId(), late.getId());
    assertThat(engine.getSchedule(schedule.getId(), ctx).getState())
        .isEqualTo(ScheduleState.DISPATCHED);

    var again = engine.dispatch(early.getId(), ctx);
    assertThat(again.getWorkOrderId()).isEqualTo("WO-" + early.getId());
    assertThat(engine.dispatchRecords(schedule.getId(), ctx)).hasSize(3);

    var dispatched =
        engine.queryEntries(
            EntryFilter.forSchedule(schedule.getId(), Set.of(EntryState.DISPATCHED)), ctx);
    assertThat(dispatched).hasSize(3).allMatch(e -> e.getWorkOrderId() != null);

    var history = engine.transitionHistory(schedule.getId(), ctx);
    assertThat(history)
        .filteredOn(r -> r.getEntityId().equals(schedule.getId()))
        .extracting(StateTransitionRecord::getToState)
        .containsExactly("DISPATCHED", "RELEASED");

    var audit = engine.auditTrail(schedule.getId(), PageRequest.of(0, 50));
    assertThat(audit.getContent())
        .extracting(AuditEvent::getEventType)
        .contains("schedule.created", "schedule.state_changed");

    var statistics = engine.statistics(ctx);
    assertThat(statistics.dispatchedEntries()).isGreaterThanOrEqualTo(3);
  }

  @Test
  void clientCannotMoveReleasedScheduleToDispatched() {
    var schedule = createSchedule();
    addEntry(schedule.getId(), 1, MONDAY);
    engine.transitionSchedule(
        schedule.getId(), ScheduleState.RELEASED, version(schedule.getId()), null, ctx);

    assertThatThrownBy(
            () ->
                engine.transitionSchedule(
                    schedule.getId(),
                    ScheduleState.DISPATCHED,
                    version(schedule.getId()),
                    null,
                    ctx))
        .isInstanceOf(IllegalStateTransitionException.class);

    assertThat(engine.getSchedule(schedule.getId(), ctx).getState())
        .isEqualTo(ScheduleState.RELEASED);
    assertThat(engine.auditTrail(schedule.getId(), PageRequest.of(0, 50)).getContent())
        .extracting(AuditEvent::getEventType)
        .contains("schedule.transition_rejected");
  }

  @Test
  void releasingEmptyScheduleIsRefused() {
    var schedule = createSchedule();

    assertThatThrownBy(
            () ->
                engine.transitionSchedule(
                    schedule.getId(), ScheduleState.RELEASED, version(schedule.getId()), null, ctx))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void staleVersionIsRejected() {
    var schedule = createSchedule();
    long stale = version(schedule.getId());
    addEntry(schedule.getId(), 1, MONDAY);

    assertThatThrownBy(
            () -> engine.resequence(schedule.getId(), SequencingStrategy.PRIORITY, stale, ctx))
        .isInstanceOf(VersionConflictException.class);
  }

  @Test
  void concurrentResequencesOfSameVersion_exactlyOneWins() throws Exception {
    var schedule = createSchedule();
    addEntry(schedule.getId(), 1, MONDAY.plusDays(3));
    addEntry(schedule.getId(), 5, MONDAY);
    long expected = version(schedule.getId());
    var start = new CountDownLatch(1);
    Callable<Object> resequence =
        () -> {
          start.await();
          return engine.resequence(schedule.getId(), SequencingStrategy.PRIORITY, expected, ctx);
        };

    var pool = Executors.newFixedThreadPool(2);
    var outcomes = new ArrayList<Object>();
    try {
      List<Future<Object>> futures = List.of(pool.submit(resequence), pool.submit(resequence));
      start.countDown();
      for (var future : futures) {
        try {
          outcomes.add(future.get());
        } catch (ExecutionException e) {
          outcomes.add(e.getCause());
        }
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(outcomes).filteredOn(o -> o instanceof VersionConflictException).hasSize(1);
    assertThat(outcomes).filteredOn(o -> !(o instanceof Throwable)).hasSize(1);
    assertThat(version(schedule.getId())).isEqualTo(expected + 1);
  }

  @Test
  void cancellingScheduleCancelsPendingEntries() {
    var schedule = createSchedule();
    var entry = addEntry(schedule.getId(), 1, MONDAY);

    engine.transitionSchedule(
        schedule.getId(), ScheduleState.CANCELLED, version(schedule.getId()), "demand gone", ctx);

    var cancelled = engine.getEntry(entry.getId(), ctx);
    assertThat(cancelled.getState()).isEqualTo(EntryState.CANCELLED);
    assertThat(cancelled.getSequencePosition()).isNull();
    assertThat(cancelled.getCancelledReason()).isEqualTo("demand gone");
  }

  private ProductionSchedule createSchedule() {
    var horizon = new TimeWindow(HORIZON_START, HORIZON_START.plus(28, ChronoUnit.DAYS));
    return engine.createSchedule(
        new CreateSchedule("PS-" + UUID.randomUUID(), "Week 10", null, SITE, horizon), ctx);
  }

  private ScheduleEntry addEntry(UUID scheduleId, int priority, LocalDate dueDate) {
    var start = dueDate.atStartOfDay(ZoneOffset.UTC).toInstant();
    var request =
        new AddEntry(
            "PART-" + priority,
            "OP-10",
            null,
            new BigDecimal("10"),
            "EA",
            priority,
            dueDate,
            new TimeWindow(start, start.plus(4, ChronoUnit.HOURS)));
    return engine.addEntry(scheduleId, request, version(scheduleId), ctx);
  }

  private long version(UUID scheduleId) {
    return engine.getSchedule(scheduleId, ctx).getVersion();
  }
}
