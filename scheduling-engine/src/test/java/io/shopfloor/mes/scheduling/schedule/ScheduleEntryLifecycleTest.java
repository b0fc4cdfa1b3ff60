package io.shopfloor.mes.scheduling.schedule;

import static io.shopfloor.mes.scheduling.TestEntities.ACTOR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shopfloor.mes.scheduling.TestEntities;
import io.shopfloor.mes.scheduling.exception.IllegalStateTransitionException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ScheduleEntryLifecycleTest {

  private final ProductionSchedule schedule = TestEntities.schedule();

  @Test
  void newEntry_isPlannedWithDefaultUnit() {
    var entry =
        new ScheduleEntry(
            schedule.getId(),
            1,
            "PART-1",
            "OP-10",
            null,
            BigDecimal.ONE,
            null,
            0,
            TestEntities.DAY_ONE,
            TestEntities.HORIZON);

    assertThat(entry.getState()).isEqualTo(EntryState.PLANNED);
    assertThat(entry.getUnitOfMeasure()).isEqualTo("EA");
    assertThat(entry.getSequencePosition()).isNull();
  }

  @Test
  void markDispatched_requiresReady() {
    var entry = TestEntities.entry(schedule, 1, EntryState.PLANNED, 1);

    assertThatThrownBy(() -> entry.markDispatched("WO-1", ACTOR, Instant.now()))
        .isInstanceOf(IllegalStateTransitionException.class);
    assertThat(entry.getWorkOrderId()).isNull();
  }

  @Test
  void markDispatched_recordsWorkOrder() {
    var entry = TestEntities.entry(schedule, 1, EntryState.READY, 1);
    var at = Instant.now();

    entry.markDispatched("WO-1", ACTOR, at);

    assertThat(entry.getState()).isEqualTo(EntryState.DISPATCHED);
    assertThat(entry.getWorkOrderId()).isEqualTo("WO-1");
    assertThat(entry.getDispatchedBy()).isEqualTo(ACTOR);
    assertThat(entry.getDispatchedAt()).isEqualTo(at);
    assertThat(entry.getSequencePosition()).isEqualTo(1);
  }

  @Test
  void cancel_clearsPositionAndKeepsReason() {
    var entry = TestEntities.entry(schedule, 1, EntryState.READY, 4);

    var previous = entry.cancel("customer withdrew order");

    assertThat(previous).isEqualTo(EntryState.READY);
    assertThat(entry.getState()).isEqualTo(EntryState.CANCELLED);
    assertThat(entry.getSequencePosition()).isNull();
    assertThat(entry.getCancelledReason()).isEqualTo("customer withdrew order");
  }

  @Test
  void update_rejectedOnceDispatched() {
    var entry = TestEntities.entry(schedule, 1, EntryState.DISPATCHED, 1);

    assertThatThrownBy(
            () ->
                entry.update(
                    null, BigDecimal.TEN, 5, TestEntities.DAY_ONE, TestEntities.HORIZON))
        .isInstanceOf(InvalidStateException.class);
  }
}
