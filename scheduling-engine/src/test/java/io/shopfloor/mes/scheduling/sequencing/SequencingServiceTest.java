package io.shopfloor.mes.scheduling.sequencing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.shopfloor.mes.scheduling.TestEntities;
import io.shopfloor.mes.scheduling.config.SchedulingProperties;
import io.shopfloor.mes.scheduling.constraint.FeasibilityReport;
import io.shopfloor.mes.scheduling.constraint.FeasibilityService;
import io.shopfloor.mes.scheduling.engine.CallContext;
import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import io.shopfloor.mes.scheduling.exception.VersionConflictException;
import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionScheduleRepository;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntryRepository;
import io.shopfloor.mes.scheduling.schedule.ScheduleState;
import io.shopfloor.mes.scheduling.schedule.ScheduleStore;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class SequencingServiceTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);
  private static final CallContext CTX = new CallContext(TestEntities.ACTOR, TIMEOUT);

  @Mock private ProductionScheduleRepository scheduleRepository;
  @Mock private ScheduleEntryRepository entryRepository;
  @Mock private FeasibilityService feasibilityService;
  @Mock private PlatformTransactionManager transactionManager;

  private SequencingService service;

  @BeforeEach
  void setUp() {
    var store =
        new ScheduleStore(
            scheduleRepository,
            entryRepository,
            transactionManager,
            SchedulingProperties.defaults());
    service = new SequencingService(store, entryRepository, feasibilityService);
  }

  @Test
  void resequence_writesPositionsOfMovedEntriesOnly() {
    var schedule = TestEntities.schedule(ScheduleState.DISPATCHED);
    var dispatched = TestEntities.entry(schedule, 1, EntryState.DISPATCHED, 1);
    var late = TestEntities.entry(schedule, 2, 1, TestEntities.DAY_ONE.plusDays(5));
    var early = TestEntities.entry(schedule, 3, 1, TestEntities.DAY_ONE);
    late.assignSequencePosition(2);
    early.assignSequencePosition(3);
    when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));
    when(entryRepository.findByScheduleId(schedule.getId()))
        .thenReturn(List.of(dispatched, late, early));

    var result = service.resequence(schedule.getId(), SequencingStrategy.EDD, 0, CTX);

    assertThat(result.orderedEntryIds())
        .containsExactly(dispatched.getId(), early.getId(), late.getId());
    assertThat(result.changed()).isEqualTo(2);
    assertThat(dispatched.getSequencePosition()).isEqualTo(1);
    assertThat(early.getSequencePosition()).isEqualTo(2);
    assertThat(late.getSequencePosition()).isEqualTo(3);
    verify(entryRepository, times(2)).save(any());
    verify(scheduleRepository).saveAndFlush(schedule);
  }

  @Test
  void resequence_cancelledSchedule_isRejected() {
    var schedule = TestEntities.schedule(ScheduleState.CANCELLED);
    when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));

    assertThatThrownBy(() -> service.resequence(schedule.getId(), SequencingStrategy.EDD, 0, CTX))
        .isInstanceOf(InvalidStateException.class);
    verify(entryRepository, never()).findByScheduleId(any());
  }

  @Test
  void resequence_staleVersion_isConflict() {
    var schedule = TestEntities.schedule();
    TestEntities.setVersion(schedule, 7);
    when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));

    assertThatThrownBy(
            () -> service.resequence(schedule.getId(), SequencingStrategy.PRIORITY, 6, CTX))
        .isInstanceOf(VersionConflictException.class);
    verify(entryRepository, never()).save(any());
  }

  @Test
  void preview_doesNotTouchEntries() {
    var schedule = TestEntities.schedule();
    var entry = TestEntities.entry(schedule, 1, 1, TestEntities.DAY_ONE);
    when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));
    when(entryRepository.findByScheduleId(schedule.getId())).thenReturn(List.of(entry));
    when(feasibilityService.evaluate(schedule, TIMEOUT))
        .thenReturn(FeasibilityReport.of(schedule.getId(), Map.of()));

    var preview = service.previewSequence(schedule.getId(), SequencingStrategy.PRIORITY, TIMEOUT);

    assertThat(preview.sequence().orderedEntryIds()).containsExactly(entry.getId());
    assertThat(preview.feasibility().feasible()).isTrue();
    assertThat(entry.getSequencePosition()).isNull();
    verify(entryRepository, never()).save(any());
  }

  @Test
  void nullStrategy_isRejectedUpFront() {
    assertThatThrownBy(() -> service.resequence(UUID.randomUUID(), null, 0, CTX))
        .isInstanceOf(InvalidRequestException.class);
    verifyNoInteractions(scheduleRepository, entryRepository);
  }
}
