package io.shopfloor.mes.scheduling.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.shopfloor.mes.scheduling.TestEntities;
import io.shopfloor.mes.scheduling.config.SchedulingProperties;
import io.shopfloor.mes.scheduling.exception.PersistenceTimeoutException;
import io.shopfloor.mes.scheduling.exception.ResourceNotFoundException;
import io.shopfloor.mes.scheduling.exception.VersionConflictException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.SliceImpl;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;

@ExtendWith(MockitoExtension.class)
class ScheduleStoreTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(2);

  @Mock private ProductionScheduleRepository scheduleRepository;
  @Mock private ScheduleEntryRepository entryRepository;
  @Mock private PlatformTransactionManager transactionManager;

  private ScheduleStore store;

  @BeforeEach
  void setUp() {
    var defaults = SchedulingProperties.defaults();
    var properties =
        new SchedulingProperties(
            defaults.defaultTimeout(),
            new SchedulingProperties.Query(2),
            defaults.constraints(),
            defaults.dispatch(),
            defaults.collaborators());
    store = new ScheduleStore(scheduleRepository, entryRepository, transactionManager, properties);
  }

  @Test
  void load_missingSchedule_throwsNotFound() {
    var id = UUID.randomUUID();
    when(scheduleRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> store.load(id)).isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void loadForUpdate_staleVersion_throwsConflict() {
    var schedule = TestEntities.schedule();
    TestEntities.setVersion(schedule, 4);
    when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));

    assertThatThrownBy(() -> store.loadForUpdate(schedule.getId(), 3))
        .isInstanceOf(VersionConflictException.class)
        .satisfies(
            e -> assertThat(((VersionConflictException) e).getScheduleId())
                .isEqualTo(schedule.getId()));
  }

  @Test
  void loadForUpdate_currentVersion_returnsSchedule() {
    var schedule = TestEntities.schedule();
    TestEntities.setVersion(schedule, 4);
    when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));

    assertThat(store.loadForUpdate(schedule.getId(), 4)).isSameAs(schedule);
  }

  @Test
  void write_translatesOptimisticLockFailure() {
    var scheduleId = UUID.randomUUID();

    assertThatThrownBy(
            () ->
                store.write(
                    TIMEOUT,
                    () -> {
                      throw new ObjectOptimisticLockingFailureException(
                          ProductionSchedule.class, scheduleId);
                    }))
        .isInstanceOf(VersionConflictException.class)
        .satisfies(
            e -> assertThat(((VersionConflictException) e).getScheduleId()).isEqualTo(scheduleId));
  }

  @Test
  void write_translatesTimeout() {
    assertThatThrownBy(
            () ->
                store.write(
                    TIMEOUT,
                    () -> {
                      throw new TransactionTimedOutException("deadline passed");
                    }))
        .isInstanceOf(PersistenceTimeoutException.class);
  }

  @Test
  void queryEntries_pagesLazilyAndRestarts() {
    var schedule = TestEntities.schedule();
    var all =
        List.of(
            TestEntities.entry(schedule, 1, 1, TestEntities.DAY_ONE),
            TestEntities.entry(schedule, 2, 1, TestEntities.DAY_ONE),
            TestEntities.entry(schedule, 3, 1, TestEntities.DAY_ONE));
    when(entryRepository.findSlice(eq(schedule.getId()), any(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              Pageable pageable = invocation.getArgument(4);
              int from = (int) pageable.getOffset();
              int to = Math.min(from + pageable.getPageSize(), all.size());
              return new SliceImpl<>(all.subList(from, to), pageable, to < all.size());
            });

    var entries = store.queryEntries(EntryFilter.forSchedule(schedule.getId()));
    var first = new ArrayList<ScheduleEntry>();
    entries.forEach(first::add);
    var second = new ArrayList<ScheduleEntry>();
    entries.forEach(second::add);

    assertThat(first).containsExactlyElementsOf(all);
    assertThat(second).containsExactlyElementsOf(all);
    verify(entryRepository, times(4)).findSlice(eq(schedule.getId()), any(), any(), any(), any());
  }
}
