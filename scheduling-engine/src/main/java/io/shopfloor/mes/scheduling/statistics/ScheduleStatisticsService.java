package io.shopfloor.mes.scheduling.statistics;

import io.shopfloor.mes.scheduling.constraint.ScheduleConstraintRepository;
import io.shopfloor.mes.scheduling.lifecycle.StateTransitionRecordRepository;
import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionScheduleRepository;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntryRepository;
import io.shopfloor.mes.scheduling.schedule.ScheduleState;
import io.shopfloor.mes.scheduling.schedule.ScheduleStore;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class ScheduleStatisticsService {

  private final ScheduleStore store;
  private final ProductionScheduleRepository scheduleRepository;
  private final ScheduleEntryRepository entryRepository;
  private final ScheduleConstraintRepository constraintRepository;
  private final StateTransitionRecordRepository transitionRepository;

  public ScheduleStatisticsService(
      ScheduleStore store,
      ProductionScheduleRepository scheduleRepository,
      ScheduleEntryRepository entryRepository,
      ScheduleConstraintRepository constraintRepository,
      StateTransitionRecordRepository transitionRepository) {
    this.store = store;
    this.scheduleRepository = scheduleRepository;
    this.entryRepository = entryRepository;
    this.constraintRepository = constraintRepository;
    this.transitionRepository = transitionRepository;
  }

  public ScheduleStatistics statistics(Duration timeout) {
    return store.read(
        timeout,
        () -> {
          var schedulesByState =
              toCounts(scheduleRepository.countByState(), ScheduleState.class);
          var entriesByState = toCounts(entryRepository.countByState(), EntryState.class);
          long dispatched =
              entriesByState.get(EntryState.DISPATCHED)
                  + entriesByState.get(EntryState.IN_PROGRESS)
                  + entriesByState.get(EntryState.COMPLETED);
          long pending =
              entriesByState.get(EntryState.PLANNED) + entriesByState.get(EntryState.READY);
          return new ScheduleStatistics(
              sum(schedulesByState),
              schedulesByState,
              sum(entriesByState),
              entriesByState,
              dispatched,
              entriesByState.get(EntryState.CANCELLED),
              pending,
              constraintRepository.count(),
              constraintRepository.countByViolatedTrue(),
              constraintRepository.countByOverriddenTrue(),
              transitionRepository.count());
        });
  }

  /** Turns [state, count] rows into a map with every state present. */
  static <E extends Enum<E>> Map<E, Long> toCounts(List<Object[]> rows, Class<E> type) {
    var counts = new EnumMap<E, Long>(type);
    for (var constant : type.getEnumConstants()) {
      counts.put(constant, 0L);
    }
    for (var row : rows) {
      counts.put(type.cast(row[0]), ((Number) row[1]).longValue());
    }
    return counts;
  }

  private static long sum(Map<?, Long> counts) {
    return counts.values().stream().mapToLong(Long::longValue).sum();
  }
}
