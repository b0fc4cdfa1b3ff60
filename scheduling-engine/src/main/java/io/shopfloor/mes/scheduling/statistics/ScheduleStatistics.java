package io.shopfloor.mes.scheduling.statistics;

import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ScheduleState;
import java.util.Map;

/**
 * Engine-wide counters.
 *
 * @param dispatchedEntries entries that reached DISPATCHED or beyond
 * @param pendingEntries PLANNED and READY entries
 */
public record ScheduleStatistics(
    long totalSchedules,
    Map<ScheduleState, Long> schedulesByState,
    long totalEntries,
    Map<EntryState, Long> entriesByState,
    long dispatchedEntries,
    long cancelledEntries,
    long pendingEntries,
    long totalConstraints,
    long violatedConstraints,
    long overriddenConstraints,
    long stateTransitions) {

  public ScheduleStatistics {
    schedulesByState = Map.copyOf(schedulesByState);
    entriesByState = Map.copyOf(entriesByState);
  }
}
