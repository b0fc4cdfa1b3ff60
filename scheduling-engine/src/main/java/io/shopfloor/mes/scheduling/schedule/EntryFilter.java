package io.shopfloor.mes.scheduling.schedule;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Filter for {@link ScheduleStore#queryEntries(EntryFilter)}. Null fields mean "no filter on this
 * field"; an empty state set means every state.
 */
public record EntryFilter(
    UUID scheduleId, UUID siteId, Set<EntryState> states, LocalDate dueOnOrBefore) {

  public EntryFilter {
    states =
        states == null || states.isEmpty()
            ? EnumSet.allOf(EntryState.class)
            : Set.copyOf(states);
  }

  public static EntryFilter forSchedule(UUID scheduleId) {
    return new EntryFilter(scheduleId, null, null, null);
  }

  public static EntryFilter forSchedule(UUID scheduleId, Set<EntryState> states) {
    return new EntryFilter(scheduleId, null, states, null);
  }
}
