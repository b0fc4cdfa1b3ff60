package io.shopfloor.mes.scheduling.sequencing;

import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import java.util.Comparator;

/** Orderings for pending entries. Both end with creation order, so ties are stable. */
public enum SequencingStrategy {
  /** Higher priority first, then earlier due date. */
  PRIORITY(
      Comparator.comparingInt(ScheduleEntry::getPriority)
          .reversed()
          .thenComparing(ScheduleEntry::getDueDate)),

  /** Earliest due date first, then higher priority. */
  EDD(
      Comparator.comparing(ScheduleEntry::getDueDate)
          .thenComparing(Comparator.comparingInt(ScheduleEntry::getPriority).reversed()));

  private final Comparator<ScheduleEntry> comparator;

  SequencingStrategy(Comparator<ScheduleEntry> primary) {
    this.comparator = primary.thenComparingInt(ScheduleEntry::getEntryNumber);
  }

  public Comparator<ScheduleEntry> comparator() {
    return comparator;
  }
}
