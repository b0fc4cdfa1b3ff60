package io.shopfloor.mes.scheduling.sequencing;

import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Computes dense sequence positions for a schedule's entries.
 *
 * <p>Dispatched, in-progress and completed entries are anchors: they keep their positions. Pending
 * entries are ordered by the strategy and numbered {@code maxAnchor + 1 .. maxAnchor + n}.
 * Cancelled entries lose their position. The computation is deterministic, so running it twice on
 * the same pending set yields the same positions.
 */
public final class EntrySequencer {

  /** The order pending entries hold right now: by position, unpositioned last. */
  static final Comparator<ScheduleEntry> CURRENT_ORDER =
      Comparator.comparing(
              ScheduleEntry::getSequencePosition, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparingInt(ScheduleEntry::getEntryNumber);

  private EntrySequencer() {}

  /** Computes positions without touching the entries. */
  public static SequencingResult plan(
      UUID scheduleId, List<ScheduleEntry> entries, SequencingStrategy strategy) {
    var anchors =
        entries.stream().filter(e -> e.getState().isCommitted()).sorted(CURRENT_ORDER).toList();
    int maxAnchor = maxAnchor(entries);
    var pending =
        entries.stream()
            .filter(e -> e.getState().isPending())
            .sorted(strategy.comparator())
            .toList();

    var placements = new ArrayList<SequencingResult.Placement>();
    int changed = 0;
    for (var anchor : anchors) {
      placements.add(placement(anchor, anchor.getSequencePosition()));
    }
    int next = maxAnchor + 1;
    for (var entry : pending) {
      int position = next++;
      if (!Integer.valueOf(position).equals(entry.getSequencePosition())) {
        changed++;
      }
      placements.add(placement(entry, position));
    }
    for (var entry : entries) {
      if (entry.getState() == EntryState.CANCELLED) {
        if (entry.getSequencePosition() != null) {
          changed++;
        }
        placements.add(placement(entry, null));
      }
    }
    return new SequencingResult(scheduleId, strategy, placements, changed);
  }

  /** Writes the planned positions onto the entries; returns the entries that changed. */
  public static List<ScheduleEntry> apply(List<ScheduleEntry> entries, SequencingResult result) {
    var byId = new HashMap<UUID, ScheduleEntry>();
    entries.forEach(e -> byId.put(e.getId(), e));
    var changed = new ArrayList<ScheduleEntry>();
    for (var placement : result.placements()) {
      var entry = byId.get(placement.entryId());
      if (entry != null && !Objects.equals(entry.getSequencePosition(), placement.position())) {
        entry.assignSequencePosition(placement.position());
        changed.add(entry);
      }
    }
    return changed;
  }

  /**
   * Renumbers pending entries densely after the anchors while keeping their current order. Used
   * when an entry joins or leaves the pending set; returns the entries whose position changed.
   */
  public static List<ScheduleEntry> compact(List<ScheduleEntry> entries) {
    int next = maxAnchor(entries) + 1;
    var changed = new ArrayList<ScheduleEntry>();
    var pending =
        entries.stream().filter(e -> e.getState().isPending()).sorted(CURRENT_ORDER).toList();
    for (var entry : pending) {
      int position = next++;
      if (!Integer.valueOf(position).equals(entry.getSequencePosition())) {
        entry.assignSequencePosition(position);
        changed.add(entry);
      }
    }
    return changed;
  }

  /** Position a newly added entry takes: one past every position held in the schedule. */
  public static int nextPosition(List<ScheduleEntry> entries) {
    return entries.stream()
            .map(ScheduleEntry::getSequencePosition)
            .filter(Objects::nonNull)
            .mapToInt(Integer::intValue)
            .max()
            .orElse(0)
        + 1;
  }

  private static int maxAnchor(List<ScheduleEntry> entries) {
    return entries.stream()
        .filter(e -> e.getState().isCommitted())
        .map(ScheduleEntry::getSequencePosition)
        .filter(Objects::nonNull)
        .mapToInt(Integer::intValue)
        .max()
        .orElse(0);
  }

  private static SequencingResult.Placement placement(ScheduleEntry entry, Integer position) {
    return new SequencingResult.Placement(
        entry.getId(), entry.getEntryNumber(), entry.getState(), position);
  }
}
