package io.shopfloor.mes.scheduling.sequencing;

import io.shopfloor.mes.scheduling.schedule.EntryState;
import java.util.List;
import java.util.UUID;

/**
 * Positions computed by the sequencer, in position order. Cancelled entries are listed last with a
 * {@code null} position.
 *
 * @param changed how many entries got a position different from the stored one
 */
public record SequencingResult(
    UUID scheduleId, SequencingStrategy strategy, List<Placement> placements, int changed) {

  public SequencingResult {
    placements = List.copyOf(placements);
  }

  public record Placement(UUID entryId, int entryNumber, EntryState state, Integer position) {}

  public List<UUID> orderedEntryIds() {
    return placements.stream()
        .filter(p -> p.position() != null)
        .map(Placement::entryId)
        .toList();
  }
}
