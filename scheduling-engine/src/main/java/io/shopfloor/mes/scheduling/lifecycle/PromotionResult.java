package io.shopfloor.mes.scheduling.lifecycle;

import io.shopfloor.mes.scheduling.constraint.EntryReadiness;
import java.util.List;
import java.util.UUID;

/** Outcome of promoting PLANNED entries: which moved to READY and why the others did not. */
public record PromotionResult(UUID scheduleId, List<UUID> promoted, List<EntryReadiness> blocked) {

  public PromotionResult {
    promoted = List.copyOf(promoted);
    blocked = List.copyOf(blocked);
  }
}
