package io.shopfloor.mes.scheduling.dispatch;

import java.util.List;
import java.util.UUID;

/** Outcomes of a batch dispatch, in the order the entries were attempted. */
public record DispatchBatchResult(UUID scheduleId, List<DispatchOutcome> outcomes) {

  public DispatchBatchResult {
    outcomes = List.copyOf(outcomes);
  }

  public long count(DispatchOutcome.Status status) {
    return outcomes.stream().filter(o -> o.status() == status).count();
  }

  public List<DispatchOutcome> failures() {
    return outcomes.stream().filter(o -> o.status() == DispatchOutcome.Status.FAILED).toList();
  }
}
