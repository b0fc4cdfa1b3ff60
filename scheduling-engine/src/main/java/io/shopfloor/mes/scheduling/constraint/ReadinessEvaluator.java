package io.shopfloor.mes.scheduling.constraint;

import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import java.util.ArrayList;
import java.util.List;

/**
 * The one readiness gate shared by promotion (PLANNED to READY) and dispatch. An entry is ready
 * when it is still pending and none of its violations is blocking.
 */
public final class ReadinessEvaluator {

  private ReadinessEvaluator() {}

  public static EntryReadiness computeReadiness(ScheduleEntry entry, List<Violation> violations) {
    var reasons = new ArrayList<String>();
    if (!entry.getState().isPending()) {
      reasons.add("Entry " + entry.getEntryNumber() + " is " + entry.getState());
    }
    for (var violation : violations) {
      if (violation.blocking()) {
        reasons.add(violation.message());
      }
    }
    return reasons.isEmpty()
        ? EntryReadiness.ready(entry.getId())
        : EntryReadiness.blocked(entry.getId(), reasons);
  }
}
