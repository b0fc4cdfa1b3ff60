package io.shopfloor.mes.scheduling.schedule;

import java.util.Map;
import java.util.Set;

/** Production schedule lifecycle. The adjacency table is the single source of legal moves. */
public enum ScheduleState {
  FORECAST,
  RELEASED,
  DISPATCHED,
  RUNNING,
  COMPLETED,
  CLOSED,
  CANCELLED;

  private static final Map<ScheduleState, Set<ScheduleState>> ALLOWED_TRANSITIONS =
      Map.of(
          FORECAST, Set.of(RELEASED, CANCELLED),
          RELEASED, Set.of(DISPATCHED, CANCELLED),
          DISPATCHED, Set.of(RUNNING, CANCELLED),
          RUNNING, Set.of(COMPLETED, CANCELLED),
          COMPLETED, Set.of(CLOSED),
          CLOSED, Set.of(),
          CANCELLED, Set.of());

  /** States from which entries may be dispatched. */
  private static final Set<ScheduleState> DISPATCHABLE = Set.of(RELEASED, DISPATCHED, RUNNING);

  public Set<ScheduleState> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(ScheduleState target) {
    return allowedTransitions().contains(target);
  }

  /**
   * RELEASED to DISPATCHED is only ever taken by the dispatcher; a client asking for it directly is
   * treated like an off-graph request.
   */
  public boolean canBeRequestedByClient(ScheduleState target) {
    return canTransitionTo(target) && !(this == RELEASED && target == DISPATCHED);
  }

  public boolean acceptsDispatch() {
    return DISPATCHABLE.contains(this);
  }

  public boolean isTerminal() {
    return this == CLOSED || this == CANCELLED;
  }
}
