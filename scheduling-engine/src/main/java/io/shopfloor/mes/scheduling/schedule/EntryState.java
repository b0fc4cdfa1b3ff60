package io.shopfloor.mes.scheduling.schedule;

import java.util.Map;
import java.util.Set;

/** Schedule entry lifecycle with validated transitions. */
public enum EntryState {
  PLANNED,
  READY,
  DISPATCHED,
  IN_PROGRESS,
  COMPLETED,
  CANCELLED;

  private static final Map<EntryState, Set<EntryState>> ALLOWED_TRANSITIONS =
      Map.of(
          PLANNED, Set.of(READY, CANCELLED),
          READY, Set.of(DISPATCHED, CANCELLED),
          DISPATCHED, Set.of(IN_PROGRESS, CANCELLED),
          IN_PROGRESS, Set.of(COMPLETED),
          COMPLETED, Set.of(),
          CANCELLED, Set.of());

  public static final Set<EntryState> PENDING = Set.of(PLANNED, READY);

  /** Entries whose material demand still counts against available lots. */
  public static final Set<EntryState> COMMITTED = Set.of(PLANNED, READY, DISPATCHED);

  public Set<EntryState> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(EntryState target) {
    return allowedTransitions().contains(target);
  }

  /** PLANNED or READY: still movable by the sequencer and eligible for dispatch. */
  public boolean isPending() {
    return PENDING.contains(this);
  }

  /** Dispatched or beyond (but not cancelled): keeps its sequence position as an anchor. */
  public boolean isCommitted() {
    return this == DISPATCHED || this == IN_PROGRESS || this == COMPLETED;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }
}
