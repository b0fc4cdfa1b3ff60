package io.shopfloor.mes.scheduling.lifecycle;

/** What a {@link StateTransitionRecord} is about. */
public enum EntityKind {
  SCHEDULE,
  ENTRY
}
