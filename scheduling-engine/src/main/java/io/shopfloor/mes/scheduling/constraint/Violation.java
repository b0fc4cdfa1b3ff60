package io.shopfloor.mes.scheduling.constraint;

import java.util.UUID;

/**
 * Result of evaluating one constraint. Violations are values, never exceptions.
 *
 * @param overridden a planner accepted the violation; it no longer blocks release or dispatch
 */
public record Violation(
    UUID constraintId,
    UUID entryId,
    ConstraintType type,
    ConstraintSeverity severity,
    String targetId,
    String message,
    boolean overridden) {

  /** Unresolved critical violations block release and dispatch. */
  public boolean blocking() {
    return severity == ConstraintSeverity.CRITICAL && !overridden;
  }
}
