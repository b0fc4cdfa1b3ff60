package io.shopfloor.mes.scheduling.constraint;

public enum ConstraintSeverity {
  WARNING,
  CRITICAL
}
