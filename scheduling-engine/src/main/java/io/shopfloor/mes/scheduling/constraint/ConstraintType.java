package io.shopfloor.mes.scheduling.constraint;

public enum ConstraintType {
  /** Machine or work-center time inside the entry's window. */
  CAPACITY,
  /** Material lot quantity available by the entry's due date. */
  MATERIAL
}
