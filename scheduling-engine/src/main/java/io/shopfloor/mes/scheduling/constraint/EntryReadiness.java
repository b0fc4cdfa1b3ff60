package io.shopfloor.mes.scheduling.constraint;

import java.util.List;
import java.util.UUID;

public record EntryReadiness(UUID entryId, Status status, List<String> reasons) {

  public enum Status {
    READY,
    BLOCKED
  }

  public EntryReadiness {
    reasons = List.copyOf(reasons);
  }

  public static EntryReadiness ready(UUID entryId) {
    return new EntryReadiness(entryId, Status.READY, List.of());
  }

  public static EntryReadiness blocked(UUID entryId, List<String> reasons) {
    return new EntryReadiness(entryId, Status.BLOCKED, reasons);
  }

  public boolean isReady() {
    return status == Status.READY;
  }
}
