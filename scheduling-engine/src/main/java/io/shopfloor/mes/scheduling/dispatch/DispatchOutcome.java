package io.shopfloor.mes.scheduling.dispatch;

import java.util.UUID;

/** Per-entry result inside a {@link DispatchBatchResult}. */
public record DispatchOutcome(UUID entryId, Status status, String workOrderId, String failure) {

  public enum Status {
    DISPATCHED,
    ALREADY_DISPATCHED,
    FAILED,
    SKIPPED
  }

  public static DispatchOutcome dispatched(UUID entryId, String workOrderId) {
    return new DispatchOutcome(entryId, Status.DISPATCHED, workOrderId, null);
  }

  public static DispatchOutcome alreadyDispatched(UUID entryId, String workOrderId) {
    return new DispatchOutcome(entryId, Status.ALREADY_DISPATCHED, workOrderId, null);
  }

  public static DispatchOutcome failed(UUID entryId, String failure) {
    return new DispatchOutcome(entryId, Status.FAILED, null, failure);
  }

  public static DispatchOutcome skipped(UUID entryId) {
    return new DispatchOutcome(entryId, Status.SKIPPED, null, "batch cancelled");
  }
}
