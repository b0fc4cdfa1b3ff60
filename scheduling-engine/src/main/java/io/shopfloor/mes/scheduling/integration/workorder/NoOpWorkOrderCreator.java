package io.shopfloor.mes.scheduling.integration.workorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Accepts every request and derives the work order id from the entry id. */
public class NoOpWorkOrderCreator implements WorkOrderCreator {

  private static final Logger log = LoggerFactory.getLogger(NoOpWorkOrderCreator.class);

  @Override
  public String creatorId() {
    return "noop";
  }

  @Override
  public WorkOrderResult create(WorkOrderRequest request) {
    log.info(
        "NoOp work order: would create order for entry {} ({} x {}, due {})",
        request.entryId(),
        request.plannedQuantity(),
        request.partRef(),
        request.dueDate());
    return WorkOrderResult.created("WO-" + request.entryId());
  }
}
