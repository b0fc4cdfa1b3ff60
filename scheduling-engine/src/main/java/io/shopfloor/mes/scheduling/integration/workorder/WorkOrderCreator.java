package io.shopfloor.mes.scheduling.integration.workorder;

/**
 * Port to the execution system that turns a dispatched entry into a work order.
 *
 * <p>A returned failure result is a business rejection and is not retried. A thrown exception is
 * treated as a transport error and may be retried by the caller.
 */
public interface WorkOrderCreator {

  String creatorId();

  WorkOrderResult create(WorkOrderRequest request);
}
