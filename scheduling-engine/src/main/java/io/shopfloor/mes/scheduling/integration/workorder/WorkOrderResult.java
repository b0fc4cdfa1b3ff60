package io.shopfloor.mes.scheduling.integration.workorder;

public record WorkOrderResult(boolean success, String workOrderId, String errorMessage) {

  public static WorkOrderResult created(String workOrderId) {
    return new WorkOrderResult(true, workOrderId, null);
  }

  public static WorkOrderResult failed(String errorMessage) {
    return new WorkOrderResult(false, null, errorMessage);
  }
}
