package io.shopfloor.mes.scheduling.integration.workorder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Everything the execution system needs to open a work order for one entry. The entry id doubles
 * as the idempotency key on the creator side.
 */
public record WorkOrderRequest(
    UUID entryId,
    UUID scheduleId,
    String partRef,
    String operationRef,
    BigDecimal plannedQuantity,
    String unitOfMeasure,
    LocalDate dueDate) {}
