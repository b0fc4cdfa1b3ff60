package io.shopfloor.mes.scheduling.integration.availability;

import io.shopfloor.mes.scheduling.schedule.TimeWindow;
import java.math.BigDecimal;

/**
 * Port to the plant's capacity and inventory data. Resource ids (work centers, machines) and
 * material ids share one id space; implementations decide which is which.
 */
public interface AvailabilitySource {

  String sourceId();

  /**
   * Reports how much of {@code targetId} is available inside {@code window}. Implementations may
   * block; callers wrap the call in a timeout.
   */
  AvailabilityResult available(String targetId, TimeWindow window, BigDecimal requiredQuantity);
}
