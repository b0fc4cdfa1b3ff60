package io.shopfloor.mes.scheduling.integration.availability;

import io.shopfloor.mes.scheduling.schedule.TimeWindow;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reports every resource and material as unconstrained. */
public class NoOpAvailabilitySource implements AvailabilitySource {

  private static final Logger log = LoggerFactory.getLogger(NoOpAvailabilitySource.class);

  @Override
  public String sourceId() {
    return "noop";
  }

  @Override
  public AvailabilityResult available(
      String targetId, TimeWindow window, BigDecimal requiredQuantity) {
    log.debug(
        "NoOp availability: {} treated as unconstrained for {} in [{}, {})",
        targetId,
        requiredQuantity,
        window.start(),
        window.end());
    return AvailabilityResult.unconstrained(targetId);
  }
}
