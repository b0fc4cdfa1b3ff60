package io.shopfloor.mes.scheduling.integration.availability;

import java.math.BigDecimal;

/**
 * Answer from an {@link AvailabilitySource}.
 *
 * @param targetId resource or material the answer is about
 * @param available free quantity in the requested window; {@code null} when the source does not
 *     constrain the target
 * @param capacity total capacity of a resource in the window, or {@code null} for materials and
 *     unconstrained targets
 */
public record AvailabilityResult(String targetId, BigDecimal available, BigDecimal capacity) {

  public static AvailabilityResult unconstrained(String targetId) {
    return new AvailabilityResult(targetId, null, null);
  }

  public static AvailabilityResult ofCapacity(
      String targetId, BigDecimal available, BigDecimal capacity) {
    return new AvailabilityResult(targetId, available, capacity);
  }

  public static AvailabilityResult ofStock(String targetId, BigDecimal available) {
    return new AvailabilityResult(targetId, available, null);
  }

  public boolean unconstrained() {
    return available == null;
  }
}
