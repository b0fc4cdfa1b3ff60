package io.shopfloor.mes.scheduling.schedule;

import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import java.time.Duration;
import java.time.Instant;

/** Half-open interval {@code [start, end)} used for horizons and capacity windows. */
public record TimeWindow(Instant start, Instant end) {

  public TimeWindow {
    if (start == null || end == null) {
      throw new InvalidRequestException("Time window requires both start and end");
    }
    if (!end.isAfter(start)) {
      throw new InvalidRequestException("Time window end " + end + " must be after start " + start);
    }
  }

  public Duration length() {
    return Duration.between(start, end);
  }

  public boolean contains(TimeWindow other) {
    return !other.start.isBefore(start) && !other.end.isAfter(end);
  }
}
