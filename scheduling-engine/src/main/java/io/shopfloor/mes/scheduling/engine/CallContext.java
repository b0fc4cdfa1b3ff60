package io.shopfloor.mes.scheduling.engine;

import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import java.time.Duration;
import java.util.UUID;

/**
 * Per-call context: the canonical actor performing the call and the time budget for every
 * persistence and collaborator call it makes. Built by {@link CallContextFactory}.
 */
public record CallContext(UUID actorId, Duration timeout) {

  public CallContext {
    if (actorId == null) {
      throw new InvalidRequestException("Missing actor", "Every call needs a canonical actor id");
    }
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new InvalidRequestException("Invalid timeout", "Timeout must be positive");
    }
  }
}
