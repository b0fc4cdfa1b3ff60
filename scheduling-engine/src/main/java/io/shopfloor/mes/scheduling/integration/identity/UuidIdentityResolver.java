package io.shopfloor.mes.scheduling.integration.identity;

import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import java.util.UUID;

/**
 * Accepts only principals that already are canonical UUIDs. Display names and other free-form
 * identifiers are rejected rather than mapped.
 */
public class UuidIdentityResolver implements IdentityResolver {

  @Override
  public UUID resolve(String principal) {
    if (principal == null || principal.isBlank()) {
      throw new InvalidRequestException("Missing actor", "A principal is required");
    }
    try {
      var id = UUID.fromString(principal.trim());
      if (!id.toString().equalsIgnoreCase(principal.trim())) {
        throw new InvalidRequestException(
            "Invalid actor", "Principal '" + principal + "' is not a canonical UUID");
      }
      return id;
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException(
          "Invalid actor", "Principal '" + principal + "' is not a canonical UUID");
    }
  }
}
