package io.shopfloor.mes.scheduling.integration.identity;

import java.util.UUID;

/** Maps a caller principal to the canonical actor id stored on records. */
public interface IdentityResolver {

  /**
   * @throws io.shopfloor.mes.scheduling.exception.InvalidRequestException if the principal cannot
   *     be resolved to a canonical actor
   */
  UUID resolve(String principal);
}
