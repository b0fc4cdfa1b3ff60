package io.shopfloor.mes.scheduling.engine;

import io.shopfloor.mes.scheduling.config.SchedulingProperties;
import io.shopfloor.mes.scheduling.integration.identity.IdentityResolver;
import java.time.Duration;
import org.springframework.stereotype.Component;

/** Resolves the caller's principal and attaches the time budget for the call. */
@Component
public class CallContextFactory {

  private final IdentityResolver identityResolver;
  private final Duration defaultTimeout;

  public CallContextFactory(IdentityResolver identityResolver, SchedulingProperties properties) {
    this.identityResolver = identityResolver;
    this.defaultTimeout = properties.defaultTimeout();
  }

  public CallContext forPrincipal(String principal) {
    return forPrincipal(principal, defaultTimeout);
  }

  public CallContext forPrincipal(String principal, Duration timeout) {
    return new CallContext(
        identityResolver.resolve(principal), timeout != null ? timeout : defaultTimeout);
  }
}
