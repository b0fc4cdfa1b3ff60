package io.shopfloor.mes.scheduling.config;

import io.shopfloor.mes.scheduling.integration.availability.AvailabilitySource;
import io.shopfloor.mes.scheduling.integration.availability.NoOpAvailabilitySource;
import io.shopfloor.mes.scheduling.integration.identity.IdentityResolver;
import io.shopfloor.mes.scheduling.integration.identity.UuidIdentityResolver;
import io.shopfloor.mes.scheduling.integration.workorder.NoOpWorkOrderCreator;
import io.shopfloor.mes.scheduling.integration.workorder.WorkOrderCreator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Fallback adapters, replaced by any application-provided bean of the same port. */
@Configuration
public class IntegrationDefaultsConfig {

  @Bean
  @ConditionalOnMissingBean
  AvailabilitySource availabilitySource() {
    return new NoOpAvailabilitySource();
  }

  @Bean
  @ConditionalOnMissingBean
  WorkOrderCreator workOrderCreator() {
    return new NoOpWorkOrderCreator();
  }

  @Bean
  @ConditionalOnMissingBean
  IdentityResolver identityResolver() {
    return new UuidIdentityResolver();
  }
}
