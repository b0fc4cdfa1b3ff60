package io.shopfloor.mes.scheduling.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shopfloor.mes.scheduling.TestEntities;
import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import io.shopfloor.mes.scheduling.integration.availability.NoOpAvailabilitySource;
import io.shopfloor.mes.scheduling.integration.identity.UuidIdentityResolver;
import io.shopfloor.mes.scheduling.integration.workorder.NoOpWorkOrderCreator;
import io.shopfloor.mes.scheduling.integration.workorder.WorkOrderRequest;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class IntegrationDefaultsTest {

  @Test
  void noOpAvailability_reportsUnconstrained() {
    var result =
        new NoOpAvailabilitySource().available("WC-1", TestEntities.HORIZON, BigDecimal.TEN);

    assertThat(result.unconstrained()).isTrue();
    assertThat(result.targetId()).isEqualTo("WC-1");
  }

  @Test
  void noOpWorkOrderCreator_derivesIdFromEntry() {
    var entryId = UUID.randomUUID();
    var request =
        new WorkOrderRequest(
            entryId,
            UUID.randomUUID(),
            "PART-1",
            "OP-10",
            BigDecimal.TEN,
            "EA",
            TestEntities.DAY_ONE);

    var result = new NoOpWorkOrderCreator().create(request);

    assertThat(result.success()).isTrue();
    assertThat(result.workOrderId()).isEqualTo("WO-" + entryId);
  }

  @Test
  void uuidResolver_acceptsCanonicalUuid() {
    var resolver = new UuidIdentityResolver();

    assertThat(resolver.resolve(TestEntities.ACTOR.toString())).isEqualTo(TestEntities.ACTOR);
  }

  @Test
  void uuidResolver_rejectsDisplayNamesAndShortForms() {
    var resolver = new UuidIdentityResolver();

    assertThatThrownBy(() -> resolver.resolve("planner.alice"))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> resolver.resolve("1-1-1-1-1"))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> resolver.resolve(" "))
        .isInstanceOf(InvalidRequestException.class);
  }
}
