package io.shopfloor.mes.scheduling.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AuditEventBuilderTest {

  private final UUID scheduleId = UUID.randomUUID();

  @Test
  void actorGiven_defaultsToUserFromEngine() {
    var actor = UUID.randomUUID();

    var record =
        AuditEventBuilder.builder()
            .eventType("schedule.locked")
            .entityType("schedule")
            .entityId(scheduleId)
            .scheduleId(scheduleId)
            .actorId(actor)
            .details(Map.of("reason", "end of week"))
            .build();

    assertThat(record.actorId()).isEqualTo(actor);
    assertThat(record.actorType()).isEqualTo("USER");
    assertThat(record.source()).isEqualTo("ENGINE");
    assertThat(record.details()).containsEntry("reason", "end of week");
  }

  @Test
  void noActor_defaultsToSystem() {
    var record =
        AuditEventBuilder.builder()
            .eventType("schedule.state_changed")
            .entityType("schedule")
            .entityId(scheduleId)
            .build();

    assertThat(record.actorType()).isEqualTo("SYSTEM");
    assertThat(record.details()).isNull();
  }

  @Test
  void explicitActorTypeAndSource_arePreserved() {
    var record =
        AuditEventBuilder.builder()
            .eventType("entry.dispatch_failed")
            .entityType("entry")
            .entityId(UUID.randomUUID())
            .actorType("INTEGRATION")
            .source("MES")
            .build();

    assertThat(record.actorType()).isEqualTo("INTEGRATION");
    assertThat(record.source()).isEqualTo("MES");
  }

  @Test
  void missingEntityId_isRejected() {
    var builder = AuditEventBuilder.builder().eventType("schedule.created").entityType("schedule");

    assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
  }
}
