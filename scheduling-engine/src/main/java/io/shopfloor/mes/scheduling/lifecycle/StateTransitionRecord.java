package io.shopfloor.mes.scheduling.lifecycle;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of one accepted state change. Written in the same transaction as the change
 * itself; no setters.
 */
@Entity
@Table(name = "state_transitions")
public class StateTransitionRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "schedule_id", nullable = false)
  private UUID scheduleId;

  @Enumerated(EnumType.STRING)
  @Column(name = "entity_type", nullable = false, length = 20)
  private EntityKind entityType;

  @Column(name = "entity_id", nullable = false)
  private UUID entityId;

  @Column(name = "from_state", nullable = false, length = 20)
  private String fromState;

  @Column(name = "to_state", nullable = false, length = 20)
  private String toState;

  @Column(name = "actor_id", nullable = false)
  private UUID actorId;

  @Column(name = "reason", columnDefinition = "TEXT")
  private String reason;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected StateTransitionRecord() {}

  public StateTransitionRecord(
      UUID scheduleId,
      EntityKind entityType,
      UUID entityId,
      Enum<?> fromState,
      Enum<?> toState,
      UUID actorId,
      String reason) {
    this.scheduleId = scheduleId;
    this.entityType = entityType;
    this.entityId = entityId;
    this.fromState = fromState.name();
    this.toState = toState.name();
    this.actorId = actorId;
    this.reason = reason;
    this.occurredAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  public EntityKind getEntityType() {
    return entityType;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public String getFromState() {
    return fromState;
  }

  public String getToState() {
    return toState;
  }

  public UUID getActorId() {
    return actorId;
  }

  public String getReason() {
    return reason;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
