package io.shopfloor.mes.scheduling.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Builder that constructs an {@link AuditEventRecord}.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}. The engine has no
 * ambient request context, so the actor is always passed in; {@code actorType} defaults to "USER"
 * when an actor is given and "SYSTEM" otherwise, {@code source} defaults to "ENGINE".
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("constraint.overridden")
 *     .entityType("constraint")
 *     .entityId(constraint.getId())
 *     .scheduleId(constraint.getScheduleId())
 *     .actorId(ctx.actorId())
 *     .details(Map.of("reason", reason))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID scheduleId;
  private UUID actorId;
  private String actorType;
  private String source;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder scheduleId(UUID scheduleId) {
    this.scheduleId = scheduleId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null) {
      throw new IllegalStateException("eventType, entityType and entityId are required");
    }
    String resolvedActorType = actorType;
    if (resolvedActorType == null) {
      resolvedActorType = actorId != null ? "USER" : "SYSTEM";
    }
    String resolvedSource = source != null ? source : "ENGINE";
    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        scheduleId,
        actorId,
        resolvedActorType,
        resolvedSource,
        details);
  }
}
