package io.shopfloor.mes.scheduling.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService} for recording audit events. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "schedule", "constraint")
 * @param entityId ID of the affected entity (not a FK -- the schedule may be deleted later)
 * @param scheduleId owning schedule, for trail lookups; null when not applicable
 * @param actorId canonical actor id; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: ENGINE or DISPATCH_BATCH
 * @param details key field changes as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID scheduleId,
    UUID actorId,
    String actorType,
    String source,
    Map<String, Object> details) {}
