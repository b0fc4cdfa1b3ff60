package io.shopfloor.mes.scheduling.dispatch;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Proof that an entry was dispatched. The unique index on {@code entry_id} guarantees at most one
 * record, and therefore one work order, per entry.
 */
@Entity
@Table(name = "dispatch_records")
public class DispatchRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "entry_id", nullable = false, unique = true, updatable = false)
  private UUID entryId;

  @Column(name = "schedule_id", nullable = false, updatable = false)
  private UUID scheduleId;

  @Column(name = "work_order_id", nullable = false, length = 100, updatable = false)
  private String workOrderId;

  @Column(name = "actor_id", nullable = false, updatable = false)
  private UUID actorId;

  @Column(name = "dispatched_at", nullable = false, updatable = false)
  private Instant dispatchedAt;

  protected DispatchRecord() {}

  public DispatchRecord(UUID entryId, UUID scheduleId, String workOrderId, UUID actorId) {
    this.entryId = entryId;
    this.scheduleId = scheduleId;
    this.workOrderId = workOrderId;
    this.actorId = actorId;
    this.dispatchedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getEntryId() {
    return entryId;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  public String getWorkOrderId() {
    return workOrderId;
  }

  public UUID getActorId() {
    return actorId;
  }

  public Instant getDispatchedAt() {
    return dispatchedAt;
  }
}
