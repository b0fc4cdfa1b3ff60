package io.shopfloor.mes.scheduling.schedule;

import io.shopfloor.mes.scheduling.exception.IllegalStateTransitionException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "schedule_entries")
public class ScheduleEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "schedule_id", nullable = false)
  private UUID scheduleId;

  @Column(name = "entry_number", nullable = false)
  private int entryNumber;

  @Column(name = "part_ref", nullable = false, length = 100)
  private String partRef;

  @Column(name = "operation_ref", nullable = false, length = 100)
  private String operationRef;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "planned_quantity", nullable = false, precision = 19, scale = 4)
  private BigDecimal plannedQuantity;

  @Column(name = "unit_of_measure", nullable = false, length = 20)
  private String unitOfMeasure;

  @Column(name = "priority", nullable = false)
  private int priority;

  @Column(name = "due_date", nullable = false)
  private LocalDate dueDate;

  @Column(name = "planned_start", nullable = false)
  private Instant plannedStart;

  @Column(name = "planned_end", nullable = false)
  private Instant plannedEnd;

  @Column(name = "sequence_position")
  private Integer sequencePosition;

  @Enumerated(EnumType.STRING)
  @Column(name = "state", nullable = false, length = 20)
  private EntryState state;

  @Column(name = "state_changed_at", nullable = false)
  private Instant stateChangedAt;

  @Column(name = "cancelled_reason", columnDefinition = "TEXT")
  private String cancelledReason;

  @Column(name = "work_order_id", length = 100)
  private String workOrderId;

  @Column(name = "dispatched_at")
  private Instant dispatchedAt;

  @Column(name = "dispatched_by")
  private UUID dispatchedBy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ScheduleEntry() {}

  public ScheduleEntry(
      UUID scheduleId,
      int entryNumber,
      String partRef,
      String operationRef,
      String description,
      BigDecimal plannedQuantity,
      String unitOfMeasure,
      int priority,
      LocalDate dueDate,
      TimeWindow plannedWindow) {
    this.scheduleId = scheduleId;
    this.entryNumber = entryNumber;
    this.partRef = partRef;
    this.operationRef = operationRef;
    this.description = description;
    this.plannedQuantity = plannedQuantity;
    this.unitOfMeasure = unitOfMeasure != null ? unitOfMeasure : "EA";
    this.priority = priority;
    this.dueDate = dueDate;
    this.plannedStart = plannedWindow.start();
    this.plannedEnd = plannedWindow.end();
    this.state = EntryState.PLANNED;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
    this.stateChangedAt = this.createdAt;
  }

  /** Updates planning fields. Only pending entries can be edited. */
  public void update(
      String description,
      BigDecimal plannedQuantity,
      int priority,
      LocalDate dueDate,
      TimeWindow plannedWindow) {
    if (!state.isPending()) {
      throw new InvalidStateException(
          "Entry not editable",
          "Cannot update entry " + entryNumber + " in state " + state,
          state);
    }
    this.description = description;
    this.plannedQuantity = plannedQuantity;
    this.priority = priority;
    this.dueDate = dueDate;
    this.plannedStart = plannedWindow.start();
    this.plannedEnd = plannedWindow.end();
    this.updatedAt = Instant.now();
  }

  // --- Lifecycle transition methods ---

  /** Moves the entry along its state graph and returns the previous state. */
  public EntryState transitionTo(EntryState target) {
    if (!state.canTransitionTo(target)) {
      throw new IllegalStateTransitionException("entry", state, target);
    }
    var previous = this.state;
    this.state = target;
    this.stateChangedAt = Instant.now();
    this.updatedAt = this.stateChangedAt;
    if (target == EntryState.CANCELLED) {
      this.sequencePosition = null;
    }
    return previous;
  }

  public EntryState cancel(String reason) {
    var previous = transitionTo(EntryState.CANCELLED);
    this.cancelledReason = reason;
    return previous;
  }

  public void markDispatched(String workOrderId, UUID actorId, Instant dispatchedAt) {
    transitionTo(EntryState.DISPATCHED);
    this.workOrderId = workOrderId;
    this.dispatchedBy = actorId;
    this.dispatchedAt = dispatchedAt;
  }

  /** Sequencer-only: repositions the entry without touching its state. */
  public void assignSequencePosition(Integer position) {
    this.sequencePosition = position;
    this.updatedAt = Instant.now();
  }

  public TimeWindow plannedWindow() {
    return new TimeWindow(plannedStart, plannedEnd);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  public int getEntryNumber() {
    return entryNumber;
  }

  public String getPartRef() {
    return partRef;
  }

  public String getOperationRef() {
    return operationRef;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getPlannedQuantity() {
    return plannedQuantity;
  }

  public String getUnitOfMeasure() {
    return unitOfMeasure;
  }

  public int getPriority() {
    return priority;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public Instant getPlannedStart() {
    return plannedStart;
  }

  public Instant getPlannedEnd() {
    return plannedEnd;
  }

  public Integer getSequencePosition() {
    return sequencePosition;
  }

  public EntryState getState() {
    return state;
  }

  public Instant getStateChangedAt() {
    return stateChangedAt;
  }

  public String getCancelledReason() {
    return cancelledReason;
  }

  public String getWorkOrderId() {
    return workOrderId;
  }

  public Instant getDispatchedAt() {
    return dispatchedAt;
  }

  public UUID getDispatchedBy() {
    return dispatchedBy;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
