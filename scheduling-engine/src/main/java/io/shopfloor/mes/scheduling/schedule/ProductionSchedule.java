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
import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate root for a production schedule. Entries, constraints and transition records hang off
 * it by id; any change to them bumps this row's {@code version} through {@link #touch()} so that
 * concurrent writers of the same aggregate conflict at flush time.
 */
@Entity
@Table(name = "production_schedules")
public class ProductionSchedule {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "schedule_number", nullable = false, unique = true, length = 50)
  private String scheduleNumber;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "site_id", nullable = false)
  private UUID siteId;

  @Column(name = "horizon_start", nullable = false)
  private Instant horizonStart;

  @Column(name = "horizon_end", nullable = false)
  private Instant horizonEnd;

  @Enumerated(EnumType.STRING)
  @Column(name = "state", nullable = false, length = 20)
  private ScheduleState state;

  @Column(name = "state_changed_at", nullable = false)
  private Instant stateChangedAt;

  @Column(name = "state_changed_by")
  private UUID stateChangedBy;

  @Column(name = "planned_by", nullable = false)
  private UUID plannedBy;

  @Column(name = "locked", nullable = false)
  private boolean locked;

  @Column(name = "feasible")
  private Boolean feasible;

  @Column(name = "feasibility_notes", columnDefinition = "TEXT")
  private String feasibilityNotes;

  @Column(name = "feasibility_checked_at")
  private Instant feasibilityCheckedAt;

  @Column(name = "next_entry_number", nullable = false)
  private int nextEntryNumber;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ProductionSchedule() {}

  public ProductionSchedule(
      String scheduleNumber,
      String name,
      String description,
      UUID siteId,
      TimeWindow horizon,
      UUID plannedBy) {
    this.scheduleNumber = scheduleNumber;
    this.name = name;
    this.description = description;
    this.siteId = siteId;
    this.horizonStart = horizon.start();
    this.horizonEnd = horizon.end();
    this.plannedBy = plannedBy;
    this.state = ScheduleState.FORECAST;
    this.nextEntryNumber = 1;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
    this.stateChangedAt = this.createdAt;
    this.stateChangedBy = plannedBy;
  }

  /** Header edits are only allowed while the schedule is still a forecast and not locked. */
  public void update(String name, String description, TimeWindow horizon) {
    requireEditable("update");
    this.name = name;
    this.description = description;
    this.horizonStart = horizon.start();
    this.horizonEnd = horizon.end();
    touch();
  }

  /**
   * Moves the schedule along its state graph. The caller is responsible for rule checks (release
   * gate) and for writing the transition record.
   */
  public ScheduleState transitionTo(ScheduleState target, UUID actorId) {
    if (!state.canTransitionTo(target)) {
      throw new IllegalStateTransitionException("schedule", state, target);
    }
    var previous = this.state;
    this.state = target;
    this.stateChangedAt = Instant.now();
    this.stateChangedBy = actorId;
    if (target == ScheduleState.RELEASED) {
      this.locked = true;
    }
    touch();
    return previous;
  }

  /** Reserves the next entry number; entry numbers record creation order within the schedule. */
  public int allocateEntryNumber() {
    requireAcceptsEntries();
    return nextEntryNumber++;
  }

  public void requireAcceptsEntries() {
    if (locked) {
      throw new InvalidStateException(
          "Schedule locked", "Cannot change entries of locked schedule " + scheduleNumber);
    }
    if (state != ScheduleState.FORECAST) {
      throw new InvalidStateException(
          "Schedule not editable", "Cannot change entries of schedule in state " + state, state);
    }
  }

  /** Soft delete: the schedule stays for traceability but no longer accepts edits. */
  public void lock() {
    this.locked = true;
    touch();
  }

  public void recordFeasibility(boolean feasible, String notes) {
    this.feasible = feasible;
    this.feasibilityNotes = notes;
    this.feasibilityCheckedAt = Instant.now();
    touch();
  }

  /** Marks the aggregate dirty so the optimistic version is checked and bumped on flush. */
  public void touch() {
    this.updatedAt = Instant.now();
  }

  public TimeWindow horizon() {
    return new TimeWindow(horizonStart, horizonEnd);
  }

  private void requireEditable(String action) {
    if (state != ScheduleState.FORECAST || locked) {
      throw new InvalidStateException(
          "Schedule not editable",
          "Cannot " + action + " schedule " + scheduleNumber + " in state " + state
              + (locked ? " (locked)" : ""),
          state);
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getScheduleNumber() {
    return scheduleNumber;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public UUID getSiteId() {
    return siteId;
  }

  public Instant getHorizonStart() {
    return horizonStart;
  }

  public Instant getHorizonEnd() {
    return horizonEnd;
  }

  public ScheduleState getState() {
    return state;
  }

  public Instant getStateChangedAt() {
    return stateChangedAt;
  }

  public UUID getStateChangedBy() {
    return stateChangedBy;
  }

  public UUID getPlannedBy() {
    return plannedBy;
  }

  public boolean isLocked() {
    return locked;
  }

  public Boolean getFeasible() {
    return feasible;
  }

  public String getFeasibilityNotes() {
    return feasibilityNotes;
  }

  public Instant getFeasibilityCheckedAt() {
    return feasibilityCheckedAt;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
