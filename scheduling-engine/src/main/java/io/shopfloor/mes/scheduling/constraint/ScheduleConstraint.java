package io.shopfloor.mes.scheduling.constraint;

import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import io.shopfloor.mes.scheduling.schedule.TimeWindow;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A capacity or material requirement of one entry, with its last evaluation and any override.
 * Constraints are never deleted; resolution is recorded instead.
 */
@Entity
@Table(name = "schedule_constraints")
public class ScheduleConstraint {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "entry_id", nullable = false)
  private UUID entryId;

  @Column(name = "schedule_id", nullable = false)
  private UUID scheduleId;

  @Enumerated(EnumType.STRING)
  @Column(name = "constraint_type", nullable = false, length = 20)
  private ConstraintType type;

  @Column(name = "target_id", nullable = false, length = 100)
  private String targetId;

  @Column(name = "required_quantity", nullable = false, precision = 19, scale = 4)
  private BigDecimal requiredQuantity;

  @Column(name = "window_start")
  private Instant windowStart;

  @Column(name = "window_end")
  private Instant windowEnd;

  @Column(name = "violated", nullable = false)
  private boolean violated;

  @Enumerated(EnumType.STRING)
  @Column(name = "severity", length = 20)
  private ConstraintSeverity severity;

  @Column(name = "message", columnDefinition = "TEXT")
  private String message;

  @Column(name = "evaluated_at")
  private Instant evaluatedAt;

  @Column(name = "overridden", nullable = false)
  private boolean overridden;

  @Column(name = "override_reason", columnDefinition = "TEXT")
  private String overrideReason;

  @Column(name = "overridden_by")
  private UUID overriddenBy;

  @Column(name = "overridden_at")
  private Instant overriddenAt;

  @Column(name = "resolved_at")
  private Instant resolvedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ScheduleConstraint() {}

  public ScheduleConstraint(
      UUID entryId,
      UUID scheduleId,
      ConstraintType type,
      String targetId,
      BigDecimal requiredQuantity,
      TimeWindow explicitWindow) {
    if (requiredQuantity == null || requiredQuantity.signum() <= 0) {
      throw new InvalidRequestException("Required quantity must be positive");
    }
    this.entryId = entryId;
    this.scheduleId = scheduleId;
    this.type = type;
    this.targetId = targetId;
    this.requiredQuantity = requiredQuantity;
    if (explicitWindow != null) {
      this.windowStart = explicitWindow.start();
      this.windowEnd = explicitWindow.end();
    }
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /** Stores the outcome of an evaluation; {@code null} means the constraint is satisfied. */
  public void recordEvaluation(Violation violation) {
    var now = Instant.now();
    if (violation == null) {
      if (violated && !overridden) {
        this.resolvedAt = now;
      }
      this.violated = false;
      this.severity = null;
      this.message = null;
    } else {
      this.violated = true;
      this.severity = violation.severity();
      this.message = violation.message();
      if (!overridden) {
        this.resolvedAt = null;
      }
    }
    this.evaluatedAt = now;
    this.updatedAt = now;
  }

  /** Accepts the current violation. The override survives later re-evaluations. */
  public void override(String reason, UUID actorId) {
    if (overridden) {
      throw new InvalidStateException(
          "Constraint already overridden", "Constraint " + id + " is already overridden");
    }
    var now = Instant.now();
    this.overridden = true;
    this.overrideReason = reason;
    this.overriddenBy = actorId;
    this.overriddenAt = now;
    this.resolvedAt = now;
    this.updatedAt = now;
  }

  /**
   * Changes the requirement. The last evaluation and any override were made against the old
   * requirement, so both are cleared; the next evaluation starts fresh.
   */
  public void revise(BigDecimal requiredQuantity, TimeWindow explicitWindow) {
    if (requiredQuantity == null || requiredQuantity.signum() <= 0) {
      throw new InvalidRequestException("Required quantity must be positive");
    }
    this.requiredQuantity = requiredQuantity;
    this.windowStart = explicitWindow != null ? explicitWindow.start() : null;
    this.windowEnd = explicitWindow != null ? explicitWindow.end() : null;
    this.violated = false;
    this.severity = null;
    this.message = null;
    this.evaluatedAt = null;
    this.overridden = false;
    this.overrideReason = null;
    this.overriddenBy = null;
    this.overriddenAt = null;
    this.resolvedAt = null;
    this.updatedAt = Instant.now();
  }

  /** The explicit evaluation window, or {@code null} to use the entry's planned window. */
  public TimeWindow explicitWindow() {
    return windowStart != null && windowEnd != null
        ? new TimeWindow(windowStart, windowEnd)
        : null;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getEntryId() {
    return entryId;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  public ConstraintType getType() {
    return type;
  }

  public String getTargetId() {
    return targetId;
  }

  public BigDecimal getRequiredQuantity() {
    return requiredQuantity;
  }

  public Instant getWindowStart() {
    return windowStart;
  }

  public Instant getWindowEnd() {
    return windowEnd;
  }

  public boolean isViolated() {
    return violated;
  }

  public ConstraintSeverity getSeverity() {
    return severity;
  }

  public String getMessage() {
    return message;
  }

  public Instant getEvaluatedAt() {
    return evaluatedAt;
  }

  public boolean isOverridden() {
    return overridden;
  }

  public String getOverrideReason() {
    return overrideReason;
  }

  public UUID getOverriddenBy() {
    return overriddenBy;
  }

  public Instant getOverriddenAt() {
    return overriddenAt;
  }

  public Instant getResolvedAt() {
    return resolvedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
