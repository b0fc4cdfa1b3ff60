package io.shopfloor.mes.scheduling.constraint;

import io.shopfloor.mes.scheduling.audit.AuditEventBuilder;
import io.shopfloor.mes.scheduling.audit.AuditService;
import io.shopfloor.mes.scheduling.engine.CallContext;
import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import io.shopfloor.mes.scheduling.exception.ResourceNotFoundException;
import io.shopfloor.mes.scheduling.schedule.ScheduleStore;
import io.shopfloor.mes.scheduling.schedule.TimeWindow;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Adds, revises, lists and overrides the constraints of individual entries. */
@Service
public class ConstraintService {

  private static final Logger log = LoggerFactory.getLogger(ConstraintService.class);

  private final ScheduleStore store;
  private final ScheduleConstraintRepository constraintRepository;
  private final ConstraintEvaluator evaluator;
  private final AuditService auditService;

  public ConstraintService(
      ScheduleStore store,
      ScheduleConstraintRepository constraintRepository,
      ConstraintEvaluator evaluator,
      AuditService auditService) {
    this.store = store;
    this.constraintRepository = constraintRepository;
    this.evaluator = evaluator;
    this.auditService = auditService;
  }

  public ScheduleConstraint addConstraint(
      UUID entryId,
      ConstraintType type,
      String targetId,
      BigDecimal requiredQuantity,
      TimeWindow explicitWindow,
      long expectedVersion,
      CallContext ctx) {
    if (type == null) {
      throw new InvalidRequestException("Constraint type is required");
    }
    if (targetId == null || targetId.isBlank()) {
      throw new InvalidRequestException("Constraint target id is required");
    }
    return store.write(
        ctx.timeout(),
        () -> {
          var entry = store.loadEntry(entryId);
          var schedule = store.loadForUpdate(entry.getScheduleId(), expectedVersion);
          schedule.requireAcceptsEntries();
          if (!entry.getState().isPending()) {
            throw new InvalidStateException(
                "Entry not editable",
                "Cannot add constraints to entry " + entryId + " in state " + entry.getState());
          }
          var constraint =
              constraintRepository.save(
                  new ScheduleConstraint(
                      entryId,
                      schedule.getId(),
                      type,
                      targetId.trim(),
                      requiredQuantity,
                      explicitWindow));
          schedule.touch();
          store.save(schedule);
          log.info(
              "Added {} constraint on {} to entry {} of schedule {}",
              type,
              constraint.getTargetId(),
              entryId,
              schedule.getScheduleNumber());
          return constraint;
        });
  }

  /**
   * Changes the required quantity and explicit window of a constraint on a pending entry of an
   * unlocked FORECAST schedule. An earlier override does not carry over to the new requirement.
   */
  public ScheduleConstraint updateConstraint(
      UUID constraintId,
      BigDecimal requiredQuantity,
      TimeWindow explicitWindow,
      long expectedVersion,
      CallContext ctx) {
    return store.write(
        ctx.timeout(),
        () -> {
          var constraint =
              constraintRepository
                  .findById(constraintId)
                  .orElseThrow(() -> new ResourceNotFoundException("Constraint", constraintId));
          var schedule = store.loadForUpdate(constraint.getScheduleId(), expectedVersion);
          schedule.requireAcceptsEntries();
          var entry = store.loadEntry(constraint.getEntryId());
          if (!entry.getState().isPending()) {
            throw new InvalidStateException(
                "Entry not editable",
                "Cannot change constraints of entry " + entry.getId() + " in state "
                    + entry.getState());
          }
          var wasOverridden = constraint.isOverridden();
          var previousQuantity = constraint.getRequiredQuantity();
          constraint.revise(requiredQuantity, explicitWindow);
          constraintRepository.save(constraint);
          schedule.touch();
          store.save(schedule);

          var details = new LinkedHashMap<String, Object>();
          details.put("previous_quantity", previousQuantity.toPlainString());
          details.put("required_quantity", requiredQuantity.toPlainString());
          details.put("override_cleared", wasOverridden);
          auditService.log(
              AuditEventBuilder.builder()
                  .eventType("constraint.updated")
                  .entityType("constraint")
                  .entityId(constraintId)
                  .scheduleId(schedule.getId())
                  .actorId(ctx.actorId())
                  .details(details)
                  .build());
          return constraint;
        });
  }

  /** Constraints of an entry, violated first. */
  public List<ScheduleConstraint> listConstraints(UUID entryId, Duration timeout) {
    return store.read(
        timeout,
        () -> {
          store.loadEntry(entryId);
          return constraintRepository.findByEntryIdViolatedFirst(entryId);
        });
  }

  /**
   * Accepts a currently violated constraint so that it no longer blocks release or dispatch. The
   * constraint is evaluated live; a constraint that is satisfied has nothing to override. Rejected
   * overrides are audited in their own transaction.
   */
  public ScheduleConstraint overrideConstraint(
      UUID constraintId, String reason, long expectedVersion, CallContext ctx) {
    if (reason == null || reason.isBlank()) {
      auditRejectedOverride(constraintId, null, ctx, "A reason is required");
      throw new InvalidRequestException("Override reason required", "A reason is required");
    }
    return store.write(
        ctx.timeout(),
        () -> {
          var constraint =
              constraintRepository
                  .findById(constraintId)
                  .orElseThrow(() -> new ResourceNotFoundException("Constraint", constraintId));
          var schedule = store.loadForUpdate(constraint.getScheduleId(), expectedVersion);
          var entry = store.loadEntry(constraint.getEntryId());
          if (!entry.getState().isPending()) {
            auditRejectedOverride(
                constraintId, schedule.getId(), ctx, "Entry is " + entry.getState());
            throw new InvalidStateException(
                "Nothing to override",
                "Entry " + entry.getId() + " is " + entry.getState() + "; nothing to override");
          }
          if (constraint.isOverridden()) {
            auditRejectedOverride(constraintId, schedule.getId(), ctx, "Already overridden");
            throw new InvalidStateException(
                "Constraint already overridden",
                "Constraint " + constraintId + " is already overridden");
          }

          var violation =
              evaluator.evaluate(schedule, entry, List.of(constraint), ctx.timeout()).stream()
                  .findFirst()
                  .orElse(null);
          constraint.recordEvaluation(violation);
          if (violation == null) {
            auditRejectedOverride(constraintId, schedule.getId(), ctx, "Constraint is satisfied");
            throw new InvalidStateException(
                "Nothing to override", "Constraint " + constraintId + " is not violated");
          }

          constraint.override(reason.trim(), ctx.actorId());
          schedule.touch();
          store.save(schedule);

          var details = new LinkedHashMap<String, Object>();
          details.put("reason", reason.trim());
          details.put("severity", violation.severity().name());
          details.put("target_id", constraint.getTargetId());
          details.put("message", violation.message());
          auditService.log(
              AuditEventBuilder.builder()
                  .eventType("constraint.overridden")
                  .entityType("constraint")
                  .entityId(constraintId)
                  .scheduleId(schedule.getId())
                  .actorId(ctx.actorId())
                  .details(details)
                  .build());
          log.info(
              "Constraint {} on {} overridden by {}: {}",
              constraintId,
              constraint.getTargetId(),
              ctx.actorId(),
              reason.trim());
          return constraint;
        });
  }

  private void auditRejectedOverride(
      UUID constraintId, UUID scheduleId, CallContext ctx, String rejection) {
    log.warn("Rejected override of constraint {}: {}", constraintId, rejection);
    auditService.logIndependently(
        AuditEventBuilder.builder()
            .eventType("constraint.override_rejected")
            .entityType("constraint")
            .entityId(constraintId)
            .scheduleId(scheduleId)
            .actorId(ctx.actorId())
            .details(Map.of("rejection", rejection))
            .build());
  }
}
