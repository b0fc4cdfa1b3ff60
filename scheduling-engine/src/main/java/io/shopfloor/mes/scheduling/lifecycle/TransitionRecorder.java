package io.shopfloor.mes.scheduling.lifecycle;

import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import io.shopfloor.mes.scheduling.schedule.ScheduleState;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes transition records. Callers run it inside the unit of work that changed the state. */
@Component
public class TransitionRecorder {

  private static final Logger log = LoggerFactory.getLogger(TransitionRecorder.class);

  private final StateTransitionRecordRepository repository;

  public TransitionRecorder(StateTransitionRecordRepository repository) {
    this.repository = repository;
  }

  public StateTransitionRecord scheduleChanged(
      ProductionSchedule schedule, ScheduleState from, UUID actorId, String reason) {
    return scheduleChanged(schedule.getId(), from, schedule.getState(), actorId, reason);
  }

  public StateTransitionRecord scheduleChanged(
      UUID scheduleId, ScheduleState from, ScheduleState to, UUID actorId, String reason) {
    log.info("Schedule {} moved {} -> {} by {}", scheduleId, from, to, actorId);
    return repository.save(
        new StateTransitionRecord(
            scheduleId, EntityKind.SCHEDULE, scheduleId, from, to, actorId, reason));
  }

  public StateTransitionRecord entryChanged(
      ScheduleEntry entry, EntryState from, UUID actorId, String reason) {
    log.debug(
        "Entry {} of schedule {} moved {} -> {}",
        entry.getId(),
        entry.getScheduleId(),
        from,
        entry.getState());
    return repository.save(
        new StateTransitionRecord(
            entry.getScheduleId(),
            EntityKind.ENTRY,
            entry.getId(),
            from,
            entry.getState(),
            actorId,
            reason));
  }
}
