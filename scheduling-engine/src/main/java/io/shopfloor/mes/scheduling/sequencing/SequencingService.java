package io.shopfloor.mes.scheduling.sequencing;

import io.shopfloor.mes.scheduling.constraint.FeasibilityService;
import io.shopfloor.mes.scheduling.engine.CallContext;
import io.shopfloor.mes.scheduling.exception.InvalidRequestException;
import io.shopfloor.mes.scheduling.exception.InvalidStateException;
import io.shopfloor.mes.scheduling.schedule.ProductionSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntryRepository;
import io.shopfloor.mes.scheduling.schedule.ScheduleStore;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Runs the {@link EntrySequencer} against stored schedules. Sequencing never changes state. */
@Service
public class SequencingService {

  private static final Logger log = LoggerFactory.getLogger(SequencingService.class);

  private final ScheduleStore store;
  private final ScheduleEntryRepository entryRepository;
  private final FeasibilityService feasibilityService;

  public SequencingService(
      ScheduleStore store,
      ScheduleEntryRepository entryRepository,
      FeasibilityService feasibilityService) {
    this.store = store;
    this.entryRepository = entryRepository;
    this.feasibilityService = feasibilityService;
  }

  public SequencePreview previewSequence(
      UUID scheduleId, SequencingStrategy strategy, Duration timeout) {
    requireStrategy(strategy);
    return store.read(
        timeout,
        () -> {
          var schedule = store.load(scheduleId);
          var entries = entryRepository.findByScheduleId(scheduleId);
          var sequence = EntrySequencer.plan(scheduleId, entries, strategy);
          return new SequencePreview(sequence, feasibilityService.evaluate(schedule, timeout));
        });
  }

  /**
   * Renumbers pending entries under the caller's expected schedule version. A concurrent writer of
   * the same schedule makes one of the two calls fail with a version conflict.
   */
  public SequencingResult resequence(
      UUID scheduleId, SequencingStrategy strategy, long expectedVersion, CallContext ctx) {
    requireStrategy(strategy);
    return store.write(
        ctx.timeout(),
        () -> {
          var schedule = store.loadForUpdate(scheduleId, expectedVersion);
          requireSequenceable(schedule);
          var entries = entryRepository.findByScheduleId(scheduleId);
          var result = EntrySequencer.plan(scheduleId, entries, strategy);
          var changed = EntrySequencer.apply(entries, result);
          changed.forEach(store::saveEntry);
          schedule.touch();
          store.save(schedule);
          log.info(
              "Resequenced schedule {} by {}: {} of {} entries moved",
              schedule.getScheduleNumber(),
              strategy,
              changed.size(),
              entries.size());
          return result;
        });
  }

  private static void requireStrategy(SequencingStrategy strategy) {
    if (strategy == null) {
      throw new InvalidRequestException("A sequencing strategy is required");
    }
  }

  private static void requireSequenceable(ProductionSchedule schedule) {
    if (schedule.getState().isTerminal()) {
      throw new InvalidStateException(
          "Schedule closed",
          "Cannot resequence schedule " + schedule.getScheduleNumber() + " in state "
              + schedule.getState());
    }
  }
}
