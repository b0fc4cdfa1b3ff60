package io.shopfloor.mes.scheduling.schedule;

import io.shopfloor.mes.scheduling.config.SchedulingProperties;
import io.shopfloor.mes.scheduling.exception.PersistenceTimeoutException;
import io.shopfloor.mes.scheduling.exception.ResourceNotFoundException;
import io.shopfloor.mes.scheduling.exception.VersionConflictException;
import io.shopfloor.mes.scheduling.sequencing.EntrySequencer;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persistence boundary for the schedule aggregate. Every unit of work runs through {@link
 * #write(Duration, Supplier)} or {@link #read(Duration, Supplier)}, so entries, constraints and
 * transition records written by a caller commit or roll back together with the schedule row.
 *
 * <p>Spring DAO failures are translated here: optimistic-lock failures become {@link
 * VersionConflictException}, timeouts become {@link PersistenceTimeoutException}. Conflicts are
 * never retried.
 */
@Component
public class ScheduleStore {

  private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);

  private final ProductionScheduleRepository scheduleRepository;
  private final ScheduleEntryRepository entryRepository;
  private final PlatformTransactionManager transactionManager;
  private final int pageSize;

  public ScheduleStore(
      ProductionScheduleRepository scheduleRepository,
      ScheduleEntryRepository entryRepository,
      PlatformTransactionManager transactionManager,
      SchedulingProperties properties) {
    this.scheduleRepository = scheduleRepository;
    this.entryRepository = entryRepository;
    this.transactionManager = transactionManager;
    this.pageSize = properties.query().pageSize();
  }

  public ProductionSchedule load(UUID scheduleId) {
    return scheduleRepository
        .findById(scheduleId)
        .orElseThrow(() -> new ResourceNotFoundException("Schedule", scheduleId));
  }

  /** Loads the schedule and checks the caller's view of it is current. */
  public ProductionSchedule loadForUpdate(UUID scheduleId, long expectedVersion) {
    var schedule = load(scheduleId);
    if (schedule.getVersion() != expectedVersion) {
      log.info(
          "Rejecting write to schedule {}: expected version {}, found {}",
          scheduleId,
          expectedVersion,
          schedule.getVersion());
      throw new VersionConflictException(scheduleId, expectedVersion, schedule.getVersion());
    }
    return schedule;
  }

  /** Flushes the schedule so a stale version surfaces here rather than at commit. */
  public ProductionSchedule save(ProductionSchedule schedule) {
    try {
      return scheduleRepository.saveAndFlush(schedule);
    } catch (OptimisticLockingFailureException e) {
      throw new VersionConflictException(schedule.getId(), e);
    }
  }

  public ScheduleEntry loadEntry(UUID entryId) {
    return entryRepository
        .findById(entryId)
        .orElseThrow(() -> new ResourceNotFoundException("ScheduleEntry", entryId));
  }

  public ScheduleEntry saveEntry(ScheduleEntry entry) {
    return entryRepository.save(entry);
  }

  public int nextSequencePosition(UUID scheduleId) {
    return EntrySequencer.nextPosition(entryRepository.findByScheduleId(scheduleId));
  }

  /**
   * Closes gaps in the positions of the schedule's pending entries, keeping their order. Runs in
   * the caller's unit of work after an entry left the pending set.
   */
  public List<ScheduleEntry> compactSequence(UUID scheduleId) {
    var changed = EntrySequencer.compact(entryRepository.findByScheduleId(scheduleId));
    changed.forEach(entryRepository::save);
    if (!changed.isEmpty()) {
      log.debug("Renumbered {} pending entries of schedule {}", changed.size(), scheduleId);
    }
    return changed;
  }

  /**
   * Lazily pages through matching entries. The result is finite and restartable: every call to
   * {@code iterator()} runs the query again from the first page.
   */
  public Iterable<ScheduleEntry> queryEntries(EntryFilter filter) {
    return () -> new PagedEntryIterator(filter);
  }

  public <T> T write(Duration timeout, Supplier<T> work) {
    return execute(timeout, false, work);
  }

  public <T> T read(Duration timeout, Supplier<T> work) {
    return execute(timeout, true, work);
  }

  private <T> T execute(Duration timeout, boolean readOnly, Supplier<T> work) {
    var template = new TransactionTemplate(transactionManager);
    template.setTimeout(toSeconds(timeout));
    template.setReadOnly(readOnly);
    try {
      return template.execute(status -> work.get());
    } catch (TransactionTimedOutException | QueryTimeoutException e) {
      log.warn("Persistence call exceeded {}", timeout);
      throw new PersistenceTimeoutException(timeout, e);
    } catch (ObjectOptimisticLockingFailureException e) {
      var scheduleId =
          ProductionSchedule.class.getName().equals(e.getPersistentClassName())
                  && e.getIdentifier() instanceof UUID id
              ? id
              : null;
      throw new VersionConflictException(scheduleId, e);
    } catch (OptimisticLockingFailureException e) {
      throw new VersionConflictException(null, e);
    }
  }

  private static int toSeconds(Duration timeout) {
    long millis = timeout.toMillis();
    return (int) Math.max(1, (millis + 999) / 1000);
  }

  private final class PagedEntryIterator implements Iterator<ScheduleEntry> {

    private final EntryFilter filter;
    private Slice<ScheduleEntry> slice;
    private Iterator<ScheduleEntry> current;

    private PagedEntryIterator(EntryFilter filter) {
      this.filter = filter;
      this.slice = fetch(PageRequest.of(0, pageSize));
      this.current = slice.iterator();
    }

    @Override
    public boolean hasNext() {
      while (!current.hasNext() && slice.hasNext()) {
        slice = fetch(slice.nextPageable());
        current = slice.iterator();
      }
      return current.hasNext();
    }

    @Override
    public ScheduleEntry next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return current.next();
    }

    private Slice<ScheduleEntry> fetch(Pageable pageable) {
      return entryRepository.findSlice(
          filter.scheduleId(),
          filter.siteId(),
          filter.states(),
          filter.dueOnOrBefore(),
          pageable);
    }
  }
}
