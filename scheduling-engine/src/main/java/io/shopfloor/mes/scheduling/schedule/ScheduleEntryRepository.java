package io.shopfloor.mes.scheduling.schedule;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduleEntryRepository extends JpaRepository<ScheduleEntry, UUID> {

  @Query("SELECT e FROM ScheduleEntry e WHERE e.scheduleId = :scheduleId ORDER BY e.entryNumber")
  List<ScheduleEntry> findByScheduleId(@Param("scheduleId") UUID scheduleId);

  @Query(
      """
      SELECT e FROM ScheduleEntry e
      WHERE e.scheduleId = :scheduleId AND e.state IN :states
      ORDER BY e.sequencePosition ASC NULLS LAST, e.entryNumber ASC
      """)
  List<ScheduleEntry> findByScheduleIdAndStates(
      @Param("scheduleId") UUID scheduleId, @Param("states") Collection<EntryState> states);

  @Query(
      """
      SELECT e FROM ScheduleEntry e
      WHERE e.scheduleId = COALESCE(:scheduleId, e.scheduleId)
        AND e.scheduleId IN (
              SELECT s.id FROM ProductionSchedule s WHERE s.siteId = COALESCE(:siteId, s.siteId))
        AND e.state IN :states
        AND (:dueOnOrBefore IS NULL OR e.dueDate <= :dueOnOrBefore)
      ORDER BY e.scheduleId ASC, e.sequencePosition ASC NULLS LAST, e.entryNumber ASC
      """)
  Slice<ScheduleEntry> findSlice(
      @Param("scheduleId") UUID scheduleId,
      @Param("siteId") UUID siteId,
      @Param("states") Collection<EntryState> states,
      @Param("dueOnOrBefore") LocalDate dueOnOrBefore,
      Pageable pageable);

  /**
   * Entries that can be dispatched right now: pending entries of RELEASED, DISPATCHED or RUNNING
   * schedules, optionally on one site.
   */
  @Query(
      """
      SELECT e FROM ScheduleEntry e, ProductionSchedule s
      WHERE e.scheduleId = s.id
        AND e.state = io.shopfloor.mes.scheduling.schedule.EntryState.READY
        AND s.state IN (
              io.shopfloor.mes.scheduling.schedule.ScheduleState.RELEASED,
              io.shopfloor.mes.scheduling.schedule.ScheduleState.DISPATCHED,
              io.shopfloor.mes.scheduling.schedule.ScheduleState.RUNNING)
        AND s.siteId = COALESCE(:siteId, s.siteId)
      ORDER BY e.priority DESC, e.sequencePosition ASC NULLS LAST, e.dueDate ASC
      """)
  List<ScheduleEntry> findReadyForDispatch(@Param("siteId") UUID siteId);

  long countByScheduleIdAndStateNot(UUID scheduleId, EntryState state);

  boolean existsByScheduleIdAndWorkOrderIdIsNotNull(UUID scheduleId);

  void deleteByScheduleId(UUID scheduleId);

  /** Rows of [state, count]. */
  @Query("SELECT e.state, COUNT(e) FROM ScheduleEntry e GROUP BY e.state")
  List<Object[]> countByState();
}
