package io.shopfloor.mes.scheduling.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProductionScheduleRepository extends JpaRepository<ProductionSchedule, UUID> {

  Optional<ProductionSchedule> findByScheduleNumber(String scheduleNumber);

  boolean existsByScheduleNumber(String scheduleNumber);

  @Query(
      """
      SELECT s FROM ProductionSchedule s
      WHERE s.state = COALESCE(:state, s.state)
        AND s.siteId = COALESCE(:siteId, s.siteId)
      ORDER BY s.horizonStart ASC, s.scheduleNumber ASC
      """)
  List<ProductionSchedule> findWithFilters(
      @Param("state") ScheduleState state, @Param("siteId") UUID siteId);

  /**
   * Compare-and-swap on the schedule state. Bumps the optimistic version so that any writer
   * holding the previous version conflicts. Returns the number of rows changed (0 or 1).
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE ProductionSchedule s
         SET s.state = :to, s.stateChangedAt = :now, s.stateChangedBy = :actorId,
             s.updatedAt = :now, s.version = s.version + 1
       WHERE s.id = :id AND s.state = :from
      """)
  int compareAndSetState(
      @Param("id") UUID id,
      @Param("from") ScheduleState from,
      @Param("to") ScheduleState to,
      @Param("actorId") UUID actorId,
      @Param("now") Instant now);

  /** Rows of [state, count]. */
  @Query("SELECT s.state, COUNT(s) FROM ProductionSchedule s GROUP BY s.state")
  List<Object[]> countByState();
}
