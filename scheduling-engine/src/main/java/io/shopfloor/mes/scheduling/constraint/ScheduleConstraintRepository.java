package io.shopfloor.mes.scheduling.constraint;

import io.shopfloor.mes.scheduling.schedule.EntryState;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduleConstraintRepository extends JpaRepository<ScheduleConstraint, UUID> {

  List<ScheduleConstraint> findByScheduleIdOrderByCreatedAtAsc(UUID scheduleId);

  List<ScheduleConstraint> findByEntryIdOrderByCreatedAtAsc(UUID entryId);

  /** Constraints of an entry, currently violated ones first. */
  @Query(
      """
      SELECT c FROM ScheduleConstraint c
      WHERE c.entryId = :entryId
      ORDER BY c.violated DESC, c.severity DESC NULLS LAST, c.createdAt ASC
      """)
  List<ScheduleConstraint> findByEntryIdViolatedFirst(@Param("entryId") UUID entryId);

  /**
   * Material already promised to other entries on the same site that are due no later than the
   * given date.
   */
  @Query(
      """
      SELECT COALESCE(SUM(c.requiredQuantity), 0)
      FROM ScheduleConstraint c, ScheduleEntry e, ProductionSchedule s
      WHERE c.entryId = e.id
        AND e.scheduleId = s.id
        AND c.type = io.shopfloor.mes.scheduling.constraint.ConstraintType.MATERIAL
        AND c.targetId = :materialId
        AND s.siteId = :siteId
        AND e.id <> :excludeEntryId
        AND e.state IN :states
        AND e.dueDate <= :dueOnOrBefore
      """)
  BigDecimal sumCommittedMaterialDemand(
      @Param("materialId") String materialId,
      @Param("siteId") UUID siteId,
      @Param("excludeEntryId") UUID excludeEntryId,
      @Param("states") Collection<EntryState> states,
      @Param("dueOnOrBefore") LocalDate dueOnOrBefore);

  long countByViolatedTrue();

  long countByOverriddenTrue();

  void deleteByScheduleId(UUID scheduleId);
}
