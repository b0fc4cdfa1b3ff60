package io.shopfloor.mes.scheduling.lifecycle;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StateTransitionRecordRepository
    extends JpaRepository<StateTransitionRecord, UUID> {

  List<StateTransitionRecord> findByScheduleIdOrderByOccurredAtDesc(UUID scheduleId);

  List<StateTransitionRecord> findByEntityIdOrderByOccurredAtDesc(UUID entityId);

  long countByScheduleId(UUID scheduleId);

  void deleteByScheduleId(UUID scheduleId);
}
