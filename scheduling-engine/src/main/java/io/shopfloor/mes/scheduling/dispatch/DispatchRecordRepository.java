package io.shopfloor.mes.scheduling.dispatch;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DispatchRecordRepository extends JpaRepository<DispatchRecord, UUID> {

  Optional<DispatchRecord> findByEntryId(UUID entryId);

  List<DispatchRecord> findByScheduleIdOrderByDispatchedAtAsc(UUID scheduleId);

  long countByScheduleId(UUID scheduleId);
}
