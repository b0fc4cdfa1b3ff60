package io.shopfloor.mes.scheduling.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Records and queries audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back.
   */
  void log(AuditEventRecord record);

  /**
   * Records an audit event in its own transaction (REQUIRES_NEW). Used for rejected operations,
   * whose enclosing unit of work rolls back.
   */
  void logIndependently(AuditEventRecord record);

  /** Events recorded against a schedule, newest first. */
  Page<AuditEvent> findBySchedule(UUID scheduleId, Pageable pageable);

  List<AuditEventRepository.EventTypeCount> countEventsByType();
}
