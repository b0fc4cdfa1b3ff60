package io.shopfloor.mes.scheduling.constraint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.shopfloor.mes.scheduling.TestEntities;
import io.shopfloor.mes.scheduling.config.SchedulingProperties;
import io.shopfloor.mes.scheduling.integration.CollaboratorInvoker;
import io.shopfloor.mes.scheduling.integration.availability.AvailabilityResult;
import io.shopfloor.mes.scheduling.integration.availability.AvailabilitySource;
import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ProductionSchedule;
import io.shopfloor.mes.scheduling.schedule.ScheduleEntry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConstraintEvaluatorTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(2);

  @Mock private AvailabilitySource availabilitySource;
  @Mock private ScheduleConstraintRepository constraintRepository;

  private ConstraintEvaluator evaluator;
  private ProductionSchedule schedule;
  private ScheduleEntry entry;

  @BeforeEach
  void setUp() {
    evaluator =
        new ConstraintEvaluator(
            availabilitySource,
            new CollaboratorInvoker(Runnable::run),
            constraintRepository,
            SchedulingProperties.defaults());
    schedule = TestEntities.schedule();
    entry = TestEntities.entry(schedule, 1, 1, TestEntities.DAY_ONE);
  }

  @Test
  void capacity_requiredAboveAvailable_isCritical() {
    var violation = assess(ConstraintType.CAPACITY, "50", capacity("40", "100"), "0");

    assertThat(violation.severity()).isEqualTo(ConstraintSeverity.CRITICAL);
    assertThat(violation.blocking()).isTrue();
    assertThat(violation.message()).contains("required 50", "available 40");
  }

  @Test
  void capacity_utilizationAboveSoftThreshold_isWarning() {
    // (100 - 40 + 30) / 100 = 90% projected utilization
    var violation = assess(ConstraintType.CAPACITY, "30", capacity("40", "100"), "0");

    assertThat(violation.severity()).isEqualTo(ConstraintSeverity.WARNING);
    assertThat(violation.blocking()).isFalse();
    assertThat(violation.message()).contains("90%");
  }

  @Test
  void capacity_comfortablyAvailable_isSatisfied() {
    assertThat(assess(ConstraintType.CAPACITY, "30", capacity("80", "100"), "0")).isNull();
  }

  @Test
  void material_committedDemandReducesNetAvailability() {
    var violation = assess(ConstraintType.MATERIAL, "50", stock("100"), "60");

    assertThat(violation.severity()).isEqualTo(ConstraintSeverity.CRITICAL);
    assertThat(violation.message()).contains("net available 40", "60 committed");
  }

  @Test
  void material_headroomBelowSafetyMargin_isWarning() {
    // net 40, headroom 2, margin 10% of 38
    var violation = assess(ConstraintType.MATERIAL, "38", stock("100"), "60");

    assertThat(violation.severity()).isEqualTo(ConstraintSeverity.WARNING);
  }

  @Test
  void material_withinSafetyMargin_isSatisfied() {
    assertThat(assess(ConstraintType.MATERIAL, "30", stock("100"), "60")).isNull();
  }

  @Test
  void unconstrainedTarget_isSatisfied() {
    assertThat(
            assess(ConstraintType.CAPACITY, "500", AvailabilityResult.unconstrained("WC-1"), "0"))
        .isNull();
  }

  @Test
  void overriddenConstraint_reportsNonBlockingViolation() {
    var constraint = TestEntities.constraint(entry, ConstraintType.CAPACITY, "WC-1", "50");
    constraint.override("accepted overtime", TestEntities.ACTOR);

    var violation = evaluator.assess(entry, constraint, capacity("40", "100"), BigDecimal.ZERO);

    assertThat(violation.severity()).isEqualTo(ConstraintSeverity.CRITICAL);
    assertThat(violation.overridden()).isTrue();
    assertThat(violation.blocking()).isFalse();
  }

  @Test
  void evaluate_readsCommittedDemandForMaterial() {
    var constraint = TestEntities.constraint(entry, ConstraintType.MATERIAL, "MAT-7", "50");
    when(constraintRepository.sumCommittedMaterialDemand(
            "MAT-7", TestEntities.SITE, entry.getId(), EntryState.COMMITTED, entry.getDueDate()))
        .thenReturn(new BigDecimal("60"));
    when(availabilitySource.available(eq("MAT-7"), any(), eq(new BigDecimal("50"))))
        .thenReturn(stock("100"));

    var violations = evaluator.evaluate(schedule, entry, List.of(constraint), TIMEOUT);

    assertThat(violations)
        .singleElement()
        .satisfies(
            v -> {
              assertThat(v.constraintId()).isEqualTo(constraint.getId());
              assertThat(v.blocking()).isTrue();
            });
  }

  @Test
  void evaluateAll_keysEveryEntryEvenWithoutViolations() {
    var other = TestEntities.entry(schedule, 2, 1, TestEntities.DAY_ONE);
    var tight = TestEntities.constraint(entry, ConstraintType.CAPACITY, "WC-1", "50");
    var loose = TestEntities.constraint(other, ConstraintType.CAPACITY, "WC-2", "5");
    when(availabilitySource.available(eq("WC-1"), any(), any())).thenReturn(capacity("40", "100"));
    when(availabilitySource.available(eq("WC-2"), any(), any())).thenReturn(capacity("80", "100"));
    var input = new LinkedHashMap<ScheduleEntry, List<ScheduleConstraint>>();
    input.put(entry, List.of(tight));
    input.put(other, List.of(loose));

    var result = evaluator.evaluateAll(schedule, input, TIMEOUT);

    assertThat(result).containsOnlyKeys(entry.getId(), other.getId());
    assertThat(result.get(entry.getId())).hasSize(1);
    assertThat(result.get(other.getId())).isEmpty();
  }

  @Test
  void evaluateAll_failedCheck_cancelsChecksNotYetStarted() {
    var queued = new ArrayList<Runnable>();
    var firstRunsInline = new AtomicBoolean(true);
    var stalling =
        new ConstraintEvaluator(
            availabilitySource,
            new CollaboratorInvoker(
                task -> {
                  if (firstRunsInline.getAndSet(false)) {
                    task.run();
                  } else {
                    queued.add(task);
                  }
                }),
            constraintRepository,
            SchedulingProperties.defaults());
    var failing = TestEntities.constraint(entry, ConstraintType.CAPACITY, "WC-1", "10");
    var waiting = TestEntities.constraint(entry, ConstraintType.CAPACITY, "WC-2", "10");
    when(availabilitySource.available(eq("WC-1"), any(), any()))
        .thenThrow(new IllegalStateException("capacity service down"));

    assertThatThrownBy(
            () -> stalling.evaluateAll(schedule, Map.of(entry, List.of(failing, waiting)), TIMEOUT))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("capacity service down");

    assertThat(queued).hasSize(1);
    queued.forEach(Runnable::run);
    verify(availabilitySource, never()).available(eq("WC-2"), any(), any());
  }

  @Test
  void windowFor_capacityUsesPlannedWindow() {
    var constraint = TestEntities.constraint(entry, ConstraintType.CAPACITY, "WC-1", "5");

    assertThat(ConstraintEvaluator.windowFor(schedule, entry, constraint))
        .isEqualTo(entry.plannedWindow());
  }

  @Test
  void windowFor_materialRunsFromHorizonStartToEndOfDueDate() {
    var constraint = TestEntities.constraint(entry, ConstraintType.MATERIAL, "MAT-7", "5");

    var window = ConstraintEvaluator.windowFor(schedule, entry, constraint);

    assertThat(window.start()).isEqualTo(TestEntities.HORIZON_START);
    assertThat(window.end()).isEqualTo(Instant.parse("2026-03-03T00:00:00Z"));
  }

  private Violation assess(
      ConstraintType type, String required, AvailabilityResult availability, String committed) {
    var constraint = TestEntities.constraint(entry, type, "WC-1", required);
    return evaluator.assess(entry, constraint, availability, new BigDecimal(committed));
  }

  private static AvailabilityResult capacity(String available, String capacity) {
    return AvailabilityResult.ofCapacity(
        "WC-1", new BigDecimal(available), new BigDecimal(capacity));
  }

  private static AvailabilityResult stock(String available) {
    return AvailabilityResult.ofStock("MAT-7", new BigDecimal(available));
  }
}
