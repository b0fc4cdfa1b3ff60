package io.shopfloor.mes.scheduling.statistics;

import static org.assertj.core.api.Assertions.assertThat;

import io.shopfloor.mes.scheduling.schedule.EntryState;
import io.shopfloor.mes.scheduling.schedule.ScheduleState;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScheduleStatisticsServiceTest {

  @Test
  void toCounts_fillsMissingStatesWithZero() {
    List<Object[]> rows =
        List.of(
            new Object[] {ScheduleState.FORECAST, 3L}, new Object[] {ScheduleState.RELEASED, 1L});

    var counts = ScheduleStatisticsService.toCounts(rows, ScheduleState.class);

    assertThat(counts).hasSize(ScheduleState.values().length);
    assertThat(counts)
        .containsEntry(ScheduleState.FORECAST, 3L)
        .containsEntry(ScheduleState.RELEASED, 1L)
        .containsEntry(ScheduleState.CANCELLED, 0L);
  }

  @Test
  void toCounts_acceptsAnyNumericCount() {
    List<Object[]> rows = List.<Object[]>of(new Object[] {EntryState.READY, 7});

    var counts = ScheduleStatisticsService.toCounts(rows, EntryState.class);

    assertThat(counts.get(EntryState.READY)).isEqualTo(7L);
    assertThat(counts.get(EntryState.PLANNED)).isZero();
  }
}
