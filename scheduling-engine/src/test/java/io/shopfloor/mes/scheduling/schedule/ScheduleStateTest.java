package io.shopfloor.mes.scheduling.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ScheduleStateTest {

  @Test
  void allowedTransitions_forecast() {
    assertThat(ScheduleState.FORECAST.allowedTransitions())
        .containsExactlyInAnyOrder(ScheduleState.RELEASED, ScheduleState.CANCELLED);
  }

  @Test
  void allowedTransitions_released() {
    assertThat(ScheduleState.RELEASED.allowedTransitions())
        .containsExactlyInAnyOrder(ScheduleState.DISPATCHED, ScheduleState.CANCELLED);
  }

  @Test
  void allowedTransitions_running() {
    assertThat(ScheduleState.RUNNING.allowedTransitions())
        .containsExactlyInAnyOrder(ScheduleState.COMPLETED, ScheduleState.CANCELLED);
  }

  @Test
  void completed_canOnlyClose() {
    assertThat(ScheduleState.COMPLETED.allowedTransitions())
        .containsExactly(ScheduleState.CLOSED);
  }

  @ParameterizedTest
  @EnumSource(value = ScheduleState.class, names = {"CLOSED", "CANCELLED"})
  void terminalStates_haveNoExits(ScheduleState state) {
    assertThat(state.isTerminal()).isTrue();
    assertThat(state.allowedTransitions()).isEmpty();
  }

  @Test
  void cancellation_reachableFromEveryActiveState() {
    var cancellable = EnumSet.noneOf(ScheduleState.class);
    for (var state : ScheduleState.values()) {
      if (state.canTransitionTo(ScheduleState.CANCELLED)) {
        cancellable.add(state);
      }
    }
    assertThat(cancellable)
        .containsExactlyInAnyOrder(
            ScheduleState.FORECAST,
            ScheduleState.RELEASED,
            ScheduleState.DISPATCHED,
            ScheduleState.RUNNING);
  }

  @Test
  void releasedToDispatched_isNotClientRequestable() {
    assertThat(ScheduleState.RELEASED.canTransitionTo(ScheduleState.DISPATCHED)).isTrue();
    assertThat(ScheduleState.RELEASED.canBeRequestedByClient(ScheduleState.DISPATCHED)).isFalse();
    assertThat(ScheduleState.DISPATCHED.canBeRequestedByClient(ScheduleState.RUNNING)).isTrue();
  }

  @Test
  void skippingStates_isNotAllowed() {
    assertThat(ScheduleState.FORECAST.canTransitionTo(ScheduleState.DISPATCHED)).isFalse();
    assertThat(ScheduleState.RELEASED.canTransitionTo(ScheduleState.FORECAST)).isFalse();
  }

  @Test
  void acceptsDispatch_onlyWhileReleasedOrExecuting() {
    assertThat(EnumSet.allOf(ScheduleState.class))
        .filteredOn(ScheduleState::acceptsDispatch)
        .containsExactlyInAnyOrder(
            ScheduleState.RELEASED, ScheduleState.DISPATCHED, ScheduleState.RUNNING);
  }
}
