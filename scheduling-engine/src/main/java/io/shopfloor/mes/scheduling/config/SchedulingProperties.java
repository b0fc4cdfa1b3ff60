package io.shopfloor.mes.scheduling.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Engine tuning knobs bound from {@code scheduling.*}.
 *
 * @param defaultTimeout budget applied to a call when the caller does not supply one
 * @param query entry query paging
 * @param constraints thresholds used by the constraint evaluator
 * @param dispatch work order retries and batch fan-out
 * @param collaborators executor used for availability and work order calls
 */
@Validated
@ConfigurationProperties(prefix = "scheduling")
public record SchedulingProperties(
    @NotNull @DefaultValue("10s") Duration defaultTimeout,
    @Valid @DefaultValue Query query,
    @Valid @DefaultValue Constraints constraints,
    @Valid @DefaultValue Dispatch dispatch,
    @Valid @DefaultValue Collaborators collaborators) {

  public record Query(@Min(1) @Max(10_000) @DefaultValue("200") int pageSize) {}

  /**
   * @param capacitySoftThreshold projected utilization above which a fitting capacity requirement
   *     is reported as a warning
   * @param materialSafetyMargin fraction of the required quantity that must remain as headroom
   */
  public record Constraints(
      @NotNull @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.85")
          BigDecimal capacitySoftThreshold,
      @NotNull @DecimalMin("0.0") @DefaultValue("0.10") BigDecimal materialSafetyMargin) {}

  public record Dispatch(
      @Min(1) @DefaultValue("2") int workOrderAttempts,
      @NotNull @DefaultValue("200ms") Duration retryBackoff,
      @Min(1) @DefaultValue("1") int batchParallelism) {}

  public record Collaborators(@Min(1) @DefaultValue("8") int poolSize) {}

  /** Defaults as declared above; for wiring outside a Spring context. */
  public static SchedulingProperties defaults() {
    return new SchedulingProperties(
        Duration.ofSeconds(10),
        new Query(200),
        new Constraints(new BigDecimal("0.85"), new BigDecimal("0.10")),
        new Dispatch(2, Duration.ofMillis(200), 1),
        new Collaborators(8));
  }
}
