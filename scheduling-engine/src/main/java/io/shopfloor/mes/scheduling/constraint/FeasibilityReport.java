package io.shopfloor.mes.scheduling.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Feasibility of a schedule's pending entries. Entries without violations are not listed.
 *
 * @param violationsByEntry violations keyed by entry id, in sequence order
 */
public record FeasibilityReport(
    UUID scheduleId, boolean feasible, Map<UUID, List<Violation>> violationsByEntry) {

  public FeasibilityReport {
    violationsByEntry = Collections.unmodifiableMap(new LinkedHashMap<>(violationsByEntry));
  }

  public static FeasibilityReport of(UUID scheduleId, Map<UUID, List<Violation>> byEntry) {
    var nonEmpty = new LinkedHashMap<UUID, List<Violation>>();
    byEntry.forEach(
        (entryId, violations) -> {
          if (!violations.isEmpty()) {
            nonEmpty.put(entryId, List.copyOf(violations));
          }
        });
    boolean feasible =
        nonEmpty.values().stream().flatMap(List::stream).noneMatch(Violation::blocking);
    return new FeasibilityReport(scheduleId, feasible, nonEmpty);
  }

  public List<Violation> violations() {
    var all = new ArrayList<Violation>();
    violationsByEntry.values().forEach(all::addAll);
    return all;
  }

  public List<Violation> blockingViolations() {
    return violations().stream().filter(Violation::blocking).toList();
  }

  public List<Violation> violationsFor(UUID entryId) {
    return violationsByEntry.getOrDefault(entryId, List.of());
  }

  /** Short human-readable summary, persisted as the schedule's feasibility notes. */
  public String summary() {
    var all = violations();
    if (all.isEmpty()) {
      return "No constraint violations";
    }
    long critical = all.stream().filter(Violation::blocking).count();
    long overridden = all.stream().filter(Violation::overridden).count();
    long warnings =
        all.stream().filter(v -> v.severity() == ConstraintSeverity.WARNING).count();
    return critical
        + " unresolved critical, "
        + warnings
        + " warning, "
        + overridden
        + " overridden violation(s) across "
        + violationsByEntry.size()
        + " entries";
  }
}
