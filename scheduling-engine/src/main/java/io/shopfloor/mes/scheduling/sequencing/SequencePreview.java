package io.shopfloor.mes.scheduling.sequencing;

import io.shopfloor.mes.scheduling.constraint.FeasibilityReport;

/** A proposed ordering together with the feasibility of the entries it orders. Nothing is saved. */
public record SequencePreview(SequencingResult sequence, FeasibilityReport feasibility) {}
