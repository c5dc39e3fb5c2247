package com.ns.funnel.context;

import com.ns.funnel.config.FunnelCompilerConfig;
import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import com.ns.funnel.model.CorrelationSpec;
import com.ns.funnel.model.CorrelationType;
import com.ns.funnel.model.Exclusion;
import com.ns.funnel.model.ExternalSourceMatch;
import com.ns.funnel.model.FunnelSpec;
import com.ns.funnel.model.OrderType;
import com.ns.funnel.model.StepMath;
import com.ns.funnel.model.StepMatcher;
import com.ns.funnel.model.VizMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks a {@link FunnelSpec} for internal consistency before anything is resolved.
 * All checks run; every violation found is reported.
 */
public class FunnelSpecValidator {
    private static final Logger logger = LoggerFactory.getLogger(FunnelSpecValidator.class);

    public static class ValidationResult {
        public final boolean valid;
        public final List<FunnelValidationException.Violation> violations;

        private ValidationResult(List<FunnelValidationException.Violation> violations) {
            this.valid = violations.isEmpty();
            this.violations = Collections.unmodifiableList(violations);
        }

        public void throwIfInvalid() {
            if (!valid) {
                throw new FunnelValidationException(violations);
            }
        }
    }

    public static ValidationResult validate(FunnelSpec spec, FunnelCompilerConfig config) {
        logger.debug("Validating funnel with {} steps, order {}", spec.getSeries().size(), spec.getOrderType());
        SpecChecks checks = new SpecChecks(spec, config);
        ValidationResult result = checks.run();
        if (result.valid) {
            logger.debug("Funnel validation passed");
        } else {
            logger.info("Funnel validation failed: {}", result.violations);
        }
        return result;
    }

    private static class SpecChecks {
        private final FunnelSpec spec;
        private final FunnelCompilerConfig config;
        private final List<StepMatcher> series;
        private final int maxSteps;
        private final List<FunnelValidationException.Violation> failures = new ArrayList<>();

        SpecChecks(FunnelSpec spec, FunnelCompilerConfig config) {
            this.spec = spec;
            this.config = config;
            this.series = spec.getSeries();
            this.maxSteps = series.size();
        }

        private void fail(ValidationCode code, String message) {
            failures.add(new FunnelValidationException.Violation(code, message));
        }

        ValidationResult run() {
            if (!validateSeriesLength()) {
                return new ValidationResult(failures);
            }
            validateWindow();
            validateStepRange();
            validateExclusions();
            validateOptionalSteps();
            validateExternalSources();
            spec.getBreakdown().ifPresent(this::validateBreakdown);
            spec.getCorrelation().ifPresent(this::validateCorrelation);
            validateSampling();
            return new ValidationResult(failures);
        }

        private boolean validateSeriesLength() {
            if (maxSteps < 2) {
                fail(ValidationCode.SERIES_TOO_SHORT, "A funnel needs at least 2 steps, got " + maxSteps);
                return false;
            }
            if (maxSteps > config.getMaxSteps()) {
                fail(ValidationCode.TOO_MANY_STEPS, "A funnel can have at most " + config.getMaxSteps() + " steps, got " + maxSteps);
                return false;
            }
            return true;
        }

        private void validateWindow() {
            if (spec.getWindow().getAmount() <= 0) {
                fail(ValidationCode.WINDOW_INVALID, "Conversion window must be positive, got " + spec.getWindow());
            }
        }

        private void validateStepRange() {
            int from = spec.getFromStep().orElse(0);
            int to = spec.getToStep().orElse(maxSteps - 1);
            if (from < 0 || to > maxSteps - 1 || from >= to) {
                fail(ValidationCode.STEP_RANGE_INVALID,
                    String.format("Step range [%d, %d] is invalid for a funnel with %d steps", from, to, maxSteps));
            }
        }

        private void validateExclusions() {
            for (Exclusion exclusion : spec.getExclusions()) {
                int from = exclusion.getFromStep();
                int to = exclusion.getToStep();
                if (from >= to) {
                    fail(ValidationCode.EXCLUSION_RANGE_INVALID,
                        "Exclusion event range is invalid. End of range should be greater than start: " + exclusion);
                    continue;
                }
                if (from < 0 || from >= maxSteps - 1) {
                    fail(ValidationCode.EXCLUSION_RANGE_INVALID,
                        "Exclusion event range is invalid. Start of range is outside the funnel steps: " + exclusion);
                    continue;
                }
                if (to > maxSteps - 1) {
                    fail(ValidationCode.EXCLUSION_RANGE_INVALID,
                        "Exclusion event range is invalid. End of range is greater than number of steps: " + exclusion);
                    continue;
                }
                if (exclusion.getMatcher() instanceof ExternalSourceMatch) {
                    fail(ValidationCode.EXTERNAL_SOURCE_UNSUPPORTED, "Exclusions cannot use external sources: " + exclusion);
                    continue;
                }
                StepMatcher excluded = exclusion.getMatcher();
                for (int i = from; i <= to; i++) {
                    StepMatcher step = series.get(i);
                    if (excluded.isEquivalentTo(step) || excluded.isSupersetOf(step) || step.isSupersetOf(excluded)) {
                        fail(ValidationCode.EXCLUSION_MATCHES_STEP,
                            "Exclusion steps cannot contain an event that's part of funnel steps: " + exclusion + " overlaps step " + i);
                        break;
                    }
                }
                if (spec.getOrderType() == OrderType.UNORDERED && (from != 0 || to != maxSteps - 1)) {
                    fail(ValidationCode.PARTIAL_EXCLUSION_UNORDERED,
                        "Partial exclusions are not supported in unordered funnels: " + exclusion);
                }
            }
        }

        private void validateOptionalSteps() {
            boolean anyOptional = series.stream().anyMatch(StepMatcher::isOptional);
            if (!anyOptional) {
                return;
            }
            if (spec.getOrderType() == OrderType.UNORDERED) {
                fail(ValidationCode.OPTIONAL_STEP_INVALID, "Optional steps are not supported in unordered funnels");
            }
            if (spec.getVizMode() != VizMode.STEPS) {
                fail(ValidationCode.OPTIONAL_STEP_INVALID, "Optional steps are only supported for the steps visualization");
            }
            if (series.get(0).isOptional()) {
                fail(ValidationCode.OPTIONAL_STEP_INVALID, "The first step of a funnel cannot be optional");
            }
            for (int i = 1; i < maxSteps - 1; i++) {
                StepMatcher step = series.get(i);
                StepMatcher next = series.get(i + 1);
                if (step.isOptional() && !next.isOptional() && step.isEquivalentTo(next)) {
                    fail(ValidationCode.OPTIONAL_STEP_INVALID,
                        "Optional step " + i + " is followed by the identical required step " + (i + 1));
                }
            }
            if (!spec.getExclusions().isEmpty()) {
                fail(ValidationCode.OPTIONAL_STEP_INVALID, "Optional steps cannot be combined with exclusions");
            }
            spec.getBreakdown()
                .filter(b -> b.getAttribution().isStep())
                .ifPresent(b -> fail(ValidationCode.OPTIONAL_STEP_INVALID, "Optional steps cannot be combined with step attribution"));
            if (spec.getCorrelation().isPresent()) {
                fail(ValidationCode.OPTIONAL_STEP_INVALID, "Optional steps cannot be combined with correlation analysis");
            }
        }

        private void validateExternalSources() {
            List<Integer> external = new ArrayList<>();
            for (int i = 0; i < maxSteps; i++) {
                if (series.get(i) instanceof ExternalSourceMatch) {
                    external.add(i);
                    if (series.get(i).getMath() != StepMath.TOTAL) {
                        fail(ValidationCode.EXTERNAL_SOURCE_UNSUPPORTED, "First-time math is not supported for external source step " + i);
                    }
                }
            }
            if (external.isEmpty()) {
                return;
            }
            if (spec.getOrderType() != OrderType.SEQUENTIAL) {
                fail(ValidationCode.EXTERNAL_SOURCE_UNSUPPORTED, "External source steps require a sequential funnel, got " + spec.getOrderType());
            }
            if (spec.getBreakdown().isPresent()) {
                fail(ValidationCode.EXTERNAL_SOURCE_UNSUPPORTED, "Breakdowns are not supported with external source steps " + external);
            }
            if (spec.getCorrelation().isPresent()) {
                fail(ValidationCode.EXTERNAL_SOURCE_UNSUPPORTED, "Correlation is not supported with external source steps " + external);
            }
        }

        private void validateBreakdown(BreakdownSpec breakdown) {
            BreakdownType type = breakdown.getType();
            switch (type) {
                case COHORT:
                    if (breakdown.getCohortIds().isEmpty() && !breakdown.isIncludeAllUsersCohort()) {
                        fail(ValidationCode.BREAKDOWN_INVALID, "Cohort breakdown needs at least one cohort");
                    }
                    break;
                case HOGQL:
                    if (breakdown.getProperties().size() != 1) {
                        fail(ValidationCode.UNSUPPORTED_BREAKDOWN, "HogQL breakdown takes exactly one expression, got " + breakdown.getProperties().size());
                    }
                    break;
                case DATA_WAREHOUSE_PERSON_PROPERTY:
                    if (breakdown.getProperties().size() != 1) {
                        fail(ValidationCode.UNSUPPORTED_BREAKDOWN, "Data warehouse person property breakdown takes exactly one property");
                    }
                    break;
                case GROUP:
                    if (breakdown.getGroupTypeIndex().isEmpty()) {
                        fail(ValidationCode.BREAKDOWN_INVALID, "Group breakdown needs a group type index");
                    }
                    if (breakdown.getProperties().isEmpty()) {
                        fail(ValidationCode.BREAKDOWN_INVALID, "Group breakdown needs at least one property");
                    }
                    break;
                default:
                    if (breakdown.getProperties().isEmpty()) {
                        fail(ValidationCode.BREAKDOWN_INVALID, type + " breakdown needs at least one property");
                    }
                    break;
            }
            breakdown.getLimit().filter(limit -> limit < 1)
                .ifPresent(limit -> fail(ValidationCode.BREAKDOWN_INVALID, "Breakdown limit must be positive, got " + limit));
            BreakdownAttribution attribution = breakdown.getAttribution();
            if (attribution.isStep() && (attribution.getStepIndex() < 0 || attribution.getStepIndex() >= maxSteps)) {
                fail(ValidationCode.BREAKDOWN_INVALID,
                    "Breakdown attribution step " + attribution.getStepIndex() + " is outside the funnel steps");
            }
            breakdown.getValues().ifPresent(values -> {
                int width = Math.max(1, breakdown.getProperties().size());
                if (type != BreakdownType.COHORT && values.stream().anyMatch(v -> v.size() != width)) {
                    fail(ValidationCode.BREAKDOWN_INVALID, "Every breakdown value needs " + width + " parts");
                }
            });
        }

        private void validateCorrelation(CorrelationSpec correlation) {
            if (correlation.getType() == CorrelationType.PROPERTIES && correlation.getPropertyNames().isEmpty()) {
                fail(ValidationCode.CORRELATION_INVALID, "Property correlation needs property names");
            }
            if (correlation.getType() == CorrelationType.EVENT_WITH_PROPERTIES && correlation.getEventNames().isEmpty()) {
                fail(ValidationCode.CORRELATION_INVALID, "Event property correlation needs event names");
            }
        }

        private void validateSampling() {
            spec.getSamplingFactor()
                .filter(factor -> !(factor > 0 && factor <= 1))
                .ifPresent(factor -> fail(ValidationCode.SAMPLING_INVALID, "Sampling factor must be in (0, 1], got " + factor));
        }
    }
}
