package com.ns.funnel.query;

/**
 * Names of the columns the funnel queries pass between levels.
 */
public final class Columns {
    public static final String TIMESTAMP = "timestamp";
    public static final String AGGREGATION_TARGET = "aggregation_target";
    public static final String STEPS = "steps";
    public static final String MAX_STEPS = "max_steps";
    public static final String PROP = "prop";
    public static final String PROP_BASIC = "prop_basic";
    public static final String PROP_VALS = "prop_vals";
    public static final String EXCLUSION = "exclusion";
    public static final String EVENT_TIMES = "event_times";
    public static final String UUID = "uuid";
    public static final String UUIDS = "uuids";
    public static final String FINAL_MATCHING_EVENT = "final_matching_event";
    public static final String FINAL_MATCHING_EVENTS = "final_matching_events";
    public static final String FIRST_TIMESTAMP = "first_timestamp";
    public static final String FINAL_TIMESTAMP = "final_timestamp";
    public static final String ACTOR_ID = "actor_id";
    public static final String OTHER_BREAKDOWN_VALUE = "Other";

    public static final String EVENTS_ALIAS = "e";
    public static final String PRIOR_EVENTS_ALIAS = "prior";
    public static final String COHORT_JOIN_ALIAS = "cohort_join";
    public static final String COHORT_PERSON_ID = "cohort_person_id";
    public static final String COHORT_VALUE = "value";

    private Columns() {
    }

    public static String step(int index) {
        return "step_" + index;
    }

    public static String latest(int index) {
        return "latest_" + index;
    }

    public static String exclusionStep(int exclusion, int fromStep) {
        return "exclusion_" + exclusion + "_" + step(fromStep);
    }

    public static String exclusionLatest(int exclusion, int fromStep) {
        return "exclusion_" + exclusion + "_" + latest(fromStep);
    }

    public static String exclusionFlag(int exclusion) {
        return "exclusion_" + exclusion;
    }

    public static String conversionTime(int index) {
        return "step_" + index + "_conversion_time";
    }

    public static String averageConversionTime(int index) {
        return "step_" + index + "_average_conversion_time";
    }

    public static String medianConversionTime(int index) {
        return "step_" + index + "_median_conversion_time";
    }

    public static String inner(String column) {
        return column + "_inner";
    }

    public static String stepProp(int index) {
        return "prop_" + index;
    }

    /** Per-step copy of an event field, {@code uuid_2} or {@code $session_id_2}. */
    public static String stepField(String field, int index) {
        return field + "_" + index;
    }

    public static String matchingEvent(int index) {
        return "step_" + index + "_matching_event";
    }

    public static String matchingEvents(int index) {
        return "step_" + index + "_matching_events";
    }
}
