package com.ns.funnel.context;

public enum ValidationCode {
    SERIES_TOO_SHORT,
    TOO_MANY_STEPS,
    STEP_RANGE_INVALID,
    WINDOW_INVALID,
    EXCLUSION_RANGE_INVALID,
    EXCLUSION_MATCHES_STEP,
    PARTIAL_EXCLUSION_UNORDERED,
    OPTIONAL_STEP_INVALID,
    BREAKDOWN_INVALID,
    UNSUPPORTED_BREAKDOWN,
    EXTERNAL_SOURCE_UNSUPPORTED,
    INVALID_HOGQL_EXPRESSION,
    CORRELATION_INVALID,
    SAMPLING_INVALID,
    ACTOR_TARGET_INVALID
}
