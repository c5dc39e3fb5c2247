package com.ns.funnel.model;

public enum ExecutionStrategy {
    /** Nested windowed subqueries, one level per step. */
    CASCADING,
    /** One grouped pass per actor feeding the aggregate funnel function. */
    SINGLE_PASS
}
