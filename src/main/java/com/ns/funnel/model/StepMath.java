package com.ns.funnel.model;

/**
 * Qualifies which occurrences of a step's events count.
 */
public enum StepMath {
    TOTAL,
    /** Only the actor's first ever matching event, ignoring the step's property filters. */
    FIRST_TIME_FOR_ACTOR,
    /** Only the actor's first matching event that also passes the step's property filters. */
    FIRST_TIME_FOR_ACTOR_WITH_FILTERS
}
