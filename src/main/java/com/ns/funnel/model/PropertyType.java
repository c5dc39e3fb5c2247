package com.ns.funnel.model;

import java.util.Locale;

public enum PropertyType {
    EVENT,
    PERSON,
    GROUP,
    /** Value is a cohort id; the filter tests membership of the event's person. */
    COHORT,
    /** Key is a HogQL boolean expression; value and operator are unused. */
    HOGQL;

    public static PropertyType fromString(String value) {
        return PropertyType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
