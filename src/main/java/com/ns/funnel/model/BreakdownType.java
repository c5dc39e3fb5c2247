package com.ns.funnel.model;

import java.util.Locale;

public enum BreakdownType {
    EVENT,
    PERSON,
    GROUP,
    COHORT,
    HOGQL,
    DATA_WAREHOUSE_PERSON_PROPERTY;

    public static BreakdownType fromString(String value) {
        return BreakdownType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
