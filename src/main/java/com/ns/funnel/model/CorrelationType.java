package com.ns.funnel.model;

import java.util.Locale;

public enum CorrelationType {
    EVENTS,
    PROPERTIES,
    EVENT_WITH_PROPERTIES;

    public static CorrelationType fromString(String value) {
        return CorrelationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
