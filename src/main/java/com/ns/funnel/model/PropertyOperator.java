package com.ns.funnel.model;

import java.util.Locale;

public enum PropertyOperator {
    EXACT,
    IS_NOT,
    ICONTAINS,
    NOT_ICONTAINS,
    REGEX,
    NOT_REGEX,
    GT,
    GTE,
    LT,
    LTE,
    IS_SET,
    IS_NOT_SET;

    public static PropertyOperator fromString(String value) {
        return PropertyOperator.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
