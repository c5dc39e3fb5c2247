package com.ns.funnel.model;

public enum OrderType {
    /** Steps in order; other events may happen in between. */
    SEQUENTIAL,
    /** Steps in order with nothing else in between. */
    STRICT,
    /** Every step within the window, in any order. */
    UNORDERED
}
