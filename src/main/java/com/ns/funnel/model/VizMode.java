package com.ns.funnel.model;

public enum VizMode {
    STEPS,
    TRENDS,
    TIME_TO_CONVERT
}
