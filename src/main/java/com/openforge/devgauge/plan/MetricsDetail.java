package com.openforge.devgauge.plan;

/**
 * How much of the metrics record a plan exposes to the model.
 */
public enum MetricsDetail {
    /** Headline counts only; detailed statistics are withheld and the model is told so. */
    SUMMARY,
    FULL
}
