package com.openforge.devgauge.analysis;

/**
 * A named component of a category score. Weights within one category sum to 100.
 */
public record SubMetric(
        String name,
        int score,
        int weight
) {}
