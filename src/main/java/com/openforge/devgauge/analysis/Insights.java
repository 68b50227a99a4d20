package com.openforge.devgauge.analysis;

/** Per-axis narrative lines produced by the synthesis phase. */
public record Insights(
        String projects,
        String language,
        String activity
) {

    public static Insights empty() {
        return new Insights("", "", "");
    }
}
