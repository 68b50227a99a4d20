package com.openforge.devgauge.analysis;

import java.util.List;

/**
 * One category as the model sent it, before normalization.
 * A null {@code score} means absent, non-numeric or NaN.
 */
public record RawCategory(
        Double score,
        String notes,
        List<RawSubMetric> subMetrics
) {

    public RawCategory {
        subMetrics = subMetrics == null ? List.of() : List.copyOf(subMetrics);
    }

    public static RawCategory of(double score) {
        return new RawCategory(score, "", List.of());
    }

    /** Lifts an already-normalized category back into raw form. */
    public static RawCategory of(CategoryScore normalized) {
        List<RawSubMetric> subs = normalized.subMetrics().stream()
                .map(s -> new RawSubMetric(s.name(), (double) s.score(), (double) s.weight()))
                .toList();
        return new RawCategory((double) normalized.score(), normalized.notes(), subs);
    }

    public record RawSubMetric(
            String name,
            Double score,
            Double weight
    ) {}
}
