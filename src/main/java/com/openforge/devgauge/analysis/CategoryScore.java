package com.openforge.devgauge.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One normalized category: score in [0,100], weight in [15,45].
 * {@code subMetrics} is empty unless the category was computed from them.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record CategoryScore(
        CategoryKey key,
        int score,
        int weight,
        String notes,
        List<SubMetric> subMetrics
) {

    public CategoryScore {
        notes      = notes == null ? "" : notes;
        subMetrics = subMetrics == null ? List.of() : List.copyOf(subMetrics);
    }
}
