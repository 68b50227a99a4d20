package com.openforge.devgauge.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Output of the scoring phase: the complete category map plus the level
 * computed from it. Phase 2 receives this locked in and never recomputes it.
 */
public record ScoredCategories(
        Map<CategoryKey, CategoryScore> categories,
        int level,
        LevelName levelName
) {

    public ScoredCategories {
        Map<CategoryKey, CategoryScore> copy = new EnumMap<>(CategoryKey.class);
        copy.putAll(categories);
        categories = Collections.unmodifiableMap(copy);
    }

    public CategoryScore get(CategoryKey key) {
        return categories.get(key);
    }
}
