package com.openforge.devgauge.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The four scored axes, with their default weights.
 *
 * Raw keys coming back from the model are matched case- and
 * punctuation-insensitively, then through a fixed alias table.
 */
public enum CategoryKey {

    ACTIVITY("activity", 40),
    SKILL_SIGNALS("skillSignals", 30),
    GROWTH("growth", 15),
    COLLABORATION("collaboration", 15);

    private static final Map<String, CategoryKey> ALIASES = Map.ofEntries(
            Map.entry("activity", ACTIVITY),
            Map.entry("activities", ACTIVITY),
            Map.entry("skillsignals", SKILL_SIGNALS),
            Map.entry("skillsignal", SKILL_SIGNALS),
            Map.entry("skill", SKILL_SIGNALS),
            Map.entry("skills", SKILL_SIGNALS),
            Map.entry("growth", GROWTH),
            Map.entry("grow", GROWTH),
            Map.entry("collaboration", COLLABORATION),
            Map.entry("collaborations", COLLABORATION),
            Map.entry("collab", COLLABORATION)
    );

    private final String key;
    private final int    defaultWeight;

    CategoryKey(String key, int defaultWeight) {
        this.key           = key;
        this.defaultWeight = defaultWeight;
    }

    @JsonValue
    @JsonKey
    public String key() {
        return key;
    }

    public int defaultWeight() {
        return defaultWeight;
    }

    /**
     * Resolves a raw key such as "Skill_Signals", "skill-signals" or "collab".
     * Unknown keys resolve to empty.
     */
    public static Optional<CategoryKey> resolve(String raw) {
        if (raw == null) return Optional.empty();
        String folded = raw.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]", "");
        return Optional.ofNullable(ALIASES.get(folded));
    }

    @JsonCreator
    public static CategoryKey fromKey(String raw) {
        return resolve(raw).orElseThrow(
                () -> new IllegalArgumentException("Unknown category: " + raw));
    }

    @Override
    public String toString() {
        return key;
    }
}
