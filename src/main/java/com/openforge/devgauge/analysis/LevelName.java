package com.openforge.devgauge.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Five-tier label derived from the 0-10 level.
 * Thresholds: 9 Cooking, 7 Toasted, 5 Cooked, 3 Well-Done, below that Burnt.
 */
public enum LevelName {

    BURNT("Burnt", 0),
    WELL_DONE("Well-Done", 3),
    COOKED("Cooked", 5),
    TOASTED("Toasted", 7),
    COOKING("Cooking", 9);

    private final String label;
    private final int    minLevel;

    LevelName(String label, int minLevel) {
        this.label    = label;
        this.minLevel = minLevel;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int minLevel() {
        return minLevel;
    }

    /** Total over all ints: anything below 3 is Burnt, anything from 9 up is Cooking. */
    public static LevelName forLevel(int level) {
        if (level >= COOKING.minLevel)   return COOKING;
        if (level >= TOASTED.minLevel)   return TOASTED;
        if (level >= COOKED.minLevel)    return COOKED;
        if (level >= WELL_DONE.minLevel) return WELL_DONE;
        return BURNT;
    }

    @JsonCreator
    public static LevelName fromLabel(String label) {
        for (LevelName name : values()) {
            if (name.label.equalsIgnoreCase(label) || name.name().equalsIgnoreCase(label)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown level name: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
