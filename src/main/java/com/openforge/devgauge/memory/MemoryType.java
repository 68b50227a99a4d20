package com.openforge.devgauge.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Classifies a long-term memory entry.
 *
 * GOAL:    a career or learning goal the user stated
 * INSIGHT: an observation about the user's profile or habits
 * ACTION:  a recommendation being tracked, with its status in meta
 * SUMMARY: compressed summary of a past conversation
 * The remaining types are free-form buckets.
 */
public enum MemoryType {
    INSIGHT("Insights"),
    SUMMARY("Summaries"),
    GOAL("Goals"),
    ACTION("Actions"),
    PREFERENCE("Preferences"),
    SKILL("Skills"),
    FEEDBACK("Feedback"),
    MILESTONE("Milestones"),
    CONTEXT("Context");

    /** Bucket order used when rendering memory into a prompt. */
    public static final List<MemoryType> RENDER_ORDER = List.of(
            GOAL, INSIGHT, ACTION, SUMMARY, PREFERENCE, SKILL, FEEDBACK, MILESTONE, CONTEXT);

    private final String bucketLabel;

    MemoryType(String bucketLabel) {
        this.bucketLabel = bucketLabel;
    }

    public String bucketLabel() {
        return bucketLabel;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MemoryType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
