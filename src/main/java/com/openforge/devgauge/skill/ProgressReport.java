package com.openforge.devgauge.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.devgauge.analysis.LevelName;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of {@code compareProgress}. Levels come from the normalization
 * engine; only the lists and the summary are written by the model.
 */
public record ProgressReport(
        int level,
        LevelName levelName,
        int previousLevel,
        LevelChange levelChange,
        List<String> improvements,
        List<String> regressions,
        String summary,
        List<String> nextSteps
) {

    public enum LevelChange {
        POSITIVE, NEGATIVE, NEUTRAL;

        public static LevelChange between(int previous, int current) {
            if (current > previous) return POSITIVE;
            if (current < previous) return NEGATIVE;
            return NEUTRAL;
        }
    }

    public ProgressReport {
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
        regressions  = regressions == null ? List.of() : List.copyOf(regressions);
        nextSteps    = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        summary      = summary == null ? "" : summary;
    }

    /** Narrative fields from the model's JSON; level fields from the caller. */
    static ProgressReport from(JsonNode root, int level, LevelName levelName, int previousLevel) {
        return new ProgressReport(level, levelName, previousLevel,
                LevelChange.between(previousLevel, level),
                texts(root.path("improvements")),
                texts(root.path("regressions")),
                root.path("summary").asText("").trim(),
                texts(root.path("nextSteps")));
    }

    private static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode node : array) {
            if (node.isTextual() && !node.asText().isBlank()) out.add(node.asText().trim());
        }
        return out;
    }
}
