package com.openforge.devgauge.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Synthesis-phase response:
 * {summary, recommendations[], projectsInsight, languageInsight, activityInsight}.
 * A nested {"insights": {projects, language, activity}} block is also accepted.
 */
public record SynthesisPayload(
        String summary,
        List<String> recommendations,
        Insights insights
) {

    /** Empty when the value is not an object or carries no summary. */
    public static Optional<SynthesisPayload> from(@Nullable JsonNode root) {
        if (root == null || !root.isObject()) return Optional.empty();
        String summary = root.path("summary").asText("").trim();
        if (summary.isEmpty()) return Optional.empty();

        List<String> recommendations = new ArrayList<>();
        for (JsonNode rec : root.path("recommendations")) {
            String text = rec.isTextual() ? rec.asText().trim() : rec.path("title").asText("").trim();
            if (!text.isEmpty()) recommendations.add(text);
        }

        JsonNode nested = root.path("insights");
        Insights insights = new Insights(
                firstText(root.path("projectsInsight"), nested.path("projects")),
                firstText(root.path("languageInsight"), nested.path("language")),
                firstText(root.path("activityInsight"), nested.path("activity")));
        return Optional.of(new SynthesisPayload(summary, List.copyOf(recommendations), insights));
    }

    private static String firstText(JsonNode primary, JsonNode secondary) {
        String text = primary.asText("").trim();
        return text.isEmpty() ? secondary.asText("").trim() : text;
    }
}
