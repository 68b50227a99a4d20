package com.openforge.devgauge.skill;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Phased roadmap returned by {@code generateLearningPath}.
 */
public record LearningPath(
        String targetRole,
        String estimatedTimeframe,
        List<Phase> phases,
        List<String> resources
) {

    public record Phase(int phase, String duration, String focus, List<Milestone> milestones) {}

    public record Milestone(String title, List<String> skills, String deliverable, String successCriteria) {}

    public LearningPath {
        phases    = phases == null ? List.of() : List.copyOf(phases);
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    /** Phases without a number are numbered by position. */
    static LearningPath from(JsonNode root) {
        List<Phase> phases = new ArrayList<>();
        int position = 0;
        for (JsonNode p : root.path("phases")) {
            position++;
            List<Milestone> milestones = new ArrayList<>();
            for (JsonNode m : p.path("milestones")) {
                String title = text(m, "title");
                if (title.isEmpty()) continue;
                milestones.add(new Milestone(title, texts(m.path("skills")),
                        text(m, "deliverable"), text(m, "successCriteria")));
            }
            int number = p.path("phase").canConvertToInt() ? p.path("phase").asInt(position) : position;
            phases.add(new Phase(number, text(p, "duration"), text(p, "focus"), List.copyOf(milestones)));
        }
        return new LearningPath(text(root, "targetRole"), text(root, "estimatedTimeframe"),
                phases, texts(root.path("resources")));
    }

    private static String text(JsonNode node, String field) {
        return node.path(field).asText("").trim();
    }

    private static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode node : array) {
            String value = node.isTextual() ? node.asText() : node.path("title").asText("");
            if (!value.isBlank()) out.add(value.trim());
        }
        return List.copyOf(out);
    }
}
