package com.openforge.devgauge.memory;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Memory-extraction response: {goals[], insights[], summary}.
 * Non-textual and blank entries are dropped.
 */
public record ExtractionPayload(
        List<String> goals,
        List<String> insights,
        String summary
) {

    public ExtractionPayload {
        goals    = goals == null ? List.of() : List.copyOf(goals);
        insights = insights == null ? List.of() : List.copyOf(insights);
        summary  = summary == null ? "" : summary.trim();
    }

    public static ExtractionPayload from(@Nullable JsonNode root) {
        if (root == null || !root.isObject()) return new ExtractionPayload(List.of(), List.of(), "");
        return new ExtractionPayload(
                texts(root.path("goals")),
                texts(root.path("insights")),
                root.path("summary").isTextual() ? root.path("summary").asText() : "");
    }

    public boolean isEmpty() {
        return goals.isEmpty() && insights.isEmpty() && summary.isEmpty();
    }

    /** Goals, then insights, then the summary, all stamped {@code at}. */
    public List<MemoryItem> toItems(Instant at) {
        List<MemoryItem> items = new ArrayList<>();
        goals.forEach(g -> items.add(MemoryItem.of(MemoryType.GOAL, g, at)));
        insights.forEach(i -> items.add(MemoryItem.of(MemoryType.INSIGHT, i, at)));
        if (!summary.isEmpty()) items.add(MemoryItem.of(MemoryType.SUMMARY, summary, at));
        return items;
    }

    private static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (!array.isArray()) return out;
        for (JsonNode node : array) {
            if (node.isTextual() && !node.asText().isBlank()) out.add(node.asText().trim());
        }
        return out;
    }
}
