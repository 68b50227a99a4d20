package com.openforge.devgauge.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scoring-phase response, coerced from whatever JSON the model produced.
 *
 * Expected shape:
 * <pre>
 * {"categoryScores": {"activity": {"score": 72, "notes": "...", "weight": 40,
 *                                  "subMetrics": [{"name": "...", "score": 80, "weight": 50}]}, ...}}
 * </pre>
 * A bare number is accepted in place of the category object. Keys are kept
 * raw; aliasing happens in {@link NormalizationEngine}. {@code weights} holds a
 * key only for categories that mentioned a weight; a null value there means the
 * weight was present but not numeric.
 */
public record ScoringPayload(
        Map<String, RawCategory> categories,
        Map<String, Double> weights
) {

    public ScoringPayload {
        categories = categories == null ? Map.of() : categories;
        weights    = weights == null ? Map.of() : weights;
    }

    public static ScoringPayload empty() {
        return new ScoringPayload(Map.of(), Map.of());
    }

    /** Coerces an extracted JSON value; anything that is not an object yields an empty payload. */
    public static ScoringPayload from(@Nullable JsonNode root) {
        if (root == null || !root.isObject()) return empty();

        JsonNode cats = root.path("categoryScores");
        if (!cats.isObject()) cats = root.path("category_scores");
        if (!cats.isObject()) cats = root;

        Map<String, RawCategory> categories = new LinkedHashMap<>();
        Map<String, Double> weights = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = cats.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (CategoryKey.resolve(field.getKey()).isEmpty()) continue;
            JsonNode value = field.getValue();

            if (value.isNumber()) {
                categories.put(field.getKey(), new RawCategory(number(value), "", List.of()));
                continue;
            }
            if (!value.isObject()) {
                categories.put(field.getKey(), new RawCategory(null, "", List.of()));
                continue;
            }
            categories.put(field.getKey(), new RawCategory(
                    number(value.get("score")),
                    value.path("notes").asText(""),
                    subMetrics(value.path("subMetrics").isArray()
                            ? value.path("subMetrics") : value.path("sub_metrics"))));
            if (value.has("weight")) {
                weights.put(field.getKey(), number(value.get("weight")));
            }
        }
        return new ScoringPayload(categories, weights);
    }

    /**
     * Merges a retry response into this one: retried categories replace the
     * originals, everything else is kept.
     */
    public ScoringPayload mergedWith(ScoringPayload retry) {
        Map<String, RawCategory> mergedCats = new LinkedHashMap<>(categories);
        Map<String, Double> mergedWeights = new LinkedHashMap<>(weights);
        mergedCats.putAll(retry.categories());
        mergedWeights.putAll(retry.weights());
        return new ScoringPayload(mergedCats, mergedWeights);
    }

    private static List<RawCategory.RawSubMetric> subMetrics(JsonNode array) {
        if (!array.isArray()) return List.of();
        List<RawCategory.RawSubMetric> out = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isObject()) continue;
            out.add(new RawCategory.RawSubMetric(
                    item.path("name").asText(""),
                    number(item.get("score")),
                    number(item.get("weight"))));
        }
        return out;
    }

    @Nullable
    private static Double number(@Nullable JsonNode node) {
        if (node == null || !node.isNumber()) return null;
        double d = node.asDouble();
        return Double.isFinite(d) ? d : null;
    }
}
