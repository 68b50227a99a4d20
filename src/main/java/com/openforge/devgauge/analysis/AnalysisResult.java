package com.openforge.devgauge.analysis;

import java.util.List;
import java.util.Map;

/**
 * The full assessment returned to callers.
 *
 * {@code level} and {@code levelName} always come from the category scores,
 * never from model output. A result deserialized from a request or a stored
 * chat is trusted only after {@link NormalizationEngine#rescore}.
 */
public record AnalysisResult(
        Map<CategoryKey, CategoryScore> categoryScores,
        int level,
        LevelName levelName,
        String summary,
        List<String> recommendations,
        Insights insights
) {

    public AnalysisResult {
        categoryScores  = categoryScores == null ? Map.of() : categoryScores;
        summary         = summary == null ? "" : summary;
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        insights        = insights == null ? Insights.empty() : insights;
    }

    public static AnalysisResult of(ScoredCategories scored, SynthesisPayload narrative) {
        return new AnalysisResult(
                scored.categories(),
                scored.level(),
                scored.levelName(),
                narrative.summary(),
                narrative.recommendations(),
                narrative.insights());
    }

    /** Same narrative over a different score set. */
    public AnalysisResult withScores(ScoredCategories scored) {
        return new AnalysisResult(
                scored.categories(),
                scored.level(),
                scored.levelName(),
                summary,
                recommendations,
                insights);
    }

    /** The scoring-phase view of this result, for re-normalization and progress comparison. */
    public ScoredCategories scored() {
        return new ScoredCategories(categoryScores, level, levelName);
    }
}
