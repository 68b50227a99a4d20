package com.openforge.devgauge.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.devgauge.config.AppConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new NormalizationEngine();
    }

    private static Map<String, RawCategory> scores(double activity, double skills, double growth, double collab) {
        Map<String, RawCategory> raw = new LinkedHashMap<>();
        raw.put("activity", RawCategory.of(activity));
        raw.put("skillSignals", RawCategory.of(skills));
        raw.put("growth", RawCategory.of(growth));
        raw.put("collaboration", RawCategory.of(collab));
        return raw;
    }

    @Test
    void shouldDeriveToastedForReferenceScores() {
        ScoredCategories scored = engine.normalize(scores(80, 70, 60, 50));

        assertEquals(7, scored.level());
        assertEquals(LevelName.TOASTED, scored.levelName());
        assertEquals(40, scored.get(CategoryKey.ACTIVITY).weight());
        assertEquals(30, scored.get(CategoryKey.SKILL_SIGNALS).weight());
    }

    @Test
    void shouldClampAndRoundScores() {
        ScoredCategories scored = engine.normalize(scores(140, -20, 59.5, 33.4));

        assertEquals(100, scored.get(CategoryKey.ACTIVITY).score());
        assertEquals(0, scored.get(CategoryKey.SKILL_SIGNALS).score());
        assertEquals(60, scored.get(CategoryKey.GROWTH).score());
        assertEquals(33, scored.get(CategoryKey.COLLABORATION).score());
    }

    @Test
    void shouldKeepWeightsSummingToHundred() {
        ScoredCategories scored = engine.normalize(scores(10, 20, 30, 40),
                Map.of("activity", 33.0, "skillSignals", 33.0, "growth", 20.0, "collaboration", 20.0));

        int sum = scored.categories().values().stream().mapToInt(CategoryScore::weight).sum();
        assertEquals(100, sum);
        // the largest weight absorbs the difference
        assertEquals(27, scored.get(CategoryKey.ACTIVITY).weight());
    }

    @Test
    void shouldFillMissingCategoryWithMeanOfPresent() {
        Map<String, RawCategory> raw = new LinkedHashMap<>();
        raw.put("activity", RawCategory.of(80));
        raw.put("skillSignals", RawCategory.of(80));
        raw.put("growth", RawCategory.of(80));

        ScoredCategories scored = engine.normalize(raw);

        assertEquals(80, scored.get(CategoryKey.COLLABORATION).score());
    }

    @Test
    void shouldUseNeutralScoreWhenNothingIsPresent() {
        ScoredCategories scored = engine.normalize(Map.of());

        scored.categories().values().forEach(cat -> assertEquals(NormalizationEngine.NEUTRAL_SCORE, cat.score()));
        assertEquals(5, scored.level());
    }

    @Test
    void shouldRejectOutOfRangeOverrideEntirely() {
        ScoredCategories scored = engine.normalize(scores(50, 50, 50, 50),
                Map.of("activity", 50.0, "skillSignals", 20.0, "growth", 15.0, "collaboration", 15.0));

        assertEquals(40, scored.get(CategoryKey.ACTIVITY).weight());
        assertEquals(30, scored.get(CategoryKey.SKILL_SIGNALS).weight());
        assertEquals(15, scored.get(CategoryKey.GROWTH).weight());
        assertEquals(15, scored.get(CategoryKey.COLLABORATION).weight());
    }

    @Test
    void shouldRejectIncompleteOverride() {
        ScoredCategories scored = engine.normalize(scores(50, 50, 50, 50),
                Map.of("activity", 35.0, "skillSignals", 35.0));

        assertEquals(engine.defaultWeights().get(CategoryKey.ACTIVITY), scored.get(CategoryKey.ACTIVITY).weight());
    }

    @Test
    void shouldResolveAliasedKeys() {
        Map<String, RawCategory> raw = new LinkedHashMap<>();
        raw.put("Skill_Signals", RawCategory.of(90));
        raw.put("collab", RawCategory.of(10));
        raw.put("unknown", RawCategory.of(0));

        ScoredCategories scored = engine.normalize(raw);

        assertEquals(90, scored.get(CategoryKey.SKILL_SIGNALS).score());
        assertEquals(10, scored.get(CategoryKey.COLLABORATION).score());
        // activity and growth take the mean of 90 and 10
        assertEquals(50, scored.get(CategoryKey.ACTIVITY).score());
    }

    @Test
    void shouldPreferCanonicalKeyOverAlias() {
        Map<String, RawCategory> raw = new LinkedHashMap<>();
        raw.put("skills", RawCategory.of(20));
        raw.put("skillSignals", RawCategory.of(70));

        assertEquals(70, engine.normalize(raw).get(CategoryKey.SKILL_SIGNALS).score());
    }

    @Test
    void shouldComputeScoreFromSubMetrics() {
        RawCategory activity = new RawCategory(10.0, "", List.of(
                new RawCategory.RawSubMetric("consistency", 80.0, 3.0),
                new RawCategory.RawSubMetric("volume", 40.0, 1.0)));
        Map<String, RawCategory> raw = new LinkedHashMap<>(scores(0, 50, 50, 50));
        raw.put("activity", activity);

        CategoryScore scored = engine.normalize(raw).get(CategoryKey.ACTIVITY);

        assertEquals(70, scored.score());
        assertEquals(2, scored.subMetrics().size());
        assertEquals(75, scored.subMetrics().get(0).weight());
        assertEquals(25, scored.subMetrics().get(1).weight());
    }

    @Test
    void shouldSplitSubMetricWeightsEquallyWhenAnyWeightMissing() {
        RawCategory growth = new RawCategory(null, "", List.of(
                new RawCategory.RawSubMetric("a", 10.0, 5.0),
                new RawCategory.RawSubMetric("b", 20.0, null),
                new RawCategory.RawSubMetric("c", 30.0, 1.0)));
        Map<String, RawCategory> raw = new LinkedHashMap<>(scores(50, 50, 0, 50));
        raw.put("growth", growth);

        CategoryScore scored = engine.normalize(raw).get(CategoryKey.GROWTH);

        assertEquals(100, scored.subMetrics().stream().mapToInt(SubMetric::weight).sum());
        assertEquals(20, scored.score());
    }

    @Test
    void shouldIgnoreSingleSubMetric() {
        RawCategory growth = new RawCategory(64.0, "", List.of(new RawCategory.RawSubMetric("only", 10.0, 100.0)));
        Map<String, RawCategory> raw = new LinkedHashMap<>(scores(50, 50, 0, 50));
        raw.put("growth", growth);

        CategoryScore scored = engine.normalize(raw).get(CategoryKey.GROWTH);

        assertEquals(64, scored.score());
        assertTrue(scored.subMetrics().isEmpty());
    }

    @Test
    void shouldBeIdempotentUnderRenormalization() {
        ScoredCategories first = engine.normalize(scores(91, 12, 77, 45),
                Map.of("activity", 25.0, "skillSignals", 25.0, "growth", 25.0, "collaboration", 25.0));

        ScoredCategories second = engine.renormalize(first);

        assertEquals(first.level(), second.level());
        assertEquals(first.levelName(), second.levelName());
        assertEquals(first.categories(), second.categories());
    }

    @Test
    void shouldMapEveryLevelToExactlyOneName() {
        LevelName previous = LevelName.BURNT;
        for (int level = 0; level <= 10; level++) {
            LevelName name = LevelName.forLevel(level);
            assertTrue(name.ordinal() >= previous.ordinal());
            previous = name;
        }
        assertEquals(LevelName.BURNT, LevelName.forLevel(2));
        assertEquals(LevelName.WELL_DONE, LevelName.forLevel(3));
        assertEquals(LevelName.COOKED, LevelName.forLevel(5));
        assertEquals(LevelName.TOASTED, LevelName.forLevel(7));
        assertEquals(LevelName.COOKING, LevelName.forLevel(9));
    }

    @Test
    void shouldReportMissingCategoriesInCanonicalOrder() {
        Map<String, RawCategory> raw = new LinkedHashMap<>();
        raw.put("growth", RawCategory.of(50));
        raw.put("activity", new RawCategory(null, "no score", List.of()));

        assertEquals(List.of(CategoryKey.ACTIVITY, CategoryKey.SKILL_SIGNALS, CategoryKey.COLLABORATION),
                engine.missingCategories(raw));
    }

    @Test
    void shouldRejectInvalidDefaultWeights() {
        assertThrows(IllegalArgumentException.class,
                () -> new NormalizationEngine(Map.of(CategoryKey.ACTIVITY, 100)));
    }
    @Test
    void shouldTreatNonFiniteScoreAsMissing() {
        Map<String, RawCategory> raw = scores(80, 80, 80, Double.NaN);

        ScoredCategories scored = engine.normalize(raw);

        assertEquals(80, scored.get(CategoryKey.COLLABORATION).score());
        assertEquals(List.of(CategoryKey.COLLABORATION), engine.missingCategories(raw));
    }

    @Test
    void shouldIgnoreNonFiniteSubMetricScores() {
        Map<String, RawCategory> raw = scores(60, 60, 60, 60);
        raw.put("growth", new RawCategory(null, "", List.of(
                new RawCategory.RawSubMetric("new languages", 90.0, 50.0),
                new RawCategory.RawSubMetric("complexity", Double.POSITIVE_INFINITY, 50.0))));

        ScoredCategories scored = engine.normalize(raw);

        assertEquals(60, scored.get(CategoryKey.GROWTH).score());
        assertTrue(scored.get(CategoryKey.GROWTH).subMetrics().isEmpty());
        assertEquals(List.of(CategoryKey.GROWTH), engine.missingCategories(raw));
    }

    @Test
    void shouldRederiveLevelOfSuppliedResult() throws Exception {
        ObjectMapper mapper = new AppConfig().objectMapper();
        AnalysisResult supplied = mapper.readValue("""
                {"level": 2, "level_name": "Burnt", "summary": "Earlier run",
                 "category_scores": {"activity": {"score": 90}, "growth": {"score": 70}}}""",
                AnalysisResult.class);

        AnalysisResult rescored = engine.rescore(supplied);

        assertEquals(CategoryKey.values().length, rescored.categoryScores().size());
        assertEquals(80, rescored.categoryScores().get(CategoryKey.SKILL_SIGNALS).score());
        assertEquals(80, rescored.categoryScores().get(CategoryKey.COLLABORATION).score());
        assertEquals(40, rescored.categoryScores().get(CategoryKey.ACTIVITY).weight());
        assertEquals(8, rescored.level());
        assertSame(LevelName.TOASTED, rescored.levelName());
        assertEquals("Earlier run", rescored.summary());
    }

    @Test
    void shouldFillLevelNameWhenSuppliedResultOmitsIt() throws Exception {
        ObjectMapper mapper = new AppConfig().objectMapper();
        AnalysisResult supplied = mapper.readValue(
                "{\"level\": 9, \"category_scores\": {\"activity\": {\"score\": 10}}}", AnalysisResult.class);

        AnalysisResult rescored = engine.rescore(supplied);

        assertEquals(1, rescored.level());
        assertSame(LevelName.BURNT, rescored.levelName());
        assertEquals(10, rescored.categoryScores().get(CategoryKey.GROWTH).score());
    }
}
