package com.openforge.devgauge.analysis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns a raw, possibly incomplete category map into a complete, clamped,
 * weighted set of scores and derives the level from it.
 *
 * Rules, in order:
 * <ol>
 *   <li>Keys are resolved through {@link CategoryKey#resolve}; unknown keys are dropped.</li>
 *   <li>A category with at least two named, scored sub-metrics takes their weighted
 *       average as its score, replacing any top-level score.</li>
 *   <li>Scores are clamped to [0,100] and rounded half-up.</li>
 *   <li>A category without a valid score gets the mean of the valid ones, or 50.</li>
 *   <li>Weights come from the override when it is complete and every value is in
 *       [15,45], after forcing the sum to 100 through the largest weight; otherwise
 *       from the defaults. Overrides are all-or-nothing.</li>
 *   <li>level = round(sum(weight * score) / 1000), clamped to [0,10].</li>
 * </ol>
 * Nothing here throws on bad input; malformed values fall back silently.
 * The result depends only on the input map, not on its iteration order.
 */
@Slf4j
@Component
public class NormalizationEngine {

    public static final int MIN_WEIGHT     = 15;
    public static final int MAX_WEIGHT     = 45;
    public static final int NEUTRAL_SCORE  = 50;

    private final Map<CategoryKey, Integer> defaultWeights;

    public NormalizationEngine() {
        this(defaultWeightTable());
    }

    public NormalizationEngine(Map<CategoryKey, Integer> defaultWeights) {
        EnumMap<CategoryKey, Integer> copy = new EnumMap<>(CategoryKey.class);
        copy.putAll(defaultWeights);
        if (copy.size() != CategoryKey.values().length
                || copy.values().stream().mapToInt(Integer::intValue).sum() != 100) {
            throw new IllegalArgumentException("Default weights must cover every category and sum to 100");
        }
        this.defaultWeights = copy;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ScoredCategories normalize(Map<String, RawCategory> raw) {
        return normalize(raw, null);
    }

    public ScoredCategories normalize(Map<String, RawCategory> raw,
                                      @Nullable Map<String, Double> weightOverride) {
        Map<CategoryKey, RawCategory> canonical = canonicalize(raw);

        Map<CategoryKey, Integer> effectiveScores = new EnumMap<>(CategoryKey.class);
        Map<CategoryKey, List<SubMetric>> subMetrics = new EnumMap<>(CategoryKey.class);
        for (Map.Entry<CategoryKey, RawCategory> entry : canonical.entrySet()) {
            RawCategory cat = entry.getValue();
            Optional<List<SubMetric>> subs = normalizeSubMetrics(cat.subMetrics());
            if (subs.isPresent()) {
                subMetrics.put(entry.getKey(), subs.get());
                effectiveScores.put(entry.getKey(), weightedAverage(subs.get()));
            } else if (isUsable(cat.score())) {
                effectiveScores.put(entry.getKey(), clampScore(cat.score()));
            }
        }

        int fallback = effectiveScores.isEmpty()
                ? NEUTRAL_SCORE
                : (int) Math.round(effectiveScores.values().stream()
                        .mapToInt(Integer::intValue).average().orElse(NEUTRAL_SCORE));

        Map<CategoryKey, Integer> weights = resolveWeights(weightOverride);

        Map<CategoryKey, CategoryScore> categories = new EnumMap<>(CategoryKey.class);
        for (CategoryKey key : CategoryKey.values()) {
            RawCategory cat = canonical.get(key);
            String notes = cat == null || cat.notes() == null ? "" : cat.notes().trim();
            categories.put(key, new CategoryScore(
                    key,
                    effectiveScores.getOrDefault(key, fallback),
                    weights.get(key),
                    notes,
                    subMetrics.getOrDefault(key, List.of())));
        }

        int level = deriveLevel(categories);
        return new ScoredCategories(categories, level, LevelName.forLevel(level));
    }

    /** Re-runs normalization over an already-normalized set, keeping its weights. */
    public ScoredCategories renormalize(ScoredCategories scored) {
        Map<String, RawCategory> raw = new LinkedHashMap<>();
        Map<String, Double> weights = new LinkedHashMap<>();
        scored.categories().forEach((key, cat) -> {
            if (key == null || cat == null) return;
            raw.put(key.key(), RawCategory.of(cat));
            weights.put(key.key(), (double) cat.weight());
        });
        return normalize(raw, weights);
    }

    /**
     * Recomputes the categories, level and level name of a result that came from
     * outside the scoring pipeline (a caller's prior result, a stored chat). The
     * narrative is kept as is.
     */
    public AnalysisResult rescore(AnalysisResult result) {
        ScoredCategories scored = renormalize(result.scored());
        if (scored.level() != result.level() || scored.levelName() != result.levelName()) {
            log.debug("[Normalize] Replacing supplied level {} ({}) with {} ({})",
                    result.level(), result.levelName(), scored.level(), scored.levelName());
        }
        return result.withScores(scored);
    }

    /**
     * Categories that are absent or carry no usable finite score (directly or
     * through sub-metrics), in canonical order.
     */
    public List<CategoryKey> missingCategories(Map<String, RawCategory> raw) {
        Map<CategoryKey, RawCategory> canonical = canonicalize(raw);
        List<CategoryKey> missing = new ArrayList<>();
        for (CategoryKey key : CategoryKey.values()) {
            RawCategory cat = canonical.get(key);
            boolean usable = cat != null
                    && (isUsable(cat.score()) || normalizeSubMetrics(cat.subMetrics()).isPresent());
            if (!usable) missing.add(key);
        }
        return missing;
    }

    public static int deriveLevel(Map<CategoryKey, CategoryScore> categories) {
        long weightedSum = 0;
        for (CategoryScore cat : categories.values()) {
            weightedSum += (long) cat.weight() * cat.score();
        }
        // weightedSum is score*weight, i.e. 100x the 0-100 weighted average
        int level = (int) Math.round(weightedSum / 1000.0);
        return Math.max(0, Math.min(10, level));
    }

    public Map<CategoryKey, Integer> defaultWeights() {
        return Map.copyOf(defaultWeights);
    }

    // ── Weights ──────────────────────────────────────────────────────────────

    Map<CategoryKey, Integer> resolveWeights(@Nullable Map<String, Double> override) {
        if (override == null || override.isEmpty()) return defaultWeights;

        Map<CategoryKey, Integer> candidate = new EnumMap<>(CategoryKey.class);
        for (Map.Entry<String, Double> entry : override.entrySet()) {
            Optional<CategoryKey> key = CategoryKey.resolve(entry.getKey());
            if (key.isEmpty()) continue;
            Double value = entry.getValue();
            if (value == null || !Double.isFinite(value) || value < MIN_WEIGHT || value > MAX_WEIGHT) {
                log.debug("[Normalize] Rejecting weight override, {}={}", entry.getKey(), value);
                return defaultWeights;
            }
            candidate.put(key.get(), (int) Math.round(value));
        }
        if (candidate.size() != CategoryKey.values().length) {
            log.debug("[Normalize] Rejecting weight override, only {} of {} categories present",
                    candidate.size(), CategoryKey.values().length);
            return defaultWeights;
        }

        int sum = candidate.values().stream().mapToInt(Integer::intValue).sum();
        if (sum != 100) {
            CategoryKey largest = CategoryKey.ACTIVITY;
            for (CategoryKey key : CategoryKey.values()) {
                if (candidate.get(key) > candidate.get(largest)) largest = key;
            }
            int adjusted = candidate.get(largest) + (100 - sum);
            if (adjusted < MIN_WEIGHT || adjusted > MAX_WEIGHT) {
                log.debug("[Normalize] Rejecting weight override, cannot rebalance sum {}", sum);
                return defaultWeights;
            }
            candidate.put(largest, adjusted);
        }
        return candidate;
    }

    // ── Sub-metrics ──────────────────────────────────────────────────────────

    /**
     * Present only when at least two sub-metrics have a name and a score.
     * Weights are rescaled to integers summing to 100; if any weight is missing
     * or non-positive, every sub-metric gets an equal share.
     */
    Optional<List<SubMetric>> normalizeSubMetrics(List<RawCategory.RawSubMetric> raw) {
        List<RawCategory.RawSubMetric> valid = raw.stream()
                .filter(s -> s.name() != null && !s.name().isBlank() && isUsable(s.score()))
                .toList();
        if (valid.size() < 2) return Optional.empty();

        boolean weightsUsable = valid.stream()
                .allMatch(s -> s.weight() != null && Double.isFinite(s.weight()) && s.weight() > 0);
        double[] shares = new double[valid.size()];
        double total = 0;
        for (int i = 0; i < valid.size(); i++) {
            shares[i] = weightsUsable ? valid.get(i).weight() : 1.0;
            total += shares[i];
        }
        int[] percent = toPercentages(shares, total);

        List<SubMetric> out = new ArrayList<>(valid.size());
        for (int i = 0; i < valid.size(); i++) {
            RawCategory.RawSubMetric s = valid.get(i);
            out.add(new SubMetric(s.name().trim(), clampScore(s.score()), percent[i]));
        }
        return Optional.of(List.copyOf(out));
    }

    private static int weightedAverage(List<SubMetric> subs) {
        long sum = 0;
        for (SubMetric s : subs) {
            sum += (long) s.score() * s.weight();
        }
        return clampScore(sum / 100.0);
    }

    /** Largest-remainder rounding, so the integer shares always add up to 100. */
    private static int[] toPercentages(double[] shares, double total) {
        int[] out = new int[shares.length];
        double[] remainders = new double[shares.length];
        int assigned = 0;
        for (int i = 0; i < shares.length; i++) {
            double exact = shares[i] * 100.0 / total;
            out[i] = (int) Math.floor(exact);
            remainders[i] = exact - out[i];
            assigned += out[i];
        }
        for (int left = 100 - assigned; left > 0; left--) {
            int best = 0;
            for (int i = 1; i < remainders.length; i++) {
                if (remainders[i] > remainders[best]) best = i;
            }
            out[best]++;
            remainders[best] = -1;
        }
        return out;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Map<CategoryKey, RawCategory> canonicalize(@Nullable Map<String, RawCategory> raw) {
        Map<CategoryKey, RawCategory> out = new EnumMap<>(CategoryKey.class);
        if (raw == null) return out;
        // Exact canonical keys win over aliases; among aliases the first in sorted order
        new TreeMap<>(raw).forEach((name, cat) -> CategoryKey.resolve(name).ifPresent(key -> {
            if (cat == null) return;
            boolean exact = key.key().equals(name);
            if (exact || !out.containsKey(key)) out.put(key, cat);
        }));
        return out;
    }

    /** NaN and infinities count as absent. */
    private static boolean isUsable(@Nullable Double score) {
        return score != null && Double.isFinite(score);
    }

    private static int clampScore(double score) {
        long rounded = Math.round(score);
        return (int) Math.max(0, Math.min(100, rounded));
    }

    private static Map<CategoryKey, Integer> defaultWeightTable() {
        Map<CategoryKey, Integer> table = new EnumMap<>(CategoryKey.class);
        for (CategoryKey key : CategoryKey.values()) {
            table.put(key, key.defaultWeight());
        }
        return table;
    }
}
