package com.openforge.devgauge.analysis;

import com.openforge.devgauge.plan.MetricsDetail;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders the profile, the metrics record and analysis results as prompt text.
 *
 * Metrics are an opaque map keyed by the provider's field names. Absent values
 * render as "N/A". With {@link MetricsDetail#SUMMARY} the detailed fields are
 * left out entirely, so the model cannot quote them.
 */
public final class MetricsFormatter {

    /** Fields only shown with {@link MetricsDetail#FULL}. */
    public static final Set<String> DETAILED_FIELDS = Set.of(
            "commitsLast90", "prevYearCommits", "activeWeeksPct", "avgCommitsPerActiveWeek",
            "stdDevPerWeek", "longestInactiveGap", "topLanguageDominancePct", "categoryPercentages",
            "repoCategoryBreakdown", "activityMomentumRatio", "domainDiversityChange",
            "openIssues", "closedIssues", "issuesClosedRatio");

    private static final Map<LevelName, String> LEVEL_DESCRIPTIONS = Map.of(
            LevelName.COOKING, "top tier (9-10/10), highly competitive",
            LevelName.TOASTED, "above average (7-8/10), solid with some gaps",
            LevelName.COOKED, "below average (5-6/10), needs focused effort",
            LevelName.WELL_DONE, "significantly below average (3-4/10), not yet competitive",
            LevelName.BURNT, "near-dormant (0-2/10), essentially no activity");

    private MetricsFormatter() {}

    public static String format(Map<String, Object> metrics, DeveloperProfile profile, MetricsDetail detail) {
        Map<String, Object> m = metrics == null ? Map.of() : metrics;
        DeveloperProfile p = profile == null ? DeveloperProfile.empty() : profile;
        boolean full = detail == MetricsDetail.FULL;
        StringBuilder sb = new StringBuilder();

        sb.append("## USER PROFILE\n");
        line(sb, "Age", orDefault(p.age(), "Unknown"));
        line(sb, "Education", p.educationLabel());
        line(sb, "Experience", p.experienceLabel());
        line(sb, "Current Status", orDefault(p.currentRole(), "Unknown"));
        line(sb, "Career Goal", orDefault(p.careerGoal(), "Not specified"));
        line(sb, "Technical Skills", orDefault(p.technicalSkills(), "Not specified"));
        if (notBlank(p.technicalInterests())) line(sb, "Technical Interests", p.technicalInterests());
        if (notBlank(p.hobbies())) line(sb, "Hobbies", p.hobbies());

        sb.append("\n## METRICS\n");

        sb.append("\n### Activity (40% of score)\n");
        line(sb, "Commits last 365 days", value(m, "commitsLast365", value(m, "totalCommits", "N/A")));
        if (full) {
            line(sb, "Commits last 90 days", value(m, "commitsLast90", "N/A"));
            line(sb, "Previous year commits", value(m, "prevYearCommits", "N/A"));
            line(sb, "Active weeks %", value(m, "activeWeeksPct", "N/A") + "% (out of 52 weeks)");
            line(sb, "Avg commits per active week", value(m, "avgCommitsPerActiveWeek", "N/A"));
            line(sb, "Std deviation per week", value(m, "stdDevPerWeek", "N/A") + " (lower = more consistent)");
            line(sb, "Longest inactive gap", value(m, "longestInactiveGap", "N/A") + " days");
        }
        line(sb, "Contribution streak", value(m, "streak", "0") + " days");

        sb.append("\n### Collaboration (15% of score)\n");
        line(sb, "Total PRs created", value(m, "totalPRs", "0"));
        line(sb, "Merged PRs", value(m, "mergedPRs", "N/A"));
        if (full) {
            line(sb, "Open issues", value(m, "openIssues", "N/A"));
            line(sb, "Closed issues", value(m, "closedIssues", "N/A"));
            line(sb, "Issues closed ratio", value(m, "issuesClosedRatio", "N/A") + " (closed / opened+1)");
        }

        sb.append("\n### Skill Signals (30% of score)\n");
        line(sb, "Total repositories", value(m, "totalRepos", "N/A"));
        line(sb, "Unique languages", value(m, "languageCount", languageCount(m)));
        line(sb, "Top languages", value(m, "languages", "Unknown"));
        if (full) {
            line(sb, "Top language dominance", value(m, "topLanguageDominancePct", "N/A") + "% of codebase");
            line(sb, "Tech domain breakdown (% codebase)", percentages(m.get("categoryPercentages")));
            line(sb, "Repos by dominant domain", pairs(m.get("repoCategoryBreakdown")));
        }
        line(sb, "Stars received", value(m, "totalStars", "0"));
        line(sb, "Forks", value(m, "totalForks", "0"));

        sb.append("\n### Growth (15% of score)\n");
        line(sb, "Commit velocity trend", value(m, "commitVelocityTrend", "N/A") + " (>1 = accelerating vs prior year)");
        if (full) {
            line(sb, "Activity momentum ratio", value(m, "activityMomentumRatio", "N/A") + " (~1 = steady, >1 = ramping up)");
            line(sb, "Domain diversity change", value(m, "domainDiversityChange", "N/A") + " distinct tech domains added vs prior year");
        }
        return sb.toString().trim();
    }

    /** The scoring-phase result stated as authoritative, for the synthesis prompt. */
    public static String lockedLevel(ScoredCategories scored) {
        StringBuilder sb = new StringBuilder("## PRE-COMPUTED SCORES (authoritative, do not re-score)\n");
        sb.append("- Level: ").append(scored.level()).append("/10, Level Name: \"")
                .append(scored.levelName().label()).append("\" (")
                .append(LEVEL_DESCRIPTIONS.get(scored.levelName())).append(")\n");
        sb.append("- The level name above is final. Use exactly \"").append(scored.levelName().label())
                .append("\" and do not derive a different one.\n");
        sb.append("- Scale reminder: Burnt < Well-Done < Cooked < Toasted < Cooking (higher = better)\n");
        appendCategories(sb, scored.categories());
        return sb.toString().trim();
    }

    /** An existing result, as conversational context. */
    public static String analysis(AnalysisResult result) {
        StringBuilder sb = new StringBuilder("## CURRENT ANALYSIS RESULTS (pre-computed, do not re-score)\n");
        LevelName name = levelName(result);
        sb.append("- Level: ").append(result.level()).append("/10, Level Name: \"")
                .append(name.label()).append("\" (")
                .append(LEVEL_DESCRIPTIONS.get(name)).append(")\n");
        sb.append("- Scale reminder: Burnt < Well-Done < Cooked < Toasted < Cooking (higher = better)\n");
        if (notBlank(result.summary())) sb.append("- Summary: ").append(result.summary()).append('\n');
        appendCategories(sb, result.categoryScores());
        if (!result.recommendations().isEmpty()) {
            sb.append("- Recommendations already given to user:\n");
            result.recommendations().forEach(r -> sb.append("  • ").append(r).append('\n'));
        }
        return sb.toString().trim();
    }

    private static LevelName levelName(AnalysisResult result) {
        return result.levelName() != null ? result.levelName() : LevelName.forLevel(result.level());
    }

    /** A prior result, for progress comparison. */
    public static String previousAnalysis(AnalysisResult previous) {
        StringBuilder sb = new StringBuilder("## PREVIOUS ANALYSIS (for comparison)\n");
        sb.append("- Previous Level: ").append(previous.level()).append("/10 (")
                .append(levelName(previous).label()).append(")\n");
        if (notBlank(previous.summary())) sb.append("- Previous Summary: ").append(previous.summary()).append('\n');
        previous.categoryScores().forEach((key, cat) ->
                sb.append("- Previous ").append(key.key()).append(": ").append(cat.score()).append("/100\n"));
        if (!previous.recommendations().isEmpty()) {
            sb.append("- Previous Recommendations: ")
                    .append(String.join(" | ", previous.recommendations())).append('\n');
        }
        sb.append("\nNote any improvements or regressions.");
        return sb.toString();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static void appendCategories(StringBuilder sb, Map<CategoryKey, CategoryScore> categories) {
        if (categories.isEmpty()) return;
        sb.append("- Category Scores:\n");
        for (Map.Entry<CategoryKey, CategoryScore> entry : categories.entrySet()) {
            CategoryScore cat = entry.getValue();
            sb.append("  - ").append(entry.getKey().key()).append(": ").append(cat.score())
                    .append("/100 (").append(cat.weight()).append("% weight)");
            if (notBlank(cat.notes())) sb.append(" - ").append(cat.notes());
            sb.append('\n');
            for (SubMetric sub : cat.subMetrics()) {
                sb.append("    - ").append(sub.name()).append(": ").append(sub.score())
                        .append("/100 (").append(sub.weight()).append("%)\n");
            }
        }
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append("- ").append(label).append(": ").append(value).append('\n');
    }

    private static String value(Map<String, Object> metrics, String key, String fallback) {
        Object v = metrics.get(key);
        if (v == null) return fallback;
        if (v instanceof Collection<?> c) {
            return c.isEmpty() ? fallback : c.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        String text = String.valueOf(v);
        return text.isBlank() ? fallback : text;
    }

    private static String languageCount(Map<String, Object> metrics) {
        return metrics.get("languages") instanceof List<?> list ? String.valueOf(list.size()) : "N/A";
    }

    private static String percentages(Object value) {
        if (!(value instanceof Map<?, ?> map) || map.isEmpty()) return "N/A";
        return map.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue() + "%")
                .collect(Collectors.joining(", "));
    }

    private static String pairs(Object value) {
        if (!(value instanceof Map<?, ?> map) || map.isEmpty()) return "N/A";
        return map.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
    }

    private static String orDefault(String value, String fallback) {
        return notBlank(value) ? value : fallback;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
