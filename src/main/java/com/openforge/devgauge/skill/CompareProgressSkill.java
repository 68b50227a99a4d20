package com.openforge.devgauge.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.devgauge.analysis.AnalysisInstructions;
import com.openforge.devgauge.analysis.AnalysisMode;
import com.openforge.devgauge.analysis.MetricsFormatter;
import com.openforge.devgauge.analysis.PromptContext;
import com.openforge.devgauge.analysis.ScoredCategories;
import com.openforge.devgauge.analysis.ScoringOrchestrator;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.llm.ResponseExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Progress since the previous analysis. The current level is scored first, so
 * the level change is computed rather than guessed; the model only writes the
 * narrative. Without a previous analysis there is nothing to compare.
 */
@Component
@RequiredArgsConstructor
public class CompareProgressSkill implements Skill {

    public static final String NAME = "compareProgress";

    private static final String REPORT_FORMAT = """
            Compare this user's progress against the previous analysis. The current level above is final.
            Return ONLY this JSON:
            {
              "improvements": ["<specific improvement 1>", "<improvement 2>"],
              "regressions": ["<regression 1>"],
              "summary": "<2-3 sentences on overall progress>",
              "nextSteps": ["<updated recommendation 1>", "<recommendation 2>", "<recommendation 3>"]
            }""";

    private final ScoringOrchestrator orchestrator;
    private final ModelGateway        gateway;
    private final ResponseExtractor   extractor;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Compare the current profile to the previous analysis";
    }

    @Override
    public SkillResult execute(SkillContext context) {
        if (context.previous() == null) {
            return SkillResult.noBaseline(NAME);
        }
        ScoredCategories current = orchestrator.score(context.toScoringRequest());

        String system = AnalysisInstructions.chat(
                context.metricsDetail(), context.tone(), null, AnalysisMode.PROGRESS_COMPARISON);
        String prompt = PromptContext.builder()
                .profileAndMetrics(context.formattedMetrics())
                .precomputedLevel(MetricsFormatter.lockedLevel(current))
                .previousAnalysis(MetricsFormatter.previousAnalysis(context.previous()))
                .instruction(REPORT_FORMAT)
                .build()
                .render();

        JsonNode json = extractor.extract(gateway.stream(system, prompt, context.model(), context.sink()));
        if (json == null || !json.isObject()) {
            throw new SkillFailedException(NAME, "Could not parse progress comparison");
        }
        return SkillResult.ok(NAME, ProgressReport.from(
                json, current.level(), current.levelName(), context.previous().level()));
    }
}
