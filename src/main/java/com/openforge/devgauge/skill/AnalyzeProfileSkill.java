package com.openforge.devgauge.skill;

import com.openforge.devgauge.analysis.AnalysisResult;
import com.openforge.devgauge.analysis.ScoringOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Full two-phase assessment; delegates to {@link ScoringOrchestrator}. */
@Component
@RequiredArgsConstructor
public class AnalyzeProfileSkill implements Skill {

    public static final String NAME = "analyzeProfile";

    private final ScoringOrchestrator orchestrator;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Comprehensive profile analysis with category scores and level";
    }

    @Override
    public SkillResult execute(SkillContext context) {
        AnalysisResult result = orchestrator.analyze(context.toScoringRequest(), context.sink());
        return SkillResult.ok(NAME, result);
    }
}
