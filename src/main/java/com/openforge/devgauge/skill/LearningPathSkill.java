package com.openforge.devgauge.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.devgauge.analysis.AnalysisInstructions;
import com.openforge.devgauge.analysis.AnalysisMode;
import com.openforge.devgauge.analysis.PromptContext;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.llm.ResponseExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Three-phase roadmap toward the user's career goal. */
@Component
@RequiredArgsConstructor
public class LearningPathSkill implements Skill {

    public static final String NAME = "generateLearningPath";

    private static final String PATH_FORMAT = """
            Create a learning roadmap for this user based on their full profile and metrics.
            Generate a 3-phase learning path. Return ONLY this JSON:
            {
              "targetRole": "<role they're working toward>",
              "estimatedTimeframe": "<e.g., 3-6 months>",
              "phases": [
                {
                  "phase": 1,
                  "duration": "<e.g., 8 weeks>",
                  "focus": "<theme of this phase>",
                  "milestones": [
                    {
                      "title": "<milestone name>",
                      "skills": ["<skill 1>", "<skill 2>"],
                      "deliverable": "<what to build/achieve>",
                      "successCriteria": "<how to know it's done>"
                    }
                  ]
                }
              ],
              "resources": ["<recommended learning resource 1>", "<resource 2>"]
            }""";

    private final ModelGateway      gateway;
    private final ResponseExtractor extractor;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Structured learning roadmap based on goals and current skills";
    }

    @Override
    public SkillResult execute(SkillContext context) {
        String system = AnalysisInstructions.chat(
                context.metricsDetail(), context.tone(), null, AnalysisMode.LEARNING_PATH);
        String prompt = PromptContext.builder()
                .profileAndMetrics(context.formattedMetrics())
                .instruction(PATH_FORMAT)
                .build()
                .render();

        JsonNode json = extractor.extract(gateway.stream(system, prompt, context.model(), context.sink()));
        if (json == null || !json.isObject()) {
            throw new SkillFailedException(NAME, "Could not parse learning path");
        }
        LearningPath path = LearningPath.from(json);
        if (path.phases().isEmpty()) {
            throw new SkillFailedException(NAME, "Learning path has no phases");
        }
        return SkillResult.ok(NAME, path);
    }
}
