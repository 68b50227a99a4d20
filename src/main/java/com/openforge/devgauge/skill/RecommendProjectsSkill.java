package com.openforge.devgauge.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.devgauge.analysis.AnalysisInstructions;
import com.openforge.devgauge.analysis.AnalysisMode;
import com.openforge.devgauge.analysis.PromptContext;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.llm.ResponseExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Three or four portfolio projects aimed at the user's gaps. Array elements
 * that are not usable projects are dropped; no usable element at all is a
 * failure. At most {@link #MAX_PROJECTS} are kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendProjectsSkill implements Skill {

    public static final String NAME = "recommendProjects";
    public static final int    MAX_PROJECTS = 4;

    private final ModelGateway      gateway;
    private final ResponseExtractor extractor;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Tailored project recommendations that address skill gaps";
    }

    @Override
    public SkillResult execute(SkillContext context) {
        String system = AnalysisInstructions.chat(
                context.metricsDetail(), context.tone(), null, AnalysisMode.PROJECT_RECOMMENDATION);
        String prompt = PromptContext.builder()
                .profileAndMetrics(context.formattedMetrics())
                .instruction("Generate project recommendations based on this user's complete profile and metrics. "
                        + "Suggest 3-4 projects that address their specific gaps. Return ONLY the JSON array.")
                .build()
                .render();

        String text = gateway.stream(system, prompt, context.model(), context.sink());
        JsonNode array = extractor.extractArray(text);
        if (array == null) {
            throw new SkillFailedException(NAME, "Could not parse project recommendations");
        }

        List<ProjectIdea> projects = new ArrayList<>();
        for (JsonNode node : array) {
            ProjectIdea.from(node).ifPresent(projects::add);
        }
        if (projects.isEmpty()) {
            throw new SkillFailedException(NAME, "No usable project in the recommendations");
        }
        if (projects.size() < array.size()) {
            log.debug("[Skill:{}] dropped {} malformed projects", NAME, array.size() - projects.size());
        }
        if (projects.size() > MAX_PROJECTS) {
            log.debug("[Skill:{}] keeping first {} of {} projects", NAME, MAX_PROJECTS, projects.size());
        }
        return SkillResult.ok(NAME, new ProjectRecommendations(
                projects.subList(0, Math.min(MAX_PROJECTS, projects.size()))));
    }
}
