package com.openforge.devgauge.skill;

import java.util.List;

/** Value of a successful {@link RecommendProjectsSkill} run. */
public record ProjectRecommendations(List<ProjectIdea> projects) {

    public ProjectRecommendations {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }
}
