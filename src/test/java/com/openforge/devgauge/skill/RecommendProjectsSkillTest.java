package com.openforge.devgauge.skill;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.llm.ResponseExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecommendProjectsSkillTest {

    private ModelGateway gateway;
    private RecommendProjectsSkill skill;

    @BeforeEach
    void setUp() {
        gateway = mock(ModelGateway.class);
        skill = new RecommendProjectsSkill(gateway, new ResponseExtractor(new ObjectMapper()));
    }

    private static SkillContext context() {
        return SkillContext.builder().metrics(Map.of("totalRepos", 12)).model("m").build();
    }

    @Test
    void shouldParseProjectsAndDropThoseWithoutStack() {
        when(gateway.stream(anyString(), anyString(), any(), any())).thenReturn("""
                Here you go:
                [
                  {"name": "Ledger API", "skill1": "Go", "skill2": "PostgreSQL", "overview": "Double-entry ledger",
                   "alignment": "Fintech goal",
                   "suggestedStack": [{"name": "Go", "description": "service"}, "PostgreSQL", "Docker",
                                      "Kafka", "Grafana", "Terraform", "Redis"]},
                  {"name": "No stack", "skill1": "Java"},
                  {"skills": ["nameless"]},
                ]""");

        List<ProjectIdea> projects = skill.execute(context()).valueAs(ProjectRecommendations.class).projects();

        assertEquals(1, projects.size());
        ProjectIdea ledger = projects.get(0);
        assertEquals("Ledger API", ledger.name());
        assertEquals(List.of("Go", "PostgreSQL"), ledger.skills());
        assertEquals(ProjectIdea.MAX_STACK, ledger.suggestedStack().size());
        assertEquals("service", ledger.suggestedStack().get(0).description());
        assertTrue(ledger.render().startsWith("# PROJECT CONTEXT"));
    }

    @Test
    void shouldKeepAtMostFourProjects() {
        StringBuilder reply = new StringBuilder("[");
        for (int i = 1; i <= 6; i++) {
            if (i > 1) reply.append(',');
            reply.append("{\"name\": \"Project ").append(i).append("\", \"skill1\": \"Java\", ")
                    .append("\"suggestedStack\": [\"Spring Boot\"]}");
        }
        reply.append(']');
        when(gateway.stream(anyString(), anyString(), any(), any())).thenReturn(reply.toString());

        List<ProjectIdea> projects = skill.execute(context()).valueAs(ProjectRecommendations.class).projects();

        assertEquals(RecommendProjectsSkill.MAX_PROJECTS, projects.size());
        assertEquals(List.of("Project 1", "Project 2", "Project 3", "Project 4"),
                projects.stream().map(ProjectIdea::name).toList());
    }

    @Test
    void shouldFailWhenResponseHasNoArray() {
        when(gateway.stream(anyString(), anyString(), any(), any())).thenReturn("I recommend building things.");

        assertThrows(SkillFailedException.class, () -> skill.execute(context()));
    }

    @Test
    void shouldFailWhenNoProjectIsUsable() {
        when(gateway.stream(anyString(), anyString(), any(), any())).thenReturn("[{\"name\": \"Bare\"}]");

        SkillFailedException ex = assertThrows(SkillFailedException.class, () -> skill.execute(context()));

        assertEquals(RecommendProjectsSkill.NAME, ex.skill());
    }
}
