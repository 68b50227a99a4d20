package com.openforge.devgauge.skill;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A recommended portfolio project.
 *
 * @param skills        up to three headline skills
 * @param suggestedStack between 1 and {@link #MAX_STACK} technologies
 */
public record ProjectIdea(
        String name,
        List<String> skills,
        String overview,
        String alignment,
        List<StackItem> suggestedStack
) {

    public static final int MAX_STACK = 6;

    public record StackItem(String name, String description) {}

    public ProjectIdea {
        skills         = skills == null ? List.of() : List.copyOf(skills);
        suggestedStack = suggestedStack == null ? List.of() : List.copyOf(suggestedStack);
    }

    /**
     * Reads one element of the model's project array. Skills come from
     * skill1..skill3 or a "skills" array. Empty when the name or the stack is
     * missing; a stack longer than {@link #MAX_STACK} is truncated.
     */
    public static Optional<ProjectIdea> from(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();
        String name = text(node, "name");
        if (name.isEmpty()) return Optional.empty();

        List<String> skills = new ArrayList<>();
        for (String field : List.of("skill1", "skill2", "skill3")) {
            String skill = text(node, field);
            if (!skill.isEmpty()) skills.add(skill);
        }
        if (skills.isEmpty()) {
            for (JsonNode s : node.path("skills")) {
                if (s.isTextual() && !s.asText().isBlank() && skills.size() < 3) skills.add(s.asText().trim());
            }
        }

        List<StackItem> stack = new ArrayList<>();
        for (JsonNode item : node.path("suggestedStack")) {
            if (stack.size() == MAX_STACK) break;
            String tech = item.isTextual() ? item.asText().trim() : text(item, "name");
            if (!tech.isEmpty()) stack.add(new StackItem(tech, text(item, "description")));
        }
        if (stack.isEmpty()) return Optional.empty();

        return Optional.of(new ProjectIdea(name, skills, text(node, "overview"), text(node, "alignment"), stack));
    }

    /** The "# PROJECT CONTEXT" block used by project-scoped chat. */
    public String render() {
        StringBuilder sb = new StringBuilder("# PROJECT CONTEXT\n## Project Details\n");
        sb.append("- Name: ").append(name).append('\n');
        sb.append("- Overview: ").append(overview == null || overview.isBlank() ? "N/A" : overview).append('\n');
        sb.append("- Skills: ").append(String.join(", ", skills)).append('\n');
        sb.append("- Alignment: ").append(alignment == null || alignment.isBlank() ? "N/A" : alignment);
        if (!suggestedStack.isEmpty()) {
            sb.append("\n- Stack: ").append(suggestedStack.stream()
                    .map(s -> s.description() == null || s.description().isBlank()
                            ? s.name() : s.name() + " (" + s.description() + ")")
                    .collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText().trim() : "";
    }
}
