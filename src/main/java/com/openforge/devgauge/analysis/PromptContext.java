package com.openforge.devgauge.analysis;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * User prompt assembled from named sections and rendered once.
 *
 * Sections render in declaration order of {@link Section}, separated by a
 * blank line; empty sections are skipped.
 */
public final class PromptContext {

    public enum Section {
        PROFILE_METRICS,
        PRECOMPUTED_LEVEL,
        PREVIOUS_ANALYSIS,
        PROJECT,
        MEMORY,
        HISTORY,
        USER_MESSAGE,
        INSTRUCTION
    }

    private final Map<Section, String> sections;

    private PromptContext(Map<Section, String> sections) {
        this.sections = sections;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> section(Section section) {
        return Optional.ofNullable(sections.get(section));
    }

    public boolean has(Section section) {
        return sections.containsKey(section);
    }

    public String render() {
        return sections.values().stream().collect(Collectors.joining("\n\n"));
    }

    @Override
    public String toString() {
        return render();
    }

    public static final class Builder {

        private final EnumMap<Section, String> sections = new EnumMap<>(Section.class);

        private Builder() {}

        public Builder section(Section section, String body) {
            if (body != null && !body.isBlank()) {
                sections.put(section, body.strip());
            }
            return this;
        }

        public Builder profileAndMetrics(String body)  { return section(Section.PROFILE_METRICS, body); }
        public Builder precomputedLevel(String body)   { return section(Section.PRECOMPUTED_LEVEL, body); }
        public Builder previousAnalysis(String body)   { return section(Section.PREVIOUS_ANALYSIS, body); }
        public Builder project(String body)            { return section(Section.PROJECT, body); }
        public Builder memory(String body)             { return section(Section.MEMORY, body); }

        public Builder history(String formattedHistory) {
            if (formattedHistory == null || formattedHistory.isBlank()) return this;
            return section(Section.HISTORY, "# CONVERSATION HISTORY\n" + formattedHistory);
        }

        public Builder userMessage(String message) {
            if (message == null || message.isBlank()) return this;
            return section(Section.USER_MESSAGE, "# USER MESSAGE\n" + message);
        }

        public Builder instruction(String body)        { return section(Section.INSTRUCTION, body); }

        public PromptContext build() {
            return new PromptContext(new EnumMap<>(sections));
        }
    }
}
